package com.jz.hive.chat.dispatch;

/** 通话结算结果：Calling → {Ended, Missed, Cancelled} */
public enum CallOutcome {
    ENDED, MISSED, CANCELLED
}
