package com.jz.hive.chat.dispatch;

/** chat_message.call_status 的取值 */
public final class CallStatus {
    private CallStatus() {}

    public static final String CALLING = "calling";
    public static final String ENDED = "ended";
    public static final String MISSED = "missed";
}
