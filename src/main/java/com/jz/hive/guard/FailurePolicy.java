package com.jz.hive.guard;

/** 审核依赖的存储挂掉时怎么处理 */
public enum FailurePolicy {
    /** 放行消息，只记录错误 */
    FAIL_OPEN,
    /** 拒绝消息 */
    FAIL_CLOSED
}
