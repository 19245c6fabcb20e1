package com.jz.hive.chat.dispatch;

/** 整个推送请求失败（网络、推送方 5xx 等），可以有限重试 */
public class PushDeliveryException extends Exception {
    public PushDeliveryException(String message) {
        super(message);
    }

    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
