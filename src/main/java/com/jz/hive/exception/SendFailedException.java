package com.jz.hive.exception;

/**
 * 消息没发出去（扇出批次失败或存储超时）。批次整体回滚，不会留下孤儿消息，客户端需要重发。
 */
public class SendFailedException extends RuntimeException {
    public SendFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
