package com.jz.hive.exception;

/** 内容为空/过长等，审核之前就拒绝，不影响台账 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
