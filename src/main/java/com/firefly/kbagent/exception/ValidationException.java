package com.firefly.kbagent.exception;

/**
 * 调用方输入不合法，映射为400，不重试
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
