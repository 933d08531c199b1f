package com.firefly.kbagent.exception;

/**
 * 网络异常、超时等可重试的下游故障
 */
public class TransientServiceException extends RuntimeException {

    public TransientServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
