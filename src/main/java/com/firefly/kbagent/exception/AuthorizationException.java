package com.firefly.kbagent.exception;

/**
 * 身份或会话归属校验失败，映射为403，不重试。
 * 消息文本不得透露资源是否存在。
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
