package com.firefly.kbagent.signing;

/**
 * 无法解析临时凭证。只能由调用方刷新身份后恢复，签名层不重试。
 */
public class CredentialsUnavailableException extends RuntimeException {

    public CredentialsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
