package com.firefly.kbagent.service;

/**
 * @param sessionId 调用方提供（已校验归属）或新生成的会话ID，总是非空
 */
public record ChatResult(String responseText, String sessionId) {
}
