package com.firefly.kbagent.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 运行时调用请求体 {prompt, session_id, user_id}
 */
public record RuntimeInvocation(@JsonProperty("prompt") String prompt,
                                @JsonProperty("session_id") String sessionId,
                                @JsonProperty("user_id") String userId) {
}
