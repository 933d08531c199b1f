package com.firefly.kbagent.vo;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ChatResponseVO {

    private String response;
    private String conversationId;
    private String sessionId;
}
