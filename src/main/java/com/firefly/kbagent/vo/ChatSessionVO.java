package com.firefly.kbagent.vo;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ChatSessionVO {

    private String sessionId;
    private String lastMessage;
    private String lastResponse;
    private Long timestamp;
}
