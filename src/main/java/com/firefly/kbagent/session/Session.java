package com.firefly.kbagent.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话记录。首条消息时创建，每轮对话更新，本服务从不删除（保留策略由外部决定）。
 * userId 创建后不可变。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {

    private String sessionId;
    private String userId;
    private String lastMessage;
    private String lastResponse;
    /**
     * epoch 毫秒
     */
    private Long timestamp;
    private String email;
}
