package com.firefly.kbagent.session;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.session")
public class SessionProperties {

    private String keyPrefix = "kbagent:";

    /**
     * 未指定会话时返回的历史会话数量
     */
    private int historyLimit = 20;

    /**
     * 会话记录过期时间，0表示不过期
     */
    private Duration ttl = Duration.ZERO;
}
