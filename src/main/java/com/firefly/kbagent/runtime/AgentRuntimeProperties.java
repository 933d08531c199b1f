package com.firefly.kbagent.runtime;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.runtime")
public class AgentRuntimeProperties {

    private String runtimeArn;

    /**
     * 为空时使用 https://bedrock-agentcore.{region}.amazonaws.com
     */
    private String endpoint;

    private String sessionHeader = "X-Amzn-Bedrock-AgentCore-Runtime-Session-Id";

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(120);

    private String fallbackResponse =
            "I received your message but was unable to generate a response. Please try again.";
}
