package com.firefly.kbagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.kbagent.runtime.AgentRuntimeClient;
import com.firefly.kbagent.runtime.AgentRuntimeProperties;
import com.firefly.kbagent.runtime.HttpAgentRuntimeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * Agent运行时调用配置
 */
@Configuration
@Slf4j
public class AgentRuntimeConfig {

    @Bean
    public AgentRuntimeClient agentRuntimeClient(AgentRuntimeProperties properties, AwsProperties awsProperties,
            ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getReadTimeout());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();

        // 进程启动时确定一次，运行期间不刷新
        String baseUrl = StringUtils.hasText(properties.getEndpoint())
                ? properties.getEndpoint()
                : "https://bedrock-agentcore." + awsProperties.getRegion() + ".amazonaws.com";
        if (!StringUtils.hasText(properties.getRuntimeArn())) {
            log.warn("未配置 app.runtime.runtime-arn，对话请求将失败");
        }
        log.info("Agent运行时客户端初始化: baseUrl={}, readTimeout={}s", baseUrl,
                properties.getReadTimeout().toSeconds());
        return new HttpAgentRuntimeClient(restClient, objectMapper, properties, baseUrl);
    }
}
