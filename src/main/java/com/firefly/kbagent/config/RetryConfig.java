package com.firefly.kbagent.config;

import com.firefly.kbagent.retry.RetryController;
import com.firefly.kbagent.retry.RetryProperties;
import com.firefly.kbagent.retry.ServiceErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * 重试机制配置
 * 用于向量索引供应和Agent运行时调用的容错处理
 */
@Configuration
@Slf4j
public class RetryConfig {

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * 索引供应的重试策略
     * - 5xx/网络错误/超时: 重试
     * - 403: 重试（集合权限仍在传播）
     * - 索引已存在: 视为成功
     * - 其他4xx: 不重试
     */
    @Bean
    public RetryController provisioningRetryController(RetryProperties properties, Sleeper retrySleeper) {
        RetryProperties.Policy policy = properties.getProvisioning();
        log.info("索引供应重试策略: maxAttempts={}, initialInterval={}s, multiplier={}",
                policy.getMaxAttempts(), policy.getInitialInterval().toSeconds(), policy.getMultiplier());
        return new RetryController("provisioning", policy,
                new ServiceErrorClassifier(policy.isRetryForbidden(), policy.isAlreadyExistsIsSuccess()), retrySleeper);
    }

    /**
     * 运行时调用的重试策略
     * - 网络错误/超时: 重试
     * - 5xx/429: 重试
     * - 其他4xx: 不重试
     * - 响应体中的"已存在"不代表成功，按状态码处理
     */
    @Bean
    public RetryController runtimeRetryController(RetryProperties properties, Sleeper retrySleeper) {
        RetryProperties.Policy policy = properties.getRuntime();
        log.info("运行时调用重试策略: maxAttempts={}, initialInterval={}ms, maxInterval={}ms",
                policy.getMaxAttempts(), policy.getInitialInterval().toMillis(), policy.effectiveMaxIntervalMs());
        return new RetryController("runtime", policy,
                new ServiceErrorClassifier(policy.isRetryForbidden(), policy.isAlreadyExistsIsSuccess()), retrySleeper);
    }
}
