package com.firefly.kbagent.retry;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.retry")
public class RetryProperties {

    /**
     * 索引供应：Serverless集合创建后需要数十秒才能访问，初始间隔按资源激活时间而不是网络抖动设定
     */
    private Policy provisioning = new Policy(8, Duration.ofSeconds(15), 2.0, null, true, true);

    /**
     * Agent运行时调用
     */
    private Policy runtime = new Policy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), false, false);

    @Data
    public static class Policy {

        private int maxAttempts;
        private Duration initialInterval;
        private double multiplier;
        /**
         * 为空时不封顶，即第n次重试前等待 initialInterval * multiplier^(n-1)
         */
        private Duration maxInterval;
        private boolean retryForbidden;
        /**
         * 调用失败但响应体提示"已存在"时是否按成功处理
         */
        private boolean alreadyExistsIsSuccess;

        public Policy() {
        }

        public Policy(int maxAttempts, Duration initialInterval, double multiplier, Duration maxInterval,
                boolean retryForbidden, boolean alreadyExistsIsSuccess) {
            this.maxAttempts = maxAttempts;
            this.initialInterval = initialInterval;
            this.multiplier = multiplier;
            this.maxInterval = maxInterval;
            this.retryForbidden = retryForbidden;
            this.alreadyExistsIsSuccess = alreadyExistsIsSuccess;
        }

        public long effectiveMaxIntervalMs() {
            if (maxInterval != null) {
                return maxInterval.toMillis();
            }
            double uncapped = initialInterval.toMillis() * Math.pow(multiplier, Math.max(0, maxAttempts - 2));
            return (long) Math.min(uncapped, Long.MAX_VALUE);
        }
    }
}
