package com.firefly.kbagent.retry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.classify.Classifier;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.function.Supplier;

/**
 * 有界指数退避执行器。
 * <p>
 * 可重试错误在内部吸收；"已满足"类错误折叠为成功；终止错误立即抛出；
 * 尝试次数耗尽后原样抛出最后一次异常。
 */
@Slf4j
public class RetryController {

    private final String name;
    private final RetryProperties.Policy policy;
    private final ServiceErrorClassifier classifier;
    private final RetryTemplate retryTemplate;

    public RetryController(String name, RetryProperties.Policy policy, ServiceErrorClassifier classifier,
            Sleeper sleeper) {
        this.name = name;
        this.policy = policy;
        this.classifier = classifier;
        this.retryTemplate = buildTemplate(policy, classifier, loggingSleeper(name, sleeper));
    }

    /**
     * 执行一个工作单元
     *
     * @param operation            步骤名称，仅用于日志
     * @param work                 工作单元
     * @param whenAlreadySatisfied 错误被判定为"已满足"时返回的结果
     */
    public <T> T execute(String operation, Supplier<T> work, Supplier<T> whenAlreadySatisfied) {
        RetryCallback<T, RuntimeException> callback = context -> {
            int attempt = context.getRetryCount() + 1;
            log.info("[{}] {} 第{}/{}次尝试", name, operation, attempt, policy.getMaxAttempts());
            try {
                return work.get();
            } catch (RuntimeException e) {
                ErrorClass errorClass = classifier.classify(e);
                if (errorClass == ErrorClass.ALREADY_SATISFIED) {
                    log.info("[{}] {} 目标已存在，视为成功", name, operation);
                    return whenAlreadySatisfied.get();
                }
                if (errorClass == ErrorClass.RETRYABLE) {
                    log.warn("[{}] {} 第{}/{}次尝试失败，将重试: {}", name, operation, attempt,
                            policy.getMaxAttempts(), e.getMessage());
                } else {
                    log.error("[{}] {} 第{}/{}次尝试失败，不可重试: {}", name, operation, attempt,
                            policy.getMaxAttempts(), e.getMessage());
                }
                throw e;
            }
        };
        return retryTemplate.execute(callback);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        return execute(operation, work, () -> null);
    }

    private static Sleeper loggingSleeper(String name, Sleeper delegate) {
        Sleeper target = delegate != null ? delegate : new ThreadWaitSleeper();
        return backOffPeriod -> {
            log.info("[{}] 等待 {} 秒后重试", name, backOffPeriod / 1000.0);
            target.sleep(backOffPeriod);
        };
    }

    private static RetryTemplate buildTemplate(RetryProperties.Policy policy, ServiceErrorClassifier classifier,
            Sleeper sleeper) {
        SimpleRetryPolicy simpleRetryPolicy = new SimpleRetryPolicy(policy.getMaxAttempts());
        NeverRetryPolicy neverRetryPolicy = new NeverRetryPolicy();

        ExceptionClassifierRetryPolicy classifierPolicy = new ExceptionClassifierRetryPolicy();
        classifierPolicy.setExceptionClassifier((Classifier<Throwable, RetryPolicy>) throwable ->
                classifier.classify(throwable) == ErrorClass.RETRYABLE ? simpleRetryPolicy : neverRetryPolicy);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(policy.getInitialInterval().toMillis());
        backOffPolicy.setMultiplier(policy.getMultiplier());
        backOffPolicy.setMaxInterval(policy.effectiveMaxIntervalMs());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(classifierPolicy);
        template.setBackOffPolicy(backOffPolicy);
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }
}
