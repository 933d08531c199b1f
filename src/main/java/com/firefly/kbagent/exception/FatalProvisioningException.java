package com.firefly.kbagent.exception;

import com.firefly.kbagent.index.ProvisionStep;
import lombok.Getter;
import org.springframework.web.client.HttpStatusCodeException;

/**
 * 索引供应失败：重试耗尽，或写入后回读确认资源不存在。
 * 携带失败的步骤以及最后一次HTTP状态码和响应体（如有）。
 */
@Getter
public class FatalProvisioningException extends RuntimeException {

    private final ProvisionStep step;
    private final Integer lastStatus;
    private final String lastBody;

    public FatalProvisioningException(ProvisionStep step, String message) {
        this(step, message, null, null, null);
    }

    public FatalProvisioningException(ProvisionStep step, String message, Integer lastStatus, String lastBody,
            Throwable cause) {
        super(buildMessage(step, message, lastStatus, lastBody), cause);
        this.step = step;
        this.lastStatus = lastStatus;
        this.lastBody = lastBody;
    }

    /**
     * 将某一步骤的最终异常汇总为单个错误
     */
    public static FatalProvisioningException of(ProvisionStep step, String indexName, Throwable cause) {
        if (cause instanceof HttpStatusCodeException http) {
            return new FatalProvisioningException(step, "index " + indexName + " failed",
                    http.getStatusCode().value(), http.getResponseBodyAsString(), cause);
        }
        return new FatalProvisioningException(step, "index " + indexName + " failed: " + cause.getMessage(),
                null, null, cause);
    }

    private static String buildMessage(ProvisionStep step, String message, Integer status, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(step.label()).append("] ").append(message);
        if (status != null) {
            sb.append(" (HTTP ").append(status);
            if (body != null && !body.isBlank()) {
                sb.append(": ").append(body);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
