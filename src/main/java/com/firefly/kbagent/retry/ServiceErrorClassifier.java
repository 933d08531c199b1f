package com.firefly.kbagent.retry;

import com.firefly.kbagent.exception.TransientServiceException;
import com.firefly.kbagent.signing.CredentialsUnavailableException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * 可重试/终止错误的唯一分类入口。
 * 目前依赖错误响应体中的子串匹配；服务端提供结构化错误码后只需替换本类。
 */
public class ServiceErrorClassifier {

    private static final List<String> ALREADY_EXISTS_MARKERS = List.of(
            "resource_already_exists",
            "already_exists",
            "already exists");

    private final boolean forbiddenIsTransient;
    private final boolean alreadyExistsIsSuccess;

    /**
     * @param forbiddenIsTransient   403是否视为权限传播延迟而重试（新建的Serverless集合需要）
     * @param alreadyExistsIsSuccess "已存在"响应是否视为已满足；只有幂等创建类操作才应开启
     */
    public ServiceErrorClassifier(boolean forbiddenIsTransient, boolean alreadyExistsIsSuccess) {
        this.forbiddenIsTransient = forbiddenIsTransient;
        this.alreadyExistsIsSuccess = alreadyExistsIsSuccess;
    }

    public ErrorClass classify(Throwable error) {
        if (error == null) {
            return ErrorClass.FATAL;
        }
        if (error instanceof CredentialsUnavailableException) {
            return ErrorClass.FATAL;
        }
        if (error instanceof HttpStatusCodeException http) {
            if (alreadyExistsIsSuccess && isAlreadyExists(http.getResponseBodyAsString())) {
                return ErrorClass.ALREADY_SATISFIED;
            }
            int status = http.getStatusCode().value();
            if (status >= 500 || status == 429) {
                return ErrorClass.RETRYABLE;
            }
            if (status == 403 && forbiddenIsTransient) {
                return ErrorClass.RETRYABLE;
            }
            return ErrorClass.FATAL;
        }
        if (error instanceof TransientServiceException
                || error instanceof ResourceAccessException
                || error instanceof SocketTimeoutException) {
            return ErrorClass.RETRYABLE;
        }
        return ErrorClass.FATAL;
    }

    static boolean isAlreadyExists(String body) {
        if (body == null || body.isEmpty()) {
            return false;
        }
        String normalized = body.toLowerCase(Locale.ROOT);
        return ALREADY_EXISTS_MARKERS.stream().anyMatch(normalized::contains);
    }
}
