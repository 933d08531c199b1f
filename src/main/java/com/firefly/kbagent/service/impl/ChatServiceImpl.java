package com.firefly.kbagent.service.impl;

import com.firefly.kbagent.dto.ChatRequest;
import com.firefly.kbagent.exception.AuthorizationException;
import com.firefly.kbagent.exception.ValidationException;
import com.firefly.kbagent.retry.RetryController;
import com.firefly.kbagent.runtime.AgentRuntimeClient;
import com.firefly.kbagent.runtime.AgentRuntimeProperties;
import com.firefly.kbagent.runtime.RuntimeInvocation;
import com.firefly.kbagent.security.CustomUserPrincipal;
import com.firefly.kbagent.service.ChatResult;
import com.firefly.kbagent.service.ChatService;
import com.firefly.kbagent.service.InputSanitizer;
import com.firefly.kbagent.service.SessionIdGenerator;
import com.firefly.kbagent.session.Session;
import com.firefly.kbagent.session.SessionProperties;
import com.firefly.kbagent.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

import static com.firefly.kbagent.util.LogMasking.maskId;

/**
 * 对话网关：校验 → 会话解析 → 调用运行时 → 持久化 → 返回。
 * <p>
 * 同一会话的并发请求不加锁，两次写入以后写者为准。
 */
@Service
@Slf4j
public class ChatServiceImpl implements ChatService {

    static final int MAX_MESSAGE_LENGTH = 4000;
    static final String ACCESS_DENIED = "Access denied - session not found or unauthorized";

    private final SessionStore sessionStore;
    private final AgentRuntimeClient runtimeClient;
    private final RetryController retryController;
    private final InputSanitizer sanitizer;
    private final SessionIdGenerator sessionIdGenerator;
    private final AgentRuntimeProperties runtimeProperties;
    private final SessionProperties sessionProperties;

    public ChatServiceImpl(SessionStore sessionStore,
                           AgentRuntimeClient runtimeClient,
                           @Qualifier("runtimeRetryController") RetryController retryController,
                           InputSanitizer sanitizer,
                           SessionIdGenerator sessionIdGenerator,
                           AgentRuntimeProperties runtimeProperties,
                           SessionProperties sessionProperties) {
        this.sessionStore = sessionStore;
        this.runtimeClient = runtimeClient;
        this.retryController = retryController;
        this.sanitizer = sanitizer;
        this.sessionIdGenerator = sessionIdGenerator;
        this.runtimeProperties = runtimeProperties;
        this.sessionProperties = sessionProperties;
    }

    @Override
    public ChatResult chat(ChatRequest request, CustomUserPrincipal identity, String runtimeToken) {
        String userId = requireSubject(identity);
        String prompt = validateMessage(request.getMessage());
        if (!StringUtils.hasText(runtimeToken)) {
            throw new AuthorizationException("Missing X-AgentCore-Token header");
        }

        String sessionId = resolveSession(request.getSessionId(), userId);
        log.info("调用Agent运行时: user={}, session={}, length={}", maskId(userId), maskId(sessionId),
                prompt.length());

        RuntimeInvocation invocation = new RuntimeInvocation(prompt, sessionId, userId);
        String reply;
        try {
            reply = retryController.execute("InvokeRuntime " + maskId(sessionId),
                    () -> runtimeClient.invoke(invocation, runtimeToken));
        } catch (RuntimeException e) {
            log.error("Agent运行时调用失败: step=InvokeRuntime, session={}, user={}, error={}",
                    maskId(sessionId), maskId(userId), e.getMessage());
            throw e;
        }

        // 仅在调用成功后写入，失败的调用不覆盖已有会话
        sessionStore.put(Session.builder()
                .sessionId(sessionId)
                .userId(userId)
                .lastMessage(sanitizer.maskSensitive(prompt))
                .lastResponse(reply)
                .timestamp(System.currentTimeMillis())
                .email(identity.getEmail())
                .build());

        if (!StringUtils.hasText(reply)) {
            log.warn("Agent运行时返回空回复: session={}", maskId(sessionId));
            reply = runtimeProperties.getFallbackResponse();
        }
        return new ChatResult(reply, sessionId);
    }

    @Override
    public List<Session> history(CustomUserPrincipal identity, String sessionId) {
        String userId = requireSubject(identity);
        if (StringUtils.hasText(sessionId)) {
            Session session = sessionStore.findOwned(sessionId, userId)
                    .orElseThrow(() -> {
                        log.warn("会话访问被拒绝: session={}, user={}", maskId(sessionId), maskId(userId));
                        return new AuthorizationException(ACCESS_DENIED);
                    });
            return List.of(session);
        }
        return sessionStore.query(userId, sessionProperties.getHistoryLimit());
    }

    private static String requireSubject(CustomUserPrincipal identity) {
        if (identity == null || !StringUtils.hasText(identity.getUserId())) {
            throw new AuthorizationException("Invalid authentication token - missing user ID");
        }
        return identity.getUserId();
    }

    private String validateMessage(String message) {
        if (message == null) {
            throw new ValidationException("Message is required and must be a string");
        }
        if (message.length() > MAX_MESSAGE_LENGTH) {
            throw new ValidationException("Message too long (max " + MAX_MESSAGE_LENGTH + " characters)");
        }
        String cleaned = sanitizer.stripControlCharacters(message);
        if (cleaned.isEmpty()) {
            throw new ValidationException("Message cannot be empty");
        }
        return cleaned;
    }

    private String resolveSession(String requested, String userId) {
        if (!StringUtils.hasText(requested)) {
            String minted = sessionIdGenerator.newSessionId(userId);
            log.info("创建新会话 {}: user={}", maskId(minted), maskId(userId));
            return minted;
        }
        if (!sessionStore.validateOwnership(requested, userId)) {
            log.warn("会话访问被拒绝: session={}, user={}", maskId(requested), maskId(userId));
            throw new AuthorizationException(ACCESS_DENIED);
        }
        return requested;
    }
}
