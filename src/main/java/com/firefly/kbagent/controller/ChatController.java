package com.firefly.kbagent.controller;

import com.firefly.kbagent.dto.ChatRequest;
import com.firefly.kbagent.exception.ValidationException;
import com.firefly.kbagent.security.CustomUserPrincipal;
import com.firefly.kbagent.service.ChatResult;
import com.firefly.kbagent.service.ChatService;
import com.firefly.kbagent.session.Session;
import com.firefly.kbagent.vo.ApiResponse;
import com.firefly.kbagent.vo.ChatResponseVO;
import com.firefly.kbagent.vo.ChatSessionVO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String RUNTIME_TOKEN_HEADER = "X-AgentCore-Token";

    private final ChatService chatService;

    @PostMapping
    public ResponseEntity<ApiResponse<ChatResponseVO>> chat(
            @RequestBody(required = false) ChatRequest request,
            @RequestHeader(value = RUNTIME_TOKEN_HEADER, required = false) String runtimeToken,
            @AuthenticationPrincipal CustomUserPrincipal principal) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        ChatResult result = chatService.chat(request, principal, runtimeToken);
        ChatResponseVO data = ChatResponseVO.builder()
                .response(result.responseText())
                .conversationId(result.sessionId())
                .sessionId(result.sessionId())
                .build();
        return ResponseEntity.ok(ApiResponse.success("OK", data));
    }

    @GetMapping("/history")
    public ResponseEntity<ApiResponse<Map<String, Object>>> history(
            @RequestParam(required = false) String sessionId,
            @AuthenticationPrincipal CustomUserPrincipal principal) {
        List<ChatSessionVO> sessions = chatService.history(principal, sessionId).stream()
                .map(this::toSessionVO)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success("OK", Map.of("sessions", sessions)));
    }

    private ChatSessionVO toSessionVO(Session session) {
        return ChatSessionVO.builder()
                .sessionId(session.getSessionId())
                .lastMessage(session.getLastMessage())
                .lastResponse(session.getLastResponse())
                .timestamp(session.getTimestamp())
                .build();
    }
}
