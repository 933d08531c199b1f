package com.firefly.kbagent.service;

import com.firefly.kbagent.dto.ChatRequest;
import com.firefly.kbagent.security.CustomUserPrincipal;
import com.firefly.kbagent.session.Session;

import java.util.List;

public interface ChatService {

    /**
     * 发送一条消息并获取回复
     *
     * @param identity     已认证身份，必须带有 subject
     * @param runtimeToken 下游运行时凭证
     */
    ChatResult chat(ChatRequest request, CustomUserPrincipal identity, String runtimeToken);

    /**
     * 指定会话时返回该会话（需校验归属），否则返回用户最近的会话
     */
    List<Session> history(CustomUserPrincipal identity, String sessionId);
}
