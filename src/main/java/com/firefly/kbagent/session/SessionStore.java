package com.firefly.kbagent.session;

import java.util.List;
import java.util.Optional;

public interface SessionStore {

    /**
     * 会话不存在与会话属于他人两种情况都返回false，调用方无法区分
     */
    boolean validateOwnership(String sessionId, String userId);

    /**
     * 按 sessionId 读取并按 userId 过滤，不属于该用户时为空
     */
    Optional<Session> findOwned(String sessionId, String userId);

    /**
     * 以 sessionId 为键的upsert
     */
    void put(Session session);

    /**
     * 用户最近的N个会话，按时间倒序
     */
    List<Session> query(String userId, int limit);
}
