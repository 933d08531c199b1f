package com.firefly.kbagent.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.HexFormat;

/**
 * 会话ID格式 {subject}-{epochMillis}-{16位十六进制}，随机部分来自 SecureRandom，
 * 仅凭 subject 和时间戳无法推测
 */
@Component
public class SessionIdGenerator {

    private static final int RANDOM_BYTES = 8;

    private final SecureRandom random;
    private final Clock clock;

    public SessionIdGenerator() {
        this(new SecureRandom(), Clock.systemUTC());
    }

    SessionIdGenerator(SecureRandom random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public String newSessionId(String subject) {
        byte[] suffix = new byte[RANDOM_BYTES];
        random.nextBytes(suffix);
        return subject + "-" + clock.millis() + "-" + HexFormat.of().formatHex(suffix);
    }
}
