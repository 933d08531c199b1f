package com.firefly.kbagent.util;

/**
 * 日志脱敏：标识符只保留前8位，邮箱只保留前两位和域名
 */
public final class LogMasking {

    private static final int VISIBLE_PREFIX = 8;

    private LogMasking() {
    }

    public static String maskId(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= VISIBLE_PREFIX) {
            return value + "...";
        }
        return value.substring(0, VISIBLE_PREFIX) + "...";
    }

    public static String maskEmail(String email) {
        if (email == null) {
            return null;
        }
        return email.replaceAll("(.{2}).*(@.*)", "$1***$2");
    }
}
