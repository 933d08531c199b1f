package com.firefly.kbagent.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * 输入清洗：去除控制字符；持久化前额外屏蔽常见个人信息
 */
@Component
public class InputSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\u0000-\\u001F\\u007F]");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern CARD = Pattern.compile("\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b");

    public String stripControlCharacters(String input) {
        if (input == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(input).replaceAll("").trim();
    }

    public String maskSensitive(String input) {
        String cleaned = stripControlCharacters(input);
        cleaned = SSN.matcher(cleaned).replaceAll("[SSN]");
        cleaned = EMAIL.matcher(cleaned).replaceAll("[EMAIL]");
        cleaned = CARD.matcher(cleaned).replaceAll("[CARD]");
        return cleaned.trim();
    }
}
