package com.firefly.kbagent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 非流式响应体：JSON文档或原始文本。
 * 取值顺序：response 字段，其次 result 字段，否则整个响应体作为字符串。
 */
public sealed interface RuntimeResponseBody permits RuntimeResponseBody.Json, RuntimeResponseBody.RawText {

    String extractText();

    static RuntimeResponseBody parse(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return new RawText(body == null ? "" : body);
        }
        try {
            JsonNode fields = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(body);
            return new Json(fields, body);
        } catch (JsonProcessingException e) {
            return new RawText(body);
        }
    }

    record Json(JsonNode fields, String raw) implements RuntimeResponseBody {

        @Override
        public String extractText() {
            if (fields.isTextual()) {
                return fields.asText();
            }
            String response = textOf(fields.get("response"));
            if (response != null) {
                return response;
            }
            String result = textOf(fields.get("result"));
            if (result != null) {
                return result;
            }
            return raw;
        }

        private static String textOf(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return null;
            }
            String text = node.isValueNode() ? node.asText() : node.toString();
            return text.isEmpty() ? null : text;
        }
    }

    record RawText(String text) implements RuntimeResponseBody {

        @Override
        public String extractText() {
            return text;
        }
    }
}
