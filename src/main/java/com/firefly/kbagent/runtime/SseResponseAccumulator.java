package com.firefly.kbagent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * 将SSE流中的所有 data: 帧拼接为一条完整回复。
 * 上游帧格式不统一，解析是宽松的：
 * - JSON对象取 response 字段，其次 text 字段
 * - JSON字符串直接追加
 * - 非JSON内容原样追加（以数字开头的文本也算非JSON）
 */
public class SseResponseAccumulator {

    private static final String DATA_PREFIX = "data:";

    private final ObjectReader jsonReader;
    private final StringBuilder buffer = new StringBuilder();
    private int frames;

    public SseResponseAccumulator(ObjectMapper objectMapper) {
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public SseResponseAccumulator readAll(Reader reader) throws IOException {
        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        while ((line = lines.readLine()) != null) {
            accept(line);
        }
        return this;
    }

    public void accept(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return;
        }
        String data = line.substring(DATA_PREFIX.length());
        if (data.startsWith(" ")) {
            data = data.substring(1);
        }
        frames++;
        try {
            JsonNode parsed = jsonReader.readTree(data);
            if (parsed == null || parsed.isMissingNode()) {
                buffer.append(data);
            } else if (parsed.isTextual()) {
                buffer.append(parsed.asText());
            } else if (parsed.hasNonNull("response")) {
                buffer.append(parsed.get("response").asText());
            } else if (parsed.hasNonNull("text")) {
                buffer.append(parsed.get("text").asText());
            }
        } catch (JsonProcessingException e) {
            buffer.append(data);
        }
    }

    public int frameCount() {
        return frames;
    }

    public String result() {
        return buffer.toString();
    }
}
