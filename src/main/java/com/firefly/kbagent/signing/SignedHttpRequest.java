package com.firefly.kbagent.signing;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 已签名的出站请求。请求头大小写不敏感。
 */
public record SignedHttpRequest(String method, String host, String path, Map<String, String> headers, byte[] body) {

    public SignedHttpRequest {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        headers = Collections.unmodifiableMap(copy);
        body = body == null ? new byte[0] : body;
    }

    public String header(String name) {
        return headers.get(name);
    }
}
