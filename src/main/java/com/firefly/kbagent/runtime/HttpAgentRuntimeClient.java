package com.firefly.kbagent.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.kbagent.exception.TransientServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import static com.firefly.kbagent.util.LogMasking.maskId;

/**
 * 通过 POST /runtimes/{runtimeId}/invocations 调用Agent运行时。
 * 响应可能是 application/json，也可能是 text/event-stream。
 */
@Slf4j
public class HttpAgentRuntimeClient implements AgentRuntimeClient {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AgentRuntimeProperties properties;
    private final String baseUrl;

    /**
     * @param baseUrl 运行时服务根地址，启动时解析一次，之后不再变化
     */
    public HttpAgentRuntimeClient(RestClient restClient, ObjectMapper objectMapper,
            AgentRuntimeProperties properties, String baseUrl) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String invoke(RuntimeInvocation invocation, String bearerToken) {
        URI uri = invocationUri();
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(invocation);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialise runtime payload", e);
        }

        try {
            return restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                    .header(properties.getSessionHeader(), invocation.sessionId())
                    .body(payload)
                    .exchange((request, response) -> {
                        HttpStatusCode status = response.getStatusCode();
                        if (status.isError()) {
                            byte[] errorBody = StreamUtils.copyToByteArray(response.getBody());
                            log.error("Agent运行时调用失败: status={}, session={}, body={}",
                                    status.value(), maskId(invocation.sessionId()),
                                    new String(errorBody, StandardCharsets.UTF_8));
                            throw statusError(status, response.getStatusText(), response.getHeaders(), errorBody);
                        }
                        MediaType contentType = response.getHeaders().getContentType();
                        return readBody(response.getBody(), contentType);
                    });
        } catch (ResourceAccessException e) {
            throw new TransientServiceException("Runtime invocation failed: " + e.getMessage(), e);
        }
    }

    private String readBody(InputStream body, MediaType contentType) throws IOException {
        if (contentType != null && MediaType.TEXT_EVENT_STREAM.isCompatibleWith(contentType)) {
            SseResponseAccumulator accumulator = new SseResponseAccumulator(objectMapper);
            try (InputStreamReader reader = new InputStreamReader(body, StandardCharsets.UTF_8)) {
                accumulator.readAll(reader);
            } catch (IOException e) {
                throw new TransientServiceException("Runtime stream interrupted after "
                        + accumulator.frameCount() + " frames", e);
            }
            log.debug("SSE流读取完成: frames={}, length={}", accumulator.frameCount(), accumulator.result().length());
            return accumulator.result();
        }
        String text = StreamUtils.copyToString(body, StandardCharsets.UTF_8);
        return RuntimeResponseBody.parse(text, objectMapper).extractText();
    }

    URI invocationUri() {
        if (properties.getRuntimeArn() == null || properties.getRuntimeArn().isBlank()) {
            throw new IllegalStateException("Agent runtime ARN is not configured");
        }
        String runtimeId = URLEncoder.encode(properties.getRuntimeArn(), StandardCharsets.UTF_8)
                .replace("+", "%20");
        return URI.create(baseUrl + "/runtimes/" + runtimeId + "/invocations");
    }

    private static RuntimeException statusError(HttpStatusCode status, String statusText, HttpHeaders headers,
            byte[] body) {
        if (status.is4xxClientError()) {
            return HttpClientErrorException.create(status, statusText, headers, body, StandardCharsets.UTF_8);
        }
        return HttpServerErrorException.create(status, statusText, headers, body, StandardCharsets.UTF_8);
    }
}
