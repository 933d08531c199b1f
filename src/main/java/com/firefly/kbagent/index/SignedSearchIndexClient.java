package com.firefly.kbagent.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.kbagent.exception.TransientServiceException;
import com.firefly.kbagent.signing.SignedHttpClient;
import com.firefly.kbagent.signing.SignedHttpRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * 通过签名HTTP请求操作集合端点上的索引
 */
@Slf4j
public class SignedSearchIndexClient implements SearchIndexClient {

    // HTTP客户端自行管理的请求头，不能手动设置
    private static final Set<String> RESTRICTED_HEADERS = Set.of("host", "content-length", "connection",
            "expect", "upgrade");

    private final SignedHttpClient signedHttpClient;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final IndexMappingFactory mappingFactory;

    public SignedSearchIndexClient(SignedHttpClient signedHttpClient, RestClient restClient,
            ObjectMapper objectMapper, IndexMappingFactory mappingFactory) {
        this.signedHttpClient = signedHttpClient;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.mappingFactory = mappingFactory;
    }

    @Override
    public Optional<ExistingIndex> getIndex(String collectionEndpoint, String indexName) {
        SignedHttpRequest request = signedHttpClient.sign("GET", hostOf(collectionEndpoint), "/" + indexName,
                Map.of(), null);
        String body;
        try {
            body = send(request, spec -> spec.body(String.class));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
        JsonNode definition = parse(body).get(indexName);
        if (definition == null || definition.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new ExistingIndex(mappingFactory.readDimension(definition), definition));
    }

    @Override
    public void createIndex(String collectionEndpoint, String indexName, JsonNode mapping) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(mapping);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialise index mapping", e);
        }
        SignedHttpRequest request = signedHttpClient.sign("PUT", hostOf(collectionEndpoint), "/" + indexName,
                Map.of("Content-Type", "application/json"), payload);
        ResponseEntity<String> response = send(request, spec -> spec.toEntity(String.class));
        log.info("创建索引响应: {} {}", response.getStatusCode().value(), response.getBody());
    }

    @Override
    public void deleteIndex(String collectionEndpoint, String indexName) {
        SignedHttpRequest request = signedHttpClient.sign("DELETE", hostOf(collectionEndpoint), "/" + indexName,
                Map.of(), null);
        try {
            ResponseEntity<String> response = send(request, spec -> spec.toEntity(String.class));
            log.info("删除索引响应: {} {}", response.getStatusCode().value(), response.getBody());
        } catch (HttpClientErrorException.NotFound e) {
            log.info("索引已不存在，无需删除: {}", indexName);
        }
    }

    private <T> T send(SignedHttpRequest request, Function<RestClient.ResponseSpec, T> reader) {
        URI uri = URI.create("https://" + request.host() + request.path());
        RestClient.RequestBodySpec spec = restClient.method(HttpMethod.valueOf(request.method()))
                .uri(uri)
                .headers(headers -> request.headers().forEach((name, value) -> {
                    if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                        headers.set(name, value);
                    }
                }));
        if (request.body().length > 0) {
            spec.body(request.body());
        }
        try {
            return reader.apply(spec.retrieve());
        } catch (ResourceAccessException e) {
            throw new TransientServiceException(request.method() + " " + request.path() + " failed: "
                    + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed index definition: " + body, e);
        }
    }

    static String hostOf(String collectionEndpoint) {
        URI uri = URI.create(collectionEndpoint.contains("://") ? collectionEndpoint : "https://" + collectionEndpoint);
        return uri.getHost();
    }
}
