package com.firefly.kbagent.index;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.opensearchserverless.OpenSearchServerlessClient;
import software.amazon.awssdk.services.opensearchserverless.model.BatchGetCollectionRequest;
import software.amazon.awssdk.services.opensearchserverless.model.BatchGetCollectionResponse;
import software.amazon.awssdk.services.opensearchserverless.model.CollectionDetail;

import java.util.List;
import java.util.Optional;

/**
 * 基于 OpenSearch Serverless BatchGetCollection 的端点解析，集合按名称查询
 */
@Slf4j
@RequiredArgsConstructor
public class OpenSearchServerlessEndpointResolver implements CollectionEndpointResolver {

    private final OpenSearchServerlessClient client;

    @Override
    public Optional<String> resolve(String collectionId) {
        BatchGetCollectionResponse response = client.batchGetCollection(BatchGetCollectionRequest.builder()
                .names(collectionId)
                .build());
        List<CollectionDetail> details = response.collectionDetails();
        if (details == null || details.isEmpty()) {
            log.warn("集合不存在: {}", collectionId);
            return Optional.empty();
        }
        String endpoint = details.get(0).collectionEndpoint();
        log.info("集合访问地址: {}", endpoint);
        return Optional.ofNullable(endpoint);
    }
}
