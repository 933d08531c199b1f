package com.firefly.kbagent.index;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * 针对集合端点上单个索引的增删查。非2xx响应以 HttpStatusCodeException 抛出，
 * 网络异常和超时以 TransientServiceException 抛出。
 */
public interface SearchIndexClient {

    /**
     * @return 索引不存在(404)时为空
     */
    Optional<ExistingIndex> getIndex(String collectionEndpoint, String indexName);

    void createIndex(String collectionEndpoint, String indexName, JsonNode mapping);

    void deleteIndex(String collectionEndpoint, String indexName);
}
