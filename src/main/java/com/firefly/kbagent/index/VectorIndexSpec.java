package com.firefly.kbagent.index;

import com.firefly.kbagent.exception.ValidationException;
import org.springframework.util.StringUtils;

/**
 * 期望的向量索引定义。每个 (collectionId, indexName) 只创建一次，
 * 之后每次供应都会用 vectorDimension 与远端实际维度比对。
 */
public record VectorIndexSpec(String collectionId,
                              String indexName,
                              int vectorDimension,
                              String similarityMethod,
                              String analyzer) {

    public VectorIndexSpec {
        if (!StringUtils.hasText(collectionId)) {
            throw new ValidationException("collectionId is required");
        }
        if (!StringUtils.hasText(indexName)) {
            throw new ValidationException("indexName is required");
        }
        if (vectorDimension <= 0) {
            throw new ValidationException("vectorDimension must be a positive integer");
        }
    }
}
