package com.firefly.kbagent.index;

public record ProvisionOutcome(String indexName, String collectionId, ProvisionStatus status) {
}
