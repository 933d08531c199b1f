package com.firefly.kbagent.index;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 部署生命周期事件（自定义资源的 Create/Update/Delete）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexLifecycleEvent {

    private String requestType;
    private String physicalResourceId;
    private ResourceProperties resourceProperties;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceProperties {
        private String collectionId;
        private String indexName;
        private String resourceId;
        private Integer dimension;
    }
}
