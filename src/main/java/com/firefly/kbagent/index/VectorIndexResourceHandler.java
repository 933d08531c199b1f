package com.firefly.kbagent.index;

import com.firefly.kbagent.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将部署生命周期事件转换为索引供应调用。
 * Delete 不删除索引，只返回相同的物理ID，保证回滚和栈删除时ID稳定。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorIndexResourceHandler {

    private final VectorIndexProvisioner provisioner;
    private final VectorIndexProperties properties;

    public IndexLifecycleResult handle(IndexLifecycleEvent event) {
        if (event == null || event.getResourceProperties() == null) {
            throw new ValidationException("ResourceProperties are required");
        }
        IndexLifecycleEvent.ResourceProperties props = event.getResourceProperties();
        String requestType = event.getRequestType();
        String physicalId = resolvePhysicalId(event);
        log.info("收到索引生命周期事件: type={}, collection={}, index={}, physicalId={}",
                requestType, props.getCollectionId(), props.getIndexName(), physicalId);

        if ("Delete".equals(requestType)) {
            log.info("删除请求，返回原物理ID，索引保持不变");
            return new IndexLifecycleResult(physicalId, Map.of());
        }
        if (!"Create".equals(requestType) && !"Update".equals(requestType)) {
            throw new ValidationException("Unsupported request type: " + requestType);
        }

        int dimension = props.getDimension() != null ? props.getDimension() : properties.getDimension();
        VectorIndexSpec spec = new VectorIndexSpec(props.getCollectionId(), props.getIndexName(), dimension,
                properties.getSpaceType(), properties.getAnalyzer());
        ProvisionOutcome outcome = provisioner.provision(spec);

        Map<String, String> data = new LinkedHashMap<>();
        data.put("IndexName", outcome.indexName());
        data.put("CollectionId", outcome.collectionId());
        data.put("Status", outcome.status().label());
        return new IndexLifecycleResult(physicalId, data);
    }

    static String resolvePhysicalId(IndexLifecycleEvent event) {
        if (StringUtils.hasText(event.getPhysicalResourceId())) {
            return event.getPhysicalResourceId();
        }
        IndexLifecycleEvent.ResourceProperties props = event.getResourceProperties();
        if (StringUtils.hasText(props.getResourceId())) {
            return props.getResourceId();
        }
        return "VectorIndex-" + props.getCollectionId() + "-" + props.getIndexName();
    }
}
