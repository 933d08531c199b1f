package com.firefly.kbagent.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 构建k-NN索引的完整映射：向量字段、全文字段、以及不参与索引的元数据字段
 */
@Component
@RequiredArgsConstructor
public class IndexMappingFactory {

    private final ObjectMapper objectMapper;
    private final VectorIndexProperties properties;

    public ObjectNode build(VectorIndexSpec spec) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode fields = root.putObject("mappings").putObject("properties");

        ObjectNode vector = fields.putObject(properties.getVectorField());
        vector.put("type", "knn_vector");
        vector.put("dimension", spec.vectorDimension());
        ObjectNode method = vector.putObject("method");
        method.put("name", properties.getMethodName());
        method.put("engine", properties.getEngine());
        method.put("space_type", StringUtils.hasText(spec.similarityMethod())
                ? spec.similarityMethod() : properties.getSpaceType());
        ObjectNode parameters = method.putObject("parameters");
        parameters.put("ef_construction", properties.getEfConstruction());
        parameters.put("m", properties.getM());

        ObjectNode text = fields.putObject(properties.getTextField());
        text.put("type", "text");
        text.put("analyzer", StringUtils.hasText(spec.analyzer()) ? spec.analyzer() : properties.getAnalyzer());

        // 元数据字段必须是 text 且 index:false
        ObjectNode metadata = fields.putObject(properties.getMetadataField());
        metadata.put("type", "text");
        metadata.put("index", false);

        ObjectNode index = root.putObject("settings").putObject("index");
        index.put("number_of_shards", properties.getNumberOfShards());
        index.put("number_of_replicas", properties.getNumberOfReplicas());
        index.put("knn", true);
        index.put("knn.algo_param.ef_search", properties.getEfSearch());
        return root;
    }

    /**
     * 从 GET /{index} 返回的索引定义中读取向量维度
     */
    public Integer readDimension(JsonNode definition) {
        if (definition == null) {
            return null;
        }
        JsonNode dimension = definition.path("mappings").path("properties")
                .path(properties.getVectorField()).path("dimension");
        return dimension.canConvertToInt() ? dimension.asInt() : null;
    }
}
