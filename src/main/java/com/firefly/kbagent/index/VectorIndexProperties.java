package com.firefly.kbagent.index;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.vector-index")
public class VectorIndexProperties {

    /**
     * 签名服务名，OpenSearch Serverless 为 aoss
     */
    private String serviceName = "aoss";

    /**
     * 与 amazon.titan-embed-text-v2:0 输出维度一致
     */
    private int dimension = 1024;
    private String methodName = "hnsw";
    private String engine = "faiss";
    private String spaceType = "l2";
    private int efConstruction = 128;
    private int m = 16;
    private int efSearch = 512;
    private int numberOfShards = 1;
    private int numberOfReplicas = 0;
    private String analyzer = "standard";

    private String vectorField = "vector";
    private String textField = "text";
    private String metadataField = "_metadata";

    /**
     * 删除索引后等待传播的时间
     */
    private Duration settleDelay = Duration.ofSeconds(5);

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);
}
