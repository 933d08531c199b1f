package com.firefly.kbagent.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firefly.kbagent.index.CollectionEndpointCache;
import com.firefly.kbagent.index.CollectionEndpointResolver;
import com.firefly.kbagent.index.IndexMappingFactory;
import com.firefly.kbagent.index.OpenSearchServerlessEndpointResolver;
import com.firefly.kbagent.index.SearchIndexClient;
import com.firefly.kbagent.index.SignedSearchIndexClient;
import com.firefly.kbagent.index.VectorIndexProperties;
import com.firefly.kbagent.signing.SignedHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.opensearchserverless.OpenSearchServerlessClient;

import java.net.http.HttpClient;

/**
 * 搜索集合相关的AWS客户端配置
 */
@Configuration
@Slf4j
public class AwsClientConfig {

    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        return DefaultCredentialsProvider.create();
    }

    @Bean(destroyMethod = "close")
    public OpenSearchServerlessClient openSearchServerlessClient(AwsProperties awsProperties,
            AwsCredentialsProvider awsCredentialsProvider) {
        return OpenSearchServerlessClient.builder()
                .region(Region.of(awsProperties.getRegion()))
                .credentialsProvider(awsCredentialsProvider)
                .build();
    }

    @Bean
    public CollectionEndpointResolver collectionEndpointResolver(OpenSearchServerlessClient client) {
        return new OpenSearchServerlessEndpointResolver(client);
    }

    @Bean
    public CollectionEndpointCache collectionEndpointCache(CollectionEndpointResolver resolver) {
        return new CollectionEndpointCache(resolver);
    }

    @Bean
    public SignedHttpClient searchSignedHttpClient(AwsCredentialsProvider awsCredentialsProvider,
            AwsProperties awsProperties, VectorIndexProperties indexProperties) {
        log.info("签名客户端初始化: service={}, region={}", indexProperties.getServiceName(), awsProperties.getRegion());
        return new SignedHttpClient(awsCredentialsProvider, indexProperties.getServiceName(),
                awsProperties.getRegion());
    }

    @Bean
    public SearchIndexClient searchIndexClient(SignedHttpClient searchSignedHttpClient,
            VectorIndexProperties indexProperties, ObjectMapper objectMapper, IndexMappingFactory mappingFactory) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(indexProperties.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(indexProperties.getRequestTimeout());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
        return new SignedSearchIndexClient(searchSignedHttpClient, restClient, objectMapper, mappingFactory);
    }
}
