package com.firefly.kbagent.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firefly.kbagent.signing.SignedHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SignedSearchIndexClientTest {

    private static final String ENDPOINT = "https://abc123.us-east-1.aoss.amazonaws.com";
    private static final String INDEX_URL = ENDPOINT + "/kb-index";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IndexMappingFactory mappingFactory = new IndexMappingFactory(objectMapper, new VectorIndexProperties());

    private MockRestServiceServer server;
    private SignedSearchIndexClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        SignedHttpClient signer = new SignedHttpClient(
                StaticCredentialsProvider.create(AwsBasicCredentials.create("AKIDEXAMPLE", "secret")),
                "aoss", "us-east-1");
        client = new SignedSearchIndexClient(signer, builder.build(), objectMapper, mappingFactory);
    }

    @Test
    void getIndexShouldReadDimensionFromDefinition() {
        server.expect(requestTo(INDEX_URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(request -> assertThat(request.getHeaders().getFirst("Authorization"))
                        .startsWith("AWS4-HMAC-SHA256"))
                .andRespond(withSuccess("{\"kb-index\":{\"mappings\":{\"properties\":"
                        + "{\"vector\":{\"type\":\"knn_vector\",\"dimension\":512}}}}}", MediaType.APPLICATION_JSON));

        Optional<ExistingIndex> existing = client.getIndex(ENDPOINT, "kb-index");

        assertThat(existing).isPresent();
        assertThat(existing.get().dimension()).isEqualTo(512);
        server.verify();
    }

    @Test
    void getIndexShouldTreatNotFoundAsAbsent() {
        server.expect(requestTo(INDEX_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"type\":\"index_not_found_exception\"}}"));

        assertThat(client.getIndex(ENDPOINT, "kb-index")).isEmpty();
    }

    @Test
    void getIndexShouldPropagateOtherErrors() {
        server.expect(requestTo(INDEX_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.getIndex(ENDPOINT, "kb-index"))
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void createIndexShouldPutSignedMapping() {
        ObjectNode mapping = mappingFactory.build(new VectorIndexSpec("kb", "kb-index", 1024, null, null));
        server.expect(requestTo(INDEX_URL))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(header("Content-Type", "application/json"))
                .andExpect(request -> assertThat(request.getHeaders().getFirst("x-amz-content-sha256")).hasSize(64))
                .andExpect(jsonPath("$.mappings.properties.vector.dimension").value(1024))
                .andRespond(withSuccess("{\"acknowledged\":true}", MediaType.APPLICATION_JSON));

        client.createIndex(ENDPOINT, "kb-index", mapping);

        server.verify();
    }

    @Test
    void createIndexShouldSurfaceAlreadyExistsBody() {
        ObjectNode mapping = mappingFactory.build(new VectorIndexSpec("kb", "kb-index", 1024, null, null));
        server.expect(requestTo(INDEX_URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"type\":\"resource_already_exists_exception\"}}"));

        assertThatThrownBy(() -> client.createIndex(ENDPOINT, "kb-index", mapping))
                .isInstanceOfSatisfying(HttpClientErrorException.class, e ->
                        assertThat(e.getResponseBodyAsString()).contains("resource_already_exists"));
    }

    @Test
    void deleteIndexShouldIgnoreNotFound() {
        server.expect(requestTo(INDEX_URL))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        client.deleteIndex(ENDPOINT, "kb-index");

        server.verify();
    }

    @Test
    void hostOfShouldAcceptBareHostnames() {
        assertThat(SignedSearchIndexClient.hostOf(ENDPOINT)).isEqualTo("abc123.us-east-1.aoss.amazonaws.com");
        assertThat(SignedSearchIndexClient.hostOf("abc123.us-east-1.aoss.amazonaws.com"))
                .isEqualTo("abc123.us-east-1.aoss.amazonaws.com");
    }
}
