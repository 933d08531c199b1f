package com.firefly.kbagent.signing;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 使用短期凭证对出站请求做SigV4签名，接收方无需共享密钥即可验证调用方。
 * 除凭证解析外没有副作用。
 */
@Slf4j
public class SignedHttpClient {

    static final String CONTENT_SHA256_HEADER = "x-amz-content-sha256";

    private final AwsCredentialsProvider credentialsProvider;
    private final AwsV4HttpSigner signer;
    private final String serviceName;
    private final String region;

    public SignedHttpClient(AwsCredentialsProvider credentialsProvider, String serviceName, String region) {
        this.credentialsProvider = credentialsProvider;
        this.signer = AwsV4HttpSigner.create();
        this.serviceName = serviceName;
        this.region = region;
    }

    public SignedHttpRequest sign(String method, String host, String path,
            Map<String, String> headers, byte[] body) {
        byte[] payload = body == null ? new byte[0] : body;
        AwsCredentials credentials = resolveCredentials();

        SdkHttpRequest.Builder builder = SdkHttpRequest.builder()
                .method(SdkHttpMethod.fromValue(method))
                .protocol("https")
                .host(host)
                .encodedPath(path)
                .putHeader("Host", host)
                .putHeader(CONTENT_SHA256_HEADER, sha256Hex(payload));
        if (headers != null) {
            headers.forEach(builder::putHeader);
        }

        SignedRequest signed = signer.sign(r -> r
                .identity(credentials)
                .request(builder.build())
                .payload(ContentStreamProvider.fromByteArray(payload))
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, serviceName)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region));

        Map<String, String> signedHeaders = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : signed.request().headers().entrySet()) {
            signedHeaders.put(entry.getKey(), String.join(",", entry.getValue()));
        }
        log.debug("已签名请求: {} {}{} (service={}, region={})", method, host, path, serviceName, region);
        return new SignedHttpRequest(method, host, path, signedHeaders, payload);
    }

    private AwsCredentials resolveCredentials() {
        try {
            AwsCredentials credentials = credentialsProvider.resolveCredentials();
            if (credentials == null) {
                throw new CredentialsUnavailableException("Credential provider returned no credentials", null);
            }
            return credentials;
        } catch (CredentialsUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("凭证解析失败: {}", e.getMessage());
            throw new CredentialsUnavailableException("Unable to resolve signing credentials", e);
        }
    }

    static String sha256Hex(byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
