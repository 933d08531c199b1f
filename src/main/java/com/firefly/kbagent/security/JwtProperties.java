package com.firefly.kbagent.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.security.jwt")
public class JwtProperties {

    /**
     * Base64编码的HMAC密钥，用于校验身份令牌签名
     */
    private String secret;

    /**
     * 邮箱所在的声明名
     */
    private String emailClaim = "email";
}
