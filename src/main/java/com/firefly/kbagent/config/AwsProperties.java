package com.firefly.kbagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.aws")
public class AwsProperties {

    private String region = "us-east-1";
}
