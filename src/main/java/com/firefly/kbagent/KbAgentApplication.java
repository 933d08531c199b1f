package com.firefly.kbagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.firefly.kbagent")
public class KbAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(KbAgentApplication.class, args);
    }

}
