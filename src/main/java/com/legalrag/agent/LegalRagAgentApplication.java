package com.legalrag.agent;

import com.legalrag.agent.config.RagProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties(RagProperties.class)
public class LegalRagAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(LegalRagAgentApplication.class, args);
    }
}
