package com.legalrag.agent.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * ResilientLlmClient wraps whatever is returned here.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:ollama}")
    private String provider;

    // OpenAI
    @Value("${llm.openai.api-key:}")   private String openAiKey;
    @Value("${llm.openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${llm.openai.model:gpt-4o-mini}") private String openAiModel;

    // Groq
    @Value("${llm.groq.api-key:}")   private String groqKey;
    @Value("${llm.groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${llm.groq.model:llama-3.3-70b-versatile}") private String groqModel;

    // Ollama
    @Value("${llm.ollama.base-url:http://127.0.0.1:11434}") private String ollamaBaseUrl;
    @Value("${llm.ollama.model:qwen2.5:7b}") private String ollamaModel;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(@Qualifier("ragRestClientBuilder") RestClient.Builder builder) {
        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey);
                yield new GenericLlmClient(props(openAiKey, openAiBaseUrl, openAiModel), "openai", builder.clone());
            }
            case "groq" -> {
                logKey("GROQ", groqKey);
                yield new GenericLlmClient(props(groqKey, groqBaseUrl, groqModel), "groq", builder.clone());
            }
            default -> {
                OllamaLlmClient client = new OllamaLlmClient(props(null, ollamaBaseUrl, ollamaModel), builder.clone());
                if (!client.isModelAvailable()) {
                    log.warn("  Ollama model '{}' not found at {}. Pull it with: ollama pull {}",
                            ollamaModel, ollamaBaseUrl, ollamaModel);
                }
                yield client;
            }
        };
    }

    private LlmProviderProperties props(String apiKey, String baseUrl, String model) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(apiKey); p.setBaseUrl(baseUrl); p.setModel(model);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "groq" -> groqModel;
            default -> ollamaModel;
        };
    }

    private void logKey(String name, String key) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}_API_KEY={your-key}", name, name);
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
