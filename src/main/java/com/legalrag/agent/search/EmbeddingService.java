package com.legalrag.agent.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Embeds search queries through an OpenAI-compatible /embeddings endpoint
 * (OpenAI itself, or Ollama's /v1 API). The model must match the one used
 * when the corpus was indexed.
 *
 * Refined queries repeat often across runs, so vectors are cached in Redis
 * under embed:{model}:{sha256(text)}. Cache failures only cost a re-fetch.
 */
@Service
@Slf4j
public class EmbeddingService {

    private static final String CACHE_PREFIX = "embed:";

    private final RestClient restClient;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration cacheTtl;

    public EmbeddingService(RagProperties properties,
                            StringRedisTemplate redisTemplate,
                            ObjectMapper objectMapper,
                            @Qualifier("ragRestClientBuilder") RestClient.Builder builder) {
        RagProperties.Embedding embedding = properties.getEmbedding();
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.model = embedding.getModel();
        this.cacheTtl = Duration.ofDays(embedding.getCacheTtlDays());

        RestClient.Builder clientBuilder = builder.clone()
                .baseUrl(embedding.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (embedding.getApiKey() != null && !embedding.getApiKey().isBlank()) {
            clientBuilder.defaultHeader("Authorization", "Bearer " + embedding.getApiKey());
        }
        this.restClient = clientBuilder.build();
    }

    public float[] embed(String text) {
        String cacheKey = CACHE_PREFIX + model + ":" + hashText(text);

        try {
            String cached = redisTemplate.opsForValue().get(cacheKey);
            if (cached != null) {
                log.debug("Embedding cache hit for text length={}", text.length());
                return objectMapper.readValue(cached, float[].class);
            }
        } catch (Exception e) {
            log.warn("Embedding cache read failed, re-fetching: {}", e.getMessage());
        }

        float[] embedding = fetchEmbedding(text);

        try {
            redisTemplate.opsForValue().set(cacheKey, objectMapper.writeValueAsString(embedding), cacheTtl);
        } catch (Exception e) {
            log.warn("Failed to cache embedding: {}", e.getMessage());
        }

        return embedding;
    }

    @SuppressWarnings("unchecked")
    private float[] fetchEmbedding(String text) {
        log.debug("Fetching embedding [model={}, textLength={}]", model, text.length());

        Map<String, Object> response = restClient.post()
                .uri("/embeddings")
                .body(Map.of("model", model, "input", text))
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        List<Map<String, Object>> data = response != null
                ? (List<Map<String, Object>>) response.get("data")
                : null;
        if (data == null || data.isEmpty()) {
            throw new AgentException("Embedding endpoint returned no data for model " + model);
        }
        List<Number> raw = (List<Number>) data.get(0).get("embedding");

        float[] result = new float[raw.size()];
        for (int i = 0; i < raw.size(); i++) {
            result[i] = raw.get(i).floatValue();
        }
        return result;
    }

    private String hashText(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
