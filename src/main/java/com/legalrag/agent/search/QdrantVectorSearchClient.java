package com.legalrag.agent.search;

import com.legalrag.agent.config.RagProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Similarity search against a Qdrant collection over its REST API.
 *
 * Points are expected to carry the passage under payload "text"; every other
 * payload field (article_id, article_title, clause_id, chapter, ...) is
 * passed through as metadata. Missing payloads or scores degrade to empty / 0.
 */
@Component
@Slf4j
public class QdrantVectorSearchClient implements VectorSearchClient {

    private final EmbeddingService embeddingService;
    private final RestClient restClient;
    private final String collection;

    public QdrantVectorSearchClient(RagProperties properties,
                                    EmbeddingService embeddingService,
                                    @Qualifier("ragRestClientBuilder") RestClient.Builder builder) {
        RagProperties.VectorStore.Qdrant qdrant = properties.getVectorStore().getQdrant();
        this.embeddingService = embeddingService;
        this.collection = qdrant.getCollection();

        RestClient.Builder clientBuilder = builder.clone()
                .baseUrl(qdrant.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
        if (qdrant.getApiKey() != null && !qdrant.getApiKey().isBlank()) {
            clientBuilder.defaultHeader("api-key", qdrant.getApiKey());
        }
        this.restClient = clientBuilder.build();
    }

    @Override
    public List<ScoredPassage> search(String query, int topK, Double scoreThreshold) {
        float[] vector = embeddingService.embed(query);

        Map<String, Object> body = new HashMap<>();
        body.put("query", vector);
        body.put("limit", topK);
        body.put("with_payload", true);
        if (scoreThreshold != null) {
            body.put("score_threshold", scoreThreshold);
        }

        log.debug("Qdrant query [collection={}, topK={}, threshold={}]", collection, topK, scoreThreshold);

        Map<String, Object> response = restClient.post()
                .uri("/collections/{collection}/points/query", collection)
                .body(body)
                .retrieve()
                .body(new ParameterizedTypeReference<>() {});

        return parsePoints(response);
    }

    @Override
    public boolean isHealthy() {
        try {
            restClient.get()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (Exception e) {
            log.warn("Qdrant collection '{}' not reachable: {}", collection, e.getMessage());
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private List<ScoredPassage> parsePoints(Map<String, Object> response) {
        if (response == null) return List.of();

        Object result = response.get("result");
        List<Map<String, Object>> points;
        if (result instanceof Map<?, ?> resultMap) {
            points = (List<Map<String, Object>>) ((Map<String, Object>) resultMap).getOrDefault("points", List.of());
        } else if (result instanceof List<?> list) {
            points = (List<Map<String, Object>>) list;
        } else {
            return List.of();
        }

        List<ScoredPassage> passages = new ArrayList<>(points.size());
        for (Map<String, Object> point : points) {
            Object rawScore = point.get("score");
            double score = rawScore instanceof Number n ? n.doubleValue() : 0.0;

            Map<String, Object> payload = point.get("payload") instanceof Map<?, ?> p
                    ? (Map<String, Object>) p
                    : Map.of();
            Object text = payload.get("text");

            Map<String, Object> metadata = new LinkedHashMap<>();
            payload.forEach((k, v) -> {
                if (!"text".equals(k) && v != null) metadata.put(k, v);
            });

            passages.add(new ScoredPassage(score, text != null ? text.toString() : "", metadata));
        }
        return passages;
    }
}
