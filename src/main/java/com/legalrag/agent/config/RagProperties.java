package com.legalrag.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly-typed configuration for the retrieval agent and its collaborators.
 * Bound from application.yml under the "rag" prefix.
 *
 * The {@link Agent} values are only defaults: every query resolves its own
 * immutable QueryOptions from them, so nothing here is mutated per request.
 */
@ConfigurationProperties(prefix = "rag")
@Data
public class RagProperties {

    private Agent agent = new Agent();
    private VectorStore vectorStore = new VectorStore();
    private Embedding embedding = new Embedding();
    private WebSearch webSearch = new WebSearch();
    private Generation generation = new Generation();
    private Http http = new Http();

    /** Template name → template text, overriding the built-in prompts */
    private Map<String, String> prompts = new HashMap<>();

    @Data
    public static class Agent {
        private int maxIterations = 3;
        private int topK = 3;
        private boolean enableWebSearch = true;
        /** Route after a web search on internal + web results instead of internal only */
        private boolean routeOnCombinedResults = false;
        /** Consecutive failed retrievals after which the decision step stops the loop */
        private int maxConsecutiveRetrievalFailures = 2;
    }

    @Data
    public static class VectorStore {
        private Qdrant qdrant = new Qdrant();
        /** Minimum similarity score; null means no threshold */
        private Double scoreThreshold;

        @Data
        public static class Qdrant {
            private String baseUrl = "http://localhost:6333";
            private String collection = "legal_documents";
            private String apiKey = "";
        }
    }

    @Data
    public static class Embedding {
        private String baseUrl = "http://localhost:11434/v1";
        private String apiKey = "";
        private String model = "nomic-embed-text";
        private long cacheTtlDays = 7;
    }

    @Data
    public static class WebSearch {
        /** searxng | brave | none */
        private String provider = "searxng";
        private String domainQualifier = "Vietnam Labor Code";
        /** Comma-separated site allowlist appended as (site:a OR site:b); empty means unrestricted */
        private String preferredDomains = "";
        private Searxng searxng = new Searxng();
        private Brave brave = new Brave();

        public List<String> getPreferredDomainList() {
            if (preferredDomains == null || preferredDomains.isBlank()) return List.of();
            return Arrays.stream(preferredDomains.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }

        @Data
        public static class Searxng {
            private String baseUrl = "http://localhost:8888";
            private String language = "en";
            private String categories = "general";
        }

        @Data
        public static class Brave {
            private String apiKey = "";
            private String baseUrl = "https://api.search.brave.com/res/v1";
        }
    }

    @Data
    public static class Generation {
        private double decisionTemperature = 0.3;
        private int decisionMaxTokens = 20;
        private double refineTemperature = 0.3;
        private int refineMaxTokens = 50;
        private double answerTemperature = 0.1;
        private int answerMaxTokens = 2000;
    }

    @Data
    public static class Http {
        private int connectTimeoutMs = 5000;
        private int responseTimeoutMs = 120000;
        private int maxConnections = 20;
    }
}
