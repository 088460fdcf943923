package com.legalrag.agent.websearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search powered by the Brave Search API.
 *
 * Free tier: 2,000 queries/month. Sign up at https://api.search.brave.com/register
 * Brave returns no relevance score; rank is mapped to 0.9, 0.8, ... like SearXNG.
 */
@Component
@ConditionalOnProperty(prefix = "rag.web-search", name = "provider", havingValue = "brave")
@Slf4j
public class BraveWebSearchClient implements WebSearchClient {

    private static final int MAX_COUNT = 20;

    private final RagProperties.WebSearch.Brave settings;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public BraveWebSearchClient(RagProperties properties,
                                ObjectMapper objectMapper,
                                @Qualifier("ragRestClientBuilder") RestClient.Builder builder) {
        this.settings = properties.getWebSearch().getBrave();
        this.objectMapper = objectMapper;
        this.restClient = builder.clone()
                .baseUrl(settings.getBaseUrl())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String name() {
        return "brave";
    }

    @Override
    public List<WebSearchHit> search(String query, int maxResults) {
        String apiKey = settings.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new AgentException("Brave Search API key not configured. Set BRAVE_API_KEY.");
        }

        int count = Math.min(Math.max(maxResults, 1), MAX_COUNT);
        log.info("Brave search: query='{}' count={}", query, count);

        String responseBody = restClient.get()
                .uri(uri -> uri.path("/web/search")
                        .queryParam("q", query)
                        .queryParam("count", count)
                        .queryParam("text_decorations", false)
                        .build())
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .body(String.class);

        return parseResults(responseBody);
    }

    private List<WebSearchHit> parseResults(String responseBody) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        } catch (IOException e) {
            throw new UncheckedIOException("Brave returned malformed JSON", e);
        }

        JsonNode webResults = root.path("web").path("results");
        List<WebSearchHit> hits = new ArrayList<>();
        int position = 0;

        for (JsonNode result : webResults) {
            position++;
            hits.add(WebSearchHit.builder()
                    .type(WebSearchHit.Kind.ARTICLE)
                    .title(result.path("title").asText(""))
                    .url(result.path("url").asText(""))
                    .content(result.path("description").asText(""))
                    .score(Math.max(0.1, 1.0 - position * 0.1))
                    .engine("brave")
                    .build());
        }
        return hits;
    }
}
