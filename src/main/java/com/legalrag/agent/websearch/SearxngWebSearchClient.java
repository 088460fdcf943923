package com.legalrag.agent.websearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.config.RagProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search through a self-hosted SearXNG instance (JSON output format
 * must be enabled in its settings.yml).
 *
 * Queries are sent as form POSTs since many instances block GET /search
 * from non-browser clients. SearXNG does not score results, so the score is
 * derived from rank: 0.9, 0.8, ... floored at 0.1. Instant answers, when the
 * instance returns any, come back as {@link WebSearchHit.Kind#ANSWER} hits.
 */
@Component
@ConditionalOnProperty(prefix = "rag.web-search", name = "provider", havingValue = "searxng", matchIfMissing = true)
@Slf4j
public class SearxngWebSearchClient implements WebSearchClient {

    private final RagProperties.WebSearch.Searxng settings;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public SearxngWebSearchClient(RagProperties properties,
                                  ObjectMapper objectMapper,
                                  @Qualifier("ragRestClientBuilder") RestClient.Builder builder) {
        this.settings = properties.getWebSearch().getSearxng();
        this.objectMapper = objectMapper;
        this.restClient = builder.clone()
                .baseUrl(stripTrailingSlash(settings.getBaseUrl()))
                .defaultHeader("User-Agent", "Legal-RAG-Agent/1.0")
                .defaultHeader("Accept", "application/json")
                .build();
    }

    @Override
    public String name() {
        return "searxng";
    }

    @Override
    public List<WebSearchHit> search(String query, int maxResults) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("q", query);
        form.add("format", "json");
        form.add("language", settings.getLanguage());
        form.add("categories", settings.getCategories());

        log.info("SearXNG search: query='{}' maxResults={}", query, maxResults);

        String responseBody = restClient.post()
                .uri("/search")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(String.class);

        return parseResults(responseBody, maxResults);
    }

    private List<WebSearchHit> parseResults(String responseBody, int maxResults) {
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody == null ? "{}" : responseBody);
        } catch (IOException e) {
            throw new UncheckedIOException("SearXNG returned malformed JSON", e);
        }

        List<WebSearchHit> hits = new ArrayList<>();

        for (JsonNode answer : root.path("answers")) {
            String content = answer.isTextual() ? answer.asText() : answer.path("answer").asText("");
            if (!content.isBlank()) {
                hits.add(WebSearchHit.builder()
                        .type(WebSearchHit.Kind.ANSWER)
                        .content(content)
                        .engine("searxng")
                        .build());
            }
        }

        int position = 0;
        for (JsonNode result : root.path("results")) {
            if (position >= maxResults) break;
            position++;
            hits.add(WebSearchHit.builder()
                    .type(WebSearchHit.Kind.ARTICLE)
                    .title(result.path("title").asText(""))
                    .url(result.path("url").asText(""))
                    .content(result.path("content").asText(""))
                    .score(Math.max(0.1, 1.0 - position * 0.1))
                    .engine(result.path("engine").asText("unknown"))
                    .build());
        }

        log.info("SearXNG returned {} hits", hits.size());
        return hits;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
