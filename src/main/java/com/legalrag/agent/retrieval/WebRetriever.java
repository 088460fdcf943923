package com.legalrag.agent.retrieval;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.websearch.WebSearchClient;
import com.legalrag.agent.websearch.WebSearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one web search for the working query, prefixed with the legal domain
 * qualifier and optionally restricted to preferred sites.
 *
 * With no provider configured (rag.web-search.provider=none) this is a no-op
 * and {@link #isAvailable()} is false, so the orchestrator disables web
 * search for every query.
 */
@Component
@Slf4j
public class WebRetriever {

    private final Optional<WebSearchClient> webSearchClient;
    private final String domainQualifier;
    private final List<String> preferredDomains;

    public WebRetriever(Optional<WebSearchClient> webSearchClient, RagProperties properties) {
        this.webSearchClient = webSearchClient;
        this.domainQualifier = properties.getWebSearch().getDomainQualifier();
        this.preferredDomains = properties.getWebSearch().getPreferredDomainList();
        webSearchClient.ifPresentOrElse(
                c -> log.info("Web search provider: {}", c.name()),
                () -> log.info("No web search provider configured"));
    }

    public boolean isAvailable() {
        return webSearchClient.isPresent();
    }

    public void retrieve(AgentState state) {
        if (!state.isWebSearchEnabled() || webSearchClient.isEmpty()) {
            log.warn("Web search requested but not available for this query, skipping");
            return;
        }

        String query = buildQuery(state.getQuery());
        log.info("[Web search] query='{}'", query);

        List<WebSearchHit> hits;
        try {
            hits = webSearchClient.get().search(query, state.getOptions().topK());
        } catch (Exception e) {
            state.recordRetrievalFailure();
            log.error("Web search failed [query='{}', consecutiveFailures={}]: {}",
                    query, state.getConsecutiveRetrievalFailures(), e.getMessage());
            return;
        }

        int added = state.mergeWebResults(hits != null ? hits : List.of());
        state.advanceIteration();

        log.info("[Web search] {} hits, {} new, {} web results total",
                hits != null ? hits.size() : 0, added, state.getWebResults().size());
    }

    String buildQuery(String query) {
        StringBuilder sb = new StringBuilder();
        if (domainQualifier != null && !domainQualifier.isBlank()) {
            sb.append(domainQualifier.trim()).append(' ');
        }
        sb.append(query);
        if (!preferredDomains.isEmpty()) {
            sb.append(preferredDomains.stream()
                    .map(d -> "site:" + d)
                    .collect(Collectors.joining(" OR ", " (", ")")));
        }
        return sb.toString();
    }
}
