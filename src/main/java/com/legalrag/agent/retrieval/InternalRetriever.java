package com.legalrag.agent.retrieval;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.search.ScoredPassage;
import com.legalrag.agent.search.VectorSearchClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one internal similarity search for the working query and merges the
 * hits into the state. A failed search leaves the iteration counter alone
 * and bumps the failure streak instead.
 */
@Component
@Slf4j
public class InternalRetriever {

    private final VectorSearchClient vectorSearchClient;
    private final Double scoreThreshold;

    public InternalRetriever(VectorSearchClient vectorSearchClient, RagProperties properties) {
        this.vectorSearchClient = vectorSearchClient;
        this.scoreThreshold = properties.getVectorStore().getScoreThreshold();
    }

    public void retrieve(AgentState state) {
        String query = state.getQuery();
        log.info("[Search {}] internal query='{}', topK={}",
                state.getIteration() + 1, query, state.getOptions().topK());

        List<ScoredPassage> hits;
        try {
            hits = vectorSearchClient.search(query, state.getOptions().topK(), scoreThreshold);
        } catch (Exception e) {
            state.recordRetrievalFailure();
            log.error("Internal search failed [query='{}', consecutiveFailures={}]: {}",
                    query, state.getConsecutiveRetrievalFailures(), e.getMessage());
            return;
        }

        List<ResultItem> items = (hits != null ? hits : List.<ScoredPassage>of()).stream()
                .map(ResultItem::fromPassage)
                .toList();
        int added = state.mergeSearchResults(items);
        state.advanceIteration();

        log.info("[Search {}] {} hits, {} new, {} internal results total",
                state.getIteration(), items.size(), added, state.getSearchResults().size());
    }

    public boolean isBackendHealthy() {
        return vectorSearchClient.isHealthy();
    }
}
