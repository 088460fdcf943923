package com.legalrag.agent.core;

import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.websearch.WebSearchHit;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a single query execution, threaded through every node.
 *
 * Invariants enforced here rather than in the nodes:
 * - iteration only moves forward and never passes maxIterations
 * - accumulated results are append-only, deduplicated on exact text/content
 * - the answer is written at most once
 *
 * Not thread-safe; one instance belongs to one query.
 */
@Getter
public class AgentState {

    private final String question;
    private final QueryOptions options;

    private String query;
    private String answer;
    private int iteration;
    private int consecutiveRetrievalFailures;

    private boolean needsRefinement;
    private boolean shouldContinue = true;
    private boolean useWebSearch;

    private final List<ResultItem> searchResults = new ArrayList<>();
    private final List<WebSearchHit> webResults = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> seenTexts = new HashSet<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> seenWebContents = new HashSet<>();

    public AgentState(String question, QueryOptions options) {
        this.question = question;
        this.options = options;
        this.query = question;
    }

    public int getMaxIterations() {
        return options.maxIterations();
    }

    public boolean isWebSearchEnabled() {
        return options.enableWebSearch();
    }

    public List<ResultItem> getSearchResults() {
        return Collections.unmodifiableList(searchResults);
    }

    public List<WebSearchHit> getWebResults() {
        return Collections.unmodifiableList(webResults);
    }

    public boolean hasAnyResults() {
        return !searchResults.isEmpty() || !webResults.isEmpty();
    }

    /**
     * Appends items whose text is not already present, in arrival order.
     * Items with empty text are dropped.
     *
     * @return number of items actually added
     */
    public int mergeSearchResults(List<ResultItem> incoming) {
        int added = 0;
        for (ResultItem item : incoming) {
            String text = item.getText();
            if (text != null && !text.isEmpty() && seenTexts.add(text)) {
                searchResults.add(item);
                added++;
            }
        }
        return added;
    }

    /**
     * Same as {@link #mergeSearchResults} but keyed on the web hit's content.
     */
    public int mergeWebResults(List<WebSearchHit> incoming) {
        int added = 0;
        for (WebSearchHit hit : incoming) {
            String content = hit.getContent();
            if (content != null && !content.isEmpty() && seenWebContents.add(content)) {
                webResults.add(hit);
                added++;
            }
        }
        return added;
    }

    /** Called after a successful retrieval; also clears the failure streak */
    public void advanceIteration() {
        if (iteration >= options.maxIterations()) {
            throw new IllegalStateException(
                    "iteration " + iteration + " already at maxIterations " + options.maxIterations());
        }
        iteration++;
        consecutiveRetrievalFailures = 0;
    }

    public void recordRetrievalFailure() {
        consecutiveRetrievalFailures++;
    }

    public void setQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        this.query = query;
    }

    public boolean hasAnswer() {
        return answer != null;
    }

    public void setAnswer(String answer) {
        if (this.answer != null) {
            throw new IllegalStateException("answer already set");
        }
        this.answer = answer;
    }

    /** Hard stop: routing will go to answer generation, or to END if nothing was found */
    public void stop() {
        this.shouldContinue = false;
    }

    public void apply(AgentAction action) {
        switch (action) {
            case REFINE -> setFlags(true, true, false);
            case SEARCH -> setFlags(false, true, false);
            case WEB_SEARCH -> setFlags(false, true, true);
            case ANSWER -> setFlags(false, false, false);
        }
    }

    private void setFlags(boolean needsRefinement, boolean shouldContinue, boolean useWebSearch) {
        this.needsRefinement = needsRefinement;
        this.shouldContinue = shouldContinue;
        this.useWebSearch = useWebSearch;
    }
}
