package com.legalrag.agent.decision;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentAction;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.llm.LlmClient;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.prompt.PromptTemplates;
import com.legalrag.agent.websearch.WebSearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Chooses the next action for the retrieval loop.
 *
 * Checks run in order and the first match wins:
 * 1. iteration budget spent, or too many retrievals failed in a row: stop
 * 2. nothing retrieved yet: search (no LLM call)
 * 3. the question asks for a concrete figure, internal search ran at least
 *    twice and the web has not been tried yet: web search (no LLM call)
 * 4. otherwise ask the LLM for one of answer / refine / search / web_search
 *
 * If the LLM call fails the policy answers when it has something, and
 * searches otherwise.
 */
@Component
@Slf4j
public class DecisionPolicy {

    static final int PREVIEW_INTERNAL_LIMIT = 5;
    static final int PREVIEW_WEB_LIMIT = 3;
    static final int PREVIEW_TEXT_CHARS = 100;
    static final int WEB_FALLBACK_MIN_ITERATION = 2;

    private final LlmClient llmClient;
    private final PromptTemplates promptTemplates;
    private final SpecificFigureDetector figureDetector;
    private final RagProperties.Generation generation;
    private final int maxConsecutiveFailures;

    public DecisionPolicy(LlmClient llmClient,
                          PromptTemplates promptTemplates,
                          SpecificFigureDetector figureDetector,
                          RagProperties properties) {
        this.llmClient = llmClient;
        this.promptTemplates = promptTemplates;
        this.figureDetector = figureDetector;
        this.generation = properties.getGeneration();
        this.maxConsecutiveFailures = Math.max(1, properties.getAgent().getMaxConsecutiveRetrievalFailures());
    }

    public void decide(AgentState state) {
        if (state.getIteration() >= state.getMaxIterations()) {
            log.info("Decision: stop, iteration budget spent [{}/{}]",
                    state.getIteration(), state.getMaxIterations());
            state.stop();
            return;
        }

        if (state.getConsecutiveRetrievalFailures() >= maxConsecutiveFailures) {
            log.warn("Decision: stop after {} consecutive retrieval failures",
                    state.getConsecutiveRetrievalFailures());
            state.stop();
            return;
        }

        if (!state.hasAnyResults()) {
            log.info("Decision: search (no results yet)");
            state.apply(AgentAction.SEARCH);
            return;
        }

        if (state.isWebSearchEnabled()
                && state.getIteration() >= WEB_FALLBACK_MIN_ITERATION
                && state.getWebResults().isEmpty()
                && figureDetector.asksForSpecificFigure(state.getQuestion())) {
            log.info("Decision: web_search (question asks for a specific figure, internal search tried {} times)",
                    state.getIteration());
            state.apply(AgentAction.WEB_SEARCH);
            return;
        }

        String prompt = promptTemplates.getDecisionPrompt(
                state.getQuestion(),
                state.getQuery(),
                state.getSearchResults().size(),
                state.getWebResults().size(),
                state.getIteration(),
                buildResultsPreview(state.getSearchResults(), state.getWebResults()),
                state.isWebSearchEnabled());

        try {
            String reply = llmClient.generate(prompt, null,
                    generation.getDecisionTemperature(), generation.getDecisionMaxTokens());
            AgentAction action = AgentAction.parse(reply, state.isWebSearchEnabled());
            log.info("Decision: {} (LLM replied '{}')", action, reply);
            state.apply(action);
        } catch (Exception e) {
            AgentAction fallback = state.hasAnyResults() ? AgentAction.ANSWER : AgentAction.SEARCH;
            log.warn("Decision LLM call failed, falling back to {}: {}", fallback, e.getMessage());
            state.apply(fallback);
        }
    }

    static String buildResultsPreview(List<ResultItem> internal, List<WebSearchHit> web) {
        StringBuilder sb = new StringBuilder();
        int index = 1;

        for (ResultItem item : internal.subList(0, Math.min(PREVIEW_INTERNAL_LIMIT, internal.size()))) {
            Map<String, Object> metadata = item.getMetadata() != null ? item.getMetadata() : Map.of();
            Object articleId = metadata.getOrDefault("article_id", "N/A");
            sb.append(index++).append(". [Internal] ").append(articleId).append(": ")
                    .append(head(item.getText())).append("...\n");
        }

        for (WebSearchHit hit : web.subList(0, Math.min(PREVIEW_WEB_LIMIT, web.size()))) {
            String title = hit.getTitle() != null ? hit.getTitle() : "Web summary";
            sb.append(index++).append(". [Web] ").append(title).append(": ")
                    .append(head(hit.getContent())).append("...\n");
        }

        return sb.length() == 0 ? "(no results yet)" : sb.toString().stripTrailing();
    }

    private static String head(String text) {
        if (text == null) return "";
        return text.length() <= PREVIEW_TEXT_CHARS ? text : text.substring(0, PREVIEW_TEXT_CHARS);
    }
}
