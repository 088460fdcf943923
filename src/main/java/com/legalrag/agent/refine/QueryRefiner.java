package com.legalrag.agent.refine;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.llm.LlmClient;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.prompt.PromptTemplates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Rewrites the working query into a short legal-concept query.
 * On LLM failure, or an empty reply, the current query is kept.
 */
@Component
@Slf4j
public class QueryRefiner {

    static final String NO_ARTICLES_MARKER = "none yet";

    private final LlmClient llmClient;
    private final PromptTemplates promptTemplates;
    private final RagProperties.Generation generation;

    public QueryRefiner(LlmClient llmClient, PromptTemplates promptTemplates, RagProperties properties) {
        this.llmClient = llmClient;
        this.promptTemplates = promptTemplates;
        this.generation = properties.getGeneration();
    }

    public void refine(AgentState state) {
        String current = state.getQuery();
        String prompt = promptTemplates.getRefinePrompt(
                state.getQuestion(), current, state.getIteration(), articlesFound(state));

        try {
            String reply = llmClient.generate(prompt, null,
                    generation.getRefineTemperature(), generation.getRefineMaxTokens());
            String refined = clean(reply);
            if (refined.isEmpty()) {
                log.warn("Refine returned an empty query, keeping '{}'", current);
                return;
            }
            state.setQuery(refined);
            log.info("Refined query: '{}' -> '{}'", current, refined);
        } catch (Exception e) {
            log.warn("Query refinement failed, keeping '{}': {}", current, e.getMessage());
        }
    }

    static String articlesFound(AgentState state) {
        String ids = state.getSearchResults().stream()
                .map(ResultItem::getMetadata)
                .filter(Objects::nonNull)
                .map(m -> m.get("article_id"))
                .filter(Objects::nonNull)
                .map(Object::toString)
                .filter(s -> !s.isBlank())
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        return ids.isEmpty() ? NO_ARTICLES_MARKER : ids;
    }

    static String clean(String reply) {
        if (reply == null) return "";
        String s = reply.trim();
        int start = 0;
        int end = s.length();
        while (start < end && isQuote(s.charAt(start))) start++;
        while (end > start && isQuote(s.charAt(end - 1))) end--;
        return s.substring(start, end).trim();
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}
