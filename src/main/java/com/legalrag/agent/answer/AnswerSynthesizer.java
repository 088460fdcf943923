package com.legalrag.agent.answer;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.llm.LlmClient;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.prompt.PromptTemplates;
import com.legalrag.agent.websearch.WebSearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the final answer from everything retrieved.
 *
 * Internal passages come first, then web hits converted to the same shape.
 * The LLM is never called with an empty context: with nothing retrieved the
 * fixed {@link #NO_INFORMATION_ANSWER} is returned instead. Generation
 * failures become an apologetic answer rather than an exception.
 */
@Component
@Slf4j
public class AnswerSynthesizer {

    public static final String NO_INFORMATION_ANSWER =
            "Sorry, I could not find any relevant information to answer your question.";
    static final String GENERATION_ERROR_PREFIX =
            "Sorry, an error occurred while generating the answer: ";

    private final LlmClient llmClient;
    private final PromptTemplates promptTemplates;
    private final RagProperties.Generation generation;

    public AnswerSynthesizer(LlmClient llmClient, PromptTemplates promptTemplates, RagProperties properties) {
        this.llmClient = llmClient;
        this.promptTemplates = promptTemplates;
        this.generation = properties.getGeneration();
    }

    public void synthesize(AgentState state) {
        List<ResultItem> sources = tagSources(state.getSearchResults(), state.getWebResults());
        log.info("Generating answer from {} sources ({} internal, {} web)",
                sources.size(), state.getSearchResults().size(), state.getWebResults().size());

        if (sources.isEmpty()) {
            state.setAnswer(NO_INFORMATION_ANSWER);
            return;
        }

        String context = ContextFormatter.format(sources);
        try {
            String answer = llmClient.generate(
                    promptTemplates.getUserPrompt(context, state.getQuestion()),
                    promptTemplates.getSystemPrompt(),
                    generation.getAnswerTemperature(),
                    generation.getAnswerMaxTokens());
            state.setAnswer(answer);
        } catch (Exception e) {
            log.error("Answer generation failed: {}", e.getMessage(), e);
            state.setAnswer(GENERATION_ERROR_PREFIX + e.getMessage());
        }
    }

    static List<ResultItem> tagSources(List<ResultItem> internal, List<WebSearchHit> web) {
        List<ResultItem> sources = new ArrayList<>(internal.size() + web.size());

        for (ResultItem item : internal) {
            sources.add(item.toBuilder().sourceType(ResultItem.SourceType.INTERNAL).build());
        }

        for (WebSearchHit hit : web) {
            if (hit.getType() == null) continue;
            Map<String, Object> metadata = new LinkedHashMap<>();
            switch (hit.getType()) {
                case ARTICLE -> {
                    metadata.put("source", "web");
                    metadata.put("url", hit.getUrl());
                    metadata.put("title", hit.getTitle());
                    sources.add(ResultItem.builder()
                            .text("[Web source: " + hit.getTitle() + "]\n" + hit.getContent())
                            .metadata(metadata)
                            .score(hit.getScore() != null ? hit.getScore() : 0.0)
                            .sourceType(ResultItem.SourceType.WEB)
                            .build());
                }
                case ANSWER -> {
                    metadata.put("source", "web_summary");
                    sources.add(ResultItem.builder()
                            .text("[Web search summary]\n" + hit.getContent())
                            .metadata(metadata)
                            .score(1.0)
                            .sourceType(ResultItem.SourceType.WEB)
                            .build());
                }
            }
        }
        return sources;
    }
}
