package com.legalrag.agent.decision;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.core.QueryOptions;
import com.legalrag.agent.llm.LlmClient;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.prompt.PromptTemplates;
import com.legalrag.agent.websearch.WebSearchHit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DecisionPolicyTest {

    @Mock LlmClient llmClient;

    private RagProperties properties;
    private DecisionPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new RagProperties();
        policy = new DecisionPolicy(llmClient, new PromptTemplates(properties),
                new SpecificFigureDetector(), properties);
    }

    @Test
    void decide_iterationBudgetSpent_stopsWithoutLlm() {
        AgentState state = state("Explain probation", true, 3);

        policy.decide(state);

        assertThat(state.isShouldContinue()).isFalse();
        verifyNoInteractions(llmClient);
    }

    @Test
    void decide_noResultsYet_searchesWithoutLlm() {
        AgentState state = new AgentState("Explain probation", new QueryOptions(3, 3, true));

        policy.decide(state);

        assertThat(state.isShouldContinue()).isTrue();
        assertThat(state.isNeedsRefinement()).isFalse();
        assertThat(state.isUseWebSearch()).isFalse();
        verifyNoInteractions(llmClient);
    }

    @Test
    void decide_figureQuestionAfterTwoSearches_forcesWebSearchWithoutLlm() {
        AgentState state = state("What is the maximum probation period, in days?", true, 2);

        policy.decide(state);

        assertThat(state.isUseWebSearch()).isTrue();
        assertThat(state.isShouldContinue()).isTrue();
        verifyNoInteractions(llmClient);
    }

    @Test
    void decide_figureQuestionAfterOneSearch_asksLlm() {
        AgentState state = state("What is the maximum probation period, in days?", true, 1);
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("refine");

        policy.decide(state);

        assertThat(state.isNeedsRefinement()).isTrue();
        verify(llmClient).generate(anyString(), isNull(), eq(0.3), eq(20));
    }

    @Test
    void decide_figureQuestionWebDisabled_asksLlm_andCannotChooseWeb() {
        AgentState state = state("What is the maximum probation period, in days?", false, 2);
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("web_search");

        policy.decide(state);

        assertThat(state.isUseWebSearch()).isFalse();
        assertThat(state.isShouldContinue()).isTrue();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(prompt.capture(), isNull(), anyDouble(), anyInt());
        assertThat(prompt.getValue()).doesNotContain("web_search");
    }

    @Test
    void decide_llmFailureWithResults_answers() {
        AgentState state = state("Explain probation", true, 1);
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt()))
                .thenThrow(new RuntimeException("connection refused"));

        policy.decide(state);

        assertThat(state.isShouldContinue()).isFalse();
    }

    @Test
    void decide_tooManyConsecutiveFailures_stops() {
        AgentState state = state("Explain probation", true, 1);
        state.recordRetrievalFailure();
        state.recordRetrievalFailure();

        policy.decide(state);

        assertThat(state.isShouldContinue()).isFalse();
        verifyNoInteractions(llmClient);
    }

    @Test
    void decide_promptCarriesPreviewOfInternalResults() {
        AgentState state = state("Explain probation", true, 1);
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("answer");

        policy.decide(state);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(prompt.capture(), isNull(), anyDouble(), anyInt());
        assertThat(prompt.getValue())
                .contains("1. [Internal] Article 25: Probation period shall not exceed")
                .contains("Question: Explain probation")
                .contains("web_search");
        assertThat(state.isShouldContinue()).isFalse();
    }

    @Test
    void buildResultsPreview_limitsAndTruncates() {
        String longText = "x".repeat(250);
        List<ResultItem> internal = List.of(
                ResultItem.builder().text(longText).metadata(Map.of()).build());
        List<WebSearchHit> web = List.of(
                WebSearchHit.builder().type(WebSearchHit.Kind.ARTICLE).title("News").content("short").build());

        String preview = DecisionPolicy.buildResultsPreview(internal, web);

        assertThat(preview).isEqualTo("1. [Internal] N/A: " + "x".repeat(100) + "...\n2. [Web] News: short...");
    }

    private static AgentState state(String question, boolean web, int iterations) {
        AgentState state = new AgentState(question, new QueryOptions(3, 3, web));
        state.mergeSearchResults(List.of(ResultItem.builder()
                .text("Probation period shall not exceed 180 days for enterprise managers")
                .metadata(Map.of("article_id", "Article 25"))
                .score(0.82)
                .build()));
        for (int i = 0; i < iterations; i++) {
            state.advanceIteration();
        }
        return state;
    }
}
