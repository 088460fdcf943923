package com.legalrag.agent.refine;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.core.AgentState;
import com.legalrag.agent.core.QueryOptions;
import com.legalrag.agent.llm.LlmClient;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.prompt.PromptTemplates;
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
class QueryRefinerTest {

    @Mock LlmClient llmClient;

    private QueryRefiner refiner;
    private AgentState state;

    @BeforeEach
    void setUp() {
        RagProperties properties = new RagProperties();
        refiner = new QueryRefiner(llmClient, new PromptTemplates(properties), properties);
        state = new AgentState("Salary 10 million during 2 months of probation?", new QueryOptions(3, 3, true));
    }

    @Test
    void refine_stripsQuotesAndReplacesQuery() {
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("  \"probation wage\"  ");

        refiner.refine(state);

        assertThat(state.getQuery()).isEqualTo("probation wage");
        verify(llmClient).generate(anyString(), isNull(), eq(0.3), eq(50));
    }

    @Test
    void refine_llmFailure_keepsQuery() {
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt()))
                .thenThrow(new RuntimeException("timeout"));

        refiner.refine(state);

        assertThat(state.getQuery()).isEqualTo("Salary 10 million during 2 months of probation?");
    }

    @Test
    void refine_emptyReply_keepsQuery() {
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("''");

        refiner.refine(state);

        assertThat(state.getQuery()).isEqualTo("Salary 10 million during 2 months of probation?");
    }

    @Test
    void refine_promptListsSortedDistinctArticleIds() {
        state.mergeSearchResults(List.of(
                result("b", Map.of("article_id", "Article 27")),
                result("a", Map.of("article_id", "Article 25")),
                result("c", Map.of("article_id", "Article 27")),
                result("d", Map.of())));
        when(llmClient.generate(anyString(), isNull(), anyDouble(), anyInt())).thenReturn("probation wage");

        refiner.refine(state);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmClient).generate(prompt.capture(), isNull(), anyDouble(), anyInt());
        assertThat(prompt.getValue()).contains("Articles found: Article 25, Article 27");
    }

    @Test
    void articlesFound_noIds_usesMarker() {
        assertThat(QueryRefiner.articlesFound(state)).isEqualTo(QueryRefiner.NO_ARTICLES_MARKER);
    }

    private static ResultItem result(String text, Map<String, Object> metadata) {
        return ResultItem.builder().text(text).metadata(metadata).build();
    }
}
