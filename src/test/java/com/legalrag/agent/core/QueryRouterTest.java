package com.legalrag.agent.core;

import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.model.ResultItem;
import com.legalrag.agent.websearch.WebSearchHit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryRouterTest {

    private final QueryRouter router = new QueryRouter(new RagProperties());

    @Test
    void decide_stoppedWithResults_goesToAnswer() {
        AgentState state = stateWithInternal(1);
        state.stop();
        assertThat(router.next(AgentNode.DECIDE_ACTION, state)).isEqualTo(AgentNode.GENERATE_ANSWER);
    }

    @Test
    void decide_stoppedWithoutResults_ends() {
        AgentState state = new AgentState("q", new QueryOptions(3, 3, true));
        state.stop();
        assertThat(router.next(AgentNode.DECIDE_ACTION, state)).isEqualTo(AgentNode.END);
    }

    @Test
    void decide_flagsPickNextNode() {
        AgentState state = new AgentState("q", new QueryOptions(3, 3, true));

        state.apply(AgentAction.REFINE);
        assertThat(router.next(AgentNode.DECIDE_ACTION, state)).isEqualTo(AgentNode.REFINE_QUERY);

        state.apply(AgentAction.WEB_SEARCH);
        assertThat(router.next(AgentNode.DECIDE_ACTION, state)).isEqualTo(AgentNode.SEARCH_WEB);

        state.apply(AgentAction.SEARCH);
        assertThat(router.next(AgentNode.DECIDE_ACTION, state)).isEqualTo(AgentNode.SEARCH);
    }

    @Test
    void refine_alwaysSearches() {
        assertThat(router.next(AgentNode.REFINE_QUERY, stateWithInternal(0))).isEqualTo(AgentNode.SEARCH);
    }

    @Test
    void search_routesOnIterationAndInternalResults() {
        assertThat(router.next(AgentNode.SEARCH, stateWithInternal(1))).isEqualTo(AgentNode.DECIDE_ACTION);
        assertThat(router.next(AgentNode.SEARCH, stateWithInternal(3))).isEqualTo(AgentNode.GENERATE_ANSWER);

        AgentState empty = new AgentState("q", new QueryOptions(3, 3, true));
        empty.advanceIteration();
        assertThat(router.next(AgentNode.SEARCH, empty)).isEqualTo(AgentNode.END);
    }

    @Test
    void searchWeb_byDefault_ignoresWebResultsWhenRouting() {
        AgentState webOnly = webOnlyState();
        assertThat(router.next(AgentNode.SEARCH_WEB, webOnly)).isEqualTo(AgentNode.END);
    }

    @Test
    void searchWeb_combinedRouting_countsWebResults() {
        RagProperties props = new RagProperties();
        props.getAgent().setRouteOnCombinedResults(true);
        QueryRouter combined = new QueryRouter(props);

        assertThat(combined.next(AgentNode.SEARCH_WEB, webOnlyState())).isEqualTo(AgentNode.DECIDE_ACTION);
    }

    @Test
    void generateAnswer_ends_andEndHasNoTransition() {
        AgentState state = stateWithInternal(1);
        assertThat(router.next(AgentNode.GENERATE_ANSWER, state)).isEqualTo(AgentNode.END);
        assertThatThrownBy(() -> router.next(AgentNode.END, state)).isInstanceOf(IllegalStateException.class);
    }

    private static AgentState stateWithInternal(int iterations) {
        AgentState state = new AgentState("q", new QueryOptions(3, 3, true));
        state.mergeSearchResults(List.of(ResultItem.builder().text("Article 25").build()));
        for (int i = 0; i < iterations; i++) {
            state.advanceIteration();
        }
        return state;
    }

    private static AgentState webOnlyState() {
        AgentState state = new AgentState("q", new QueryOptions(3, 3, true));
        state.mergeWebResults(List.of(WebSearchHit.builder()
                .type(WebSearchHit.Kind.ARTICLE).title("t").content("web text").build()));
        state.advanceIteration();
        return state;
    }
}
