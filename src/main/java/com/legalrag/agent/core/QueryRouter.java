package com.legalrag.agent.core;

import com.legalrag.agent.config.RagProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Transition table of the retrieval state machine: for each node, a pure
 * function of the state giving the next node.
 *
 * After a web search the default routing looks at internal results only, the
 * same check used after an internal search. Setting
 * rag.agent.route-on-combined-results=true routes on internal + web instead.
 */
@Component
@Slf4j
public class QueryRouter {

    private final boolean routeOnCombinedResults;
    private final Map<AgentNode, Function<AgentState, AgentNode>> transitions = new EnumMap<>(AgentNode.class);

    public QueryRouter(RagProperties properties) {
        this.routeOnCombinedResults = properties.getAgent().isRouteOnCombinedResults();

        transitions.put(AgentNode.DECIDE_ACTION, this::afterDecide);
        transitions.put(AgentNode.REFINE_QUERY, state -> AgentNode.SEARCH);
        transitions.put(AgentNode.SEARCH, state -> afterSearch(state, !state.getSearchResults().isEmpty()));
        transitions.put(AgentNode.SEARCH_WEB, state -> afterSearch(state, routeOnCombinedResults
                ? state.hasAnyResults()
                : !state.getSearchResults().isEmpty()));
        transitions.put(AgentNode.GENERATE_ANSWER, state -> AgentNode.END);
    }

    public AgentNode next(AgentNode current, AgentState state) {
        Function<AgentState, AgentNode> transition = transitions.get(current);
        if (transition == null) {
            throw new IllegalStateException("No transition out of terminal node " + current);
        }
        return transition.apply(state);
    }

    AgentNode afterDecide(AgentState state) {
        if (!state.isShouldContinue()) {
            return state.hasAnyResults() ? AgentNode.GENERATE_ANSWER : AgentNode.END;
        }
        if (state.isNeedsRefinement()) return AgentNode.REFINE_QUERY;
        if (state.isUseWebSearch()) return AgentNode.SEARCH_WEB;
        return AgentNode.SEARCH;
    }

    AgentNode afterSearch(AgentState state, boolean haveResults) {
        if (!haveResults) return AgentNode.END;
        if (state.getIteration() >= state.getMaxIterations()) return AgentNode.GENERATE_ANSWER;
        return AgentNode.DECIDE_ACTION;
    }
}
