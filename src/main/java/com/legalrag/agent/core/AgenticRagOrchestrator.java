package com.legalrag.agent.core;

import com.legalrag.agent.answer.AnswerSynthesizer;
import com.legalrag.agent.config.RagProperties;
import com.legalrag.agent.decision.DecisionPolicy;
import com.legalrag.agent.exception.AgentNotInitializedException;
import com.legalrag.agent.model.QueryResponse;
import com.legalrag.agent.observability.RunContext;
import com.legalrag.agent.observability.TraceService;
import com.legalrag.agent.refine.QueryRefiner;
import com.legalrag.agent.retrieval.InternalRetriever;
import com.legalrag.agent.retrieval.WebRetriever;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Drives the retrieval state machine for one question at a time.
 *
 * Per-query flow:
 * 1. Resolve immutable {@link QueryOptions} from defaults and overrides
 * 2. Loop: run the current node, ask {@link QueryRouter} for the next one
 * 3. Stop at END; build the response envelope
 * 4. Async: persist the query trace
 *
 * The loop is bounded twice: by maxIterations through the decision step, and
 * by a hard cap on node transitions that forces a terminal state if a routing
 * cycle ever fails to advance the iteration counter.
 *
 * Safe for concurrent queries: all per-query state lives in {@link AgentState}.
 */
@Service
@Slf4j
public class AgenticRagOrchestrator {

    static final String NO_ANSWER = "Unable to generate an answer.";

    private final DecisionPolicy decisionPolicy;
    private final QueryRefiner queryRefiner;
    private final InternalRetriever internalRetriever;
    private final WebRetriever webRetriever;
    private final AnswerSynthesizer answerSynthesizer;
    private final QueryRouter router;
    private final TraceService traceService;
    private final RagProperties properties;

    private volatile boolean initialized;

    public AgenticRagOrchestrator(DecisionPolicy decisionPolicy,
                                  QueryRefiner queryRefiner,
                                  InternalRetriever internalRetriever,
                                  WebRetriever webRetriever,
                                  AnswerSynthesizer answerSynthesizer,
                                  QueryRouter router,
                                  TraceService traceService,
                                  RagProperties properties) {
        this.decisionPolicy = decisionPolicy;
        this.queryRefiner = queryRefiner;
        this.internalRetriever = internalRetriever;
        this.webRetriever = webRetriever;
        this.answerSynthesizer = answerSynthesizer;
        this.router = router;
        this.traceService = traceService;
        this.properties = properties;
    }

    /**
     * Checks the vector store and marks the agent ready. An unreachable store
     * is logged, not fatal: individual searches will fail and degrade instead.
     */
    @PostConstruct
    public void initialize() {
        boolean healthy;
        try {
            healthy = internalRetriever.isBackendHealthy();
        } catch (Exception e) {
            log.warn("Vector store health check failed: {}", e.getMessage());
            healthy = false;
        }
        if (!healthy) {
            log.warn("Vector store is not reachable, internal searches will fail until it is");
        }

        RagProperties.Agent agent = properties.getAgent();
        log.info("Agent initialized [maxIterations={}, topK={}, webSearch={} (provider available={})]",
                agent.getMaxIterations(), agent.getTopK(), agent.isEnableWebSearch(), webRetriever.isAvailable());
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isVectorStoreHealthy() {
        try {
            return internalRetriever.isBackendHealthy();
        } catch (Exception e) {
            return false;
        }
    }

    public boolean isWebSearchAvailable() {
        return webRetriever.isAvailable();
    }

    public QueryResponse query(String question) {
        return query(question, null, null, null);
    }

    /**
     * Answer a question. Null overrides fall back to the configured defaults.
     *
     * @throws AgentNotInitializedException if {@link #initialize()} has not run
     * @throws IllegalArgumentException     if the question is blank or an override is out of range
     */
    public QueryResponse query(String question, Integer maxIterations, Integer topK, Boolean enableWebSearch) {
        if (!initialized) {
            throw new AgentNotInitializedException();
        }
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }

        QueryOptions options = QueryOptions.resolve(properties.getAgent(), maxIterations, topK, enableWebSearch);
        if (options.enableWebSearch() && !webRetriever.isAvailable()) {
            log.info("Web search requested but no provider is configured, disabling for this query");
            options = options.withWebSearch(false);
        }

        log.info("Query started [question='{}', maxIterations={}, topK={}, webSearch={}]",
                question, options.maxIterations(), options.topK(), options.enableWebSearch());

        AgentState state = new AgentState(question, options);
        RunContext runCtx = new RunContext();

        try {
            execute(state, runCtx);
        } catch (RuntimeException e) {
            log.error("Query failed [question='{}']", question, e);
            traceService.persistTrace(question, options, null, runCtx, e);
            throw e;
        }

        QueryResponse response = toResponse(state);
        traceService.persistTrace(question, options, response, runCtx, null);

        log.info("Query complete [iterations={}, internal={}, web={}, latency={}ms]",
                response.getIterations(), response.getSearchResults().size(),
                response.getWebResults().size(), runCtx.elapsedMs());
        return response;
    }

    private void execute(AgentState state, RunContext runCtx) {
        int maxTransitions = maxTransitions(state.getOptions());
        int transitions = 0;
        AgentNode node = AgentNode.DECIDE_ACTION;

        while (node != AgentNode.END) {
            if (++transitions > maxTransitions && node != AgentNode.GENERATE_ANSWER) {
                log.warn("Transition cap {} reached at {} [iteration={}], forcing termination",
                        maxTransitions, node, state.getIteration());
                node = state.hasAnyResults() && !state.hasAnswer() ? AgentNode.GENERATE_ANSWER : AgentNode.END;
                continue;
            }

            long start = System.currentTimeMillis();
            runNode(node, state);
            runCtx.recordNode(node, System.currentTimeMillis() - start);

            AgentNode next = router.next(node, state);
            log.debug("{} -> {} [iteration={}/{}]", node, next, state.getIteration(), state.getMaxIterations());
            node = next;
        }
    }

    private void runNode(AgentNode node, AgentState state) {
        switch (node) {
            case DECIDE_ACTION -> decisionPolicy.decide(state);
            case REFINE_QUERY -> queryRefiner.refine(state);
            case SEARCH -> internalRetriever.retrieve(state);
            case SEARCH_WEB -> webRetriever.retrieve(state);
            case GENERATE_ANSWER -> answerSynthesizer.synthesize(state);
            case END -> throw new IllegalStateException("END is terminal");
        }
    }

    /**
     * Upper bound on node executions. Every successful retrieval takes at most
     * three nodes (decide, refine, search) and each one can be preceded by
     * failed attempts up to the configured failure limit.
     */
    int maxTransitions(QueryOptions options) {
        int failureLimit = Math.max(1, properties.getAgent().getMaxConsecutiveRetrievalFailures());
        return 3 * (failureLimit + 1) * (options.maxIterations() + 1);
    }

    private QueryResponse toResponse(AgentState state) {
        return QueryResponse.builder()
                .answer(state.hasAnswer() ? state.getAnswer() : NO_ANSWER)
                .searchResults(new ArrayList<>(state.getSearchResults()))
                .webResults(new ArrayList<>(state.getWebResults()))
                .iterations(state.getIteration())
                .queryUsed(state.getQuery())
                .build();
    }
}
