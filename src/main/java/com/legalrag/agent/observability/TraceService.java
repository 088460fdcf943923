package com.legalrag.agent.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.core.QueryOptions;
import com.legalrag.agent.model.QueryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists query traces and exposes analytics over them.
 *
 * Persistence runs on the trace executor and never fails the query;
 * analytics are read synchronously by the trace endpoints.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TraceService {

    private final QueryTraceRepository traceRepository;
    private final ObjectMapper objectMapper;

    /**
     * @param response null when the query threw
     * @param error    null on success
     */
    @Async("traceTaskExecutor")
    public void persistTrace(String question, QueryOptions options, QueryResponse response,
                             RunContext runCtx, Throwable error) {
        try {
            QueryTrace trace = buildTrace(question, options, response, runCtx, error);
            traceRepository.save(trace);
            log.info("Trace persisted [status={}, iterations={}, latency={}ms]",
                    trace.getStatus(), trace.getIterations(), trace.getTotalLatencyMs());
        } catch (Exception e) {
            log.error("Failed to persist query trace", e);
        }
    }

    QueryTrace buildTrace(String question, QueryOptions options, QueryResponse response,
                          RunContext runCtx, Throwable error) {
        QueryTrace.Status status;
        if (error != null || response == null) {
            status = QueryTrace.Status.ERROR;
        } else if (response.getSearchResults().isEmpty() && response.getWebResults().isEmpty()) {
            status = QueryTrace.Status.NO_RESULTS;
        } else {
            status = QueryTrace.Status.ANSWERED;
        }

        QueryTrace.QueryTraceBuilder builder = QueryTrace.builder()
                .question(truncate(question, 4000))
                .status(status)
                .maxIterations(options.maxIterations())
                .topK(options.topK())
                .webSearchEnabled(options.enableWebSearch())
                .totalLatencyMs(runCtx.elapsedMs())
                .nodeVisitsJson(serializeNodeVisits(runCtx.getNodeVisits()))
                .errorMessage(error != null ? truncate(error.getMessage(), 2000) : null);

        if (response != null) {
            builder.queryUsed(truncate(response.getQueryUsed(), 1000))
                    .answer(truncate(response.getAnswer(), 8000))
                    .iterations(response.getIterations())
                    .internalResultCount(response.getSearchResults().size())
                    .webResultCount(response.getWebResults().size());
        }
        return builder.build();
    }

    public List<QueryTrace> getRecentTraces() {
        return traceRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public List<QueryTrace> getTracesByStatus(QueryTrace.Status status) {
        return traceRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    /**
     * Last-24h averages plus an all-time status breakdown.
     */
    public Map<String, Object> getAnalytics() {
        Instant since24h = Instant.now().minus(24, ChronoUnit.HOURS);

        Double avgLatency = traceRepository.avgLatencySince(since24h);
        Double avgIterations = traceRepository.avgIterationsSince(since24h);
        long webQueries = traceRepository.countUsingWebSince(since24h);

        Map<String, Long> statusBreakdown = traceRepository.statusBreakdown().stream()
                .collect(Collectors.toMap(
                        r -> r[0].toString(),
                        r -> ((Number) r[1]).longValue()
                ));

        return Map.of(
                "avgLatencyMsLast24h", avgLatency != null ? Math.round(avgLatency) : 0,
                "avgIterationsLast24h", avgIterations != null ? avgIterations : 0.0,
                "webSearchQueriesLast24h", webQueries,
                "statusBreakdown", statusBreakdown
        );
    }

    private String serializeNodeVisits(List<RunContext.NodeVisit> visits) {
        if (visits.isEmpty()) return "[]";
        try {
            return objectMapper.writeValueAsString(visits.stream()
                    .map(v -> Map.of("node", v.node().name(), "latencyMs", v.latencyMs()))
                    .toList());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize node visits: {}", e.getMessage());
            return "[]";
        }
    }

    private String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max - 14) + "...[truncated]";
    }
}
