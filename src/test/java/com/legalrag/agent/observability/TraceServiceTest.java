package com.legalrag.agent.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.core.AgentNode;
import com.legalrag.agent.core.QueryOptions;
import com.legalrag.agent.model.QueryResponse;
import com.legalrag.agent.model.ResultItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TraceServiceTest {

    @Mock QueryTraceRepository traceRepository;

    private TraceService service;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueryOptions options = new QueryOptions(3, 3, true);

    @BeforeEach
    void setUp() {
        service = new TraceService(traceRepository, objectMapper);
    }

    @Test
    void persistTrace_answered_savesCountsAndNodeVisits() throws Exception {
        RunContext runCtx = new RunContext();
        runCtx.recordNode(AgentNode.DECIDE_ACTION, 5);
        runCtx.recordNode(AgentNode.SEARCH, 40);
        QueryResponse response = QueryResponse.builder()
                .answer("answer")
                .searchResults(List.of(ResultItem.builder().text("Article 25").build()))
                .iterations(1)
                .queryUsed("probation")
                .build();

        service.persistTrace("What is probation?", options, response, runCtx, null);

        ArgumentCaptor<QueryTrace> trace = ArgumentCaptor.forClass(QueryTrace.class);
        verify(traceRepository).save(trace.capture());
        assertThat(trace.getValue().getStatus()).isEqualTo(QueryTrace.Status.ANSWERED);
        assertThat(trace.getValue().getInternalResultCount()).isEqualTo(1);
        assertThat(trace.getValue().getWebResultCount()).isZero();
        JsonNode visits = objectMapper.readTree(trace.getValue().getNodeVisitsJson());
        assertThat(visits.size()).isEqualTo(2);
        assertThat(visits.get(0).get("node").asText()).isEqualTo("DECIDE_ACTION");
        assertThat(visits.get(1).get("latencyMs").asLong()).isEqualTo(40L);
    }

    @Test
    void buildTrace_noResults_marksNoResults() {
        QueryResponse response = QueryResponse.builder().answer("none").iterations(1).queryUsed("q").build();

        QueryTrace trace = service.buildTrace("q", options, response, new RunContext(), null);

        assertThat(trace.getStatus()).isEqualTo(QueryTrace.Status.NO_RESULTS);
        assertThat(trace.getNodeVisitsJson()).isEqualTo("[]");
    }

    @Test
    void buildTrace_error_keepsMessageWithoutResponse() {
        QueryTrace trace = service.buildTrace("q", options, null, new RunContext(),
                new IllegalStateException("boom"));

        assertThat(trace.getStatus()).isEqualTo(QueryTrace.Status.ERROR);
        assertThat(trace.getErrorMessage()).isEqualTo("boom");
        assertThat(trace.getAnswer()).isNull();
    }

    @Test
    void persistTrace_repositoryFailure_isSwallowedAndLogged() {
        when(traceRepository.save(any())).thenThrow(new RuntimeException("db down"));

        service.persistTrace("q", options, null, new RunContext(), null);

        verify(traceRepository).save(any());
    }

    @Test
    void getAnalytics_mapsStatusRows() {
        when(traceRepository.avgLatencySince(any(Instant.class))).thenReturn(1234.4);
        when(traceRepository.avgIterationsSince(any(Instant.class))).thenReturn(2.5);
        when(traceRepository.countUsingWebSince(any(Instant.class))).thenReturn(7L);
        when(traceRepository.statusBreakdown()).thenReturn(List.<Object[]>of(
                new Object[]{QueryTrace.Status.ANSWERED, 10L},
                new Object[]{QueryTrace.Status.ERROR, 2L}));

        Map<String, Object> analytics = service.getAnalytics();

        assertThat(analytics).containsEntry("avgLatencyMsLast24h", 1234L)
                .containsEntry("avgIterationsLast24h", 2.5)
                .containsEntry("webSearchQueriesLast24h", 7L)
                .containsEntry("statusBreakdown", Map.of("ANSWERED", 10L, "ERROR", 2L));
    }
}
