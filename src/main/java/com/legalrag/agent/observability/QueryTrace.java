package com.legalrag.agent.observability;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * One row per executed query.
 *
 * node_visits_json holds the node sequence with per-node latency, e.g.
 * [{"node":"DECIDE_ACTION","latencyMs":812},{"node":"SEARCH","latencyMs":95}]
 */
@Entity
@Table(
    name = "query_traces",
    indexes = {
        @Index(name = "idx_query_trace_created_at", columnList = "createdAt"),
        @Index(name = "idx_query_trace_status",     columnList = "status")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryTrace {

    /** ANSWERED: answer produced. NO_RESULTS: nothing retrieved. ERROR: the query threw. */
    public enum Status { ANSWERED, NO_RESULTS, ERROR }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 4000)
    private String question;

    @Column(length = 1000)
    private String queryUsed;

    @Column(length = 8000)
    private String answer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Status status;

    private int iterations;
    private int maxIterations;
    private int topK;
    private boolean webSearchEnabled;

    private int internalResultCount;
    private int webResultCount;

    private long totalLatencyMs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private String nodeVisitsJson;

    @Column(length = 2000)
    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;
}
