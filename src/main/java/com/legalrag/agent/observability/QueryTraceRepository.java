package com.legalrag.agent.observability;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface QueryTraceRepository extends JpaRepository<QueryTrace, Long> {

    List<QueryTrace> findTop50ByOrderByCreatedAtDesc();

    List<QueryTrace> findByStatusOrderByCreatedAtDesc(QueryTrace.Status status);

    @Query("select avg(t.totalLatencyMs) from QueryTrace t where t.createdAt >= ?1")
    Double avgLatencySince(Instant since);

    @Query("select avg(t.iterations) from QueryTrace t where t.createdAt >= ?1")
    Double avgIterationsSince(Instant since);

    @Query("select count(t) from QueryTrace t where t.createdAt >= ?1 and t.webResultCount > 0")
    long countUsingWebSince(Instant since);

    @Query("select t.status, count(t) from QueryTrace t group by t.status")
    List<Object[]> statusBreakdown();
}
