package com.legalrag.agent.api;

import com.legalrag.agent.observability.QueryTrace;
import com.legalrag.agent.observability.TraceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/traces                   last 50 query traces
 * GET /api/v1/traces/status/{status}   traces with one status (ANSWERED, NO_RESULTS, ERROR)
 * GET /api/v1/traces/analytics         latency / iteration / status summary
 */
@RestController
@RequestMapping("/api/v1/traces")
@RequiredArgsConstructor
public class TraceController {

    private final TraceService traceService;

    @GetMapping
    public ResponseEntity<List<QueryTrace>> getRecentTraces() {
        return ResponseEntity.ok(traceService.getRecentTraces());
    }

    @GetMapping("/status/{status}")
    public ResponseEntity<List<QueryTrace>> getTracesByStatus(@PathVariable QueryTrace.Status status) {
        return ResponseEntity.ok(traceService.getTracesByStatus(status));
    }

    @GetMapping("/analytics")
    public ResponseEntity<Map<String, Object>> getAnalytics() {
        return ResponseEntity.ok(traceService.getAnalytics());
    }
}
