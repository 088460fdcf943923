package com.legalrag.agent.api;

import com.legalrag.agent.core.AgenticRagOrchestrator;
import com.legalrag.agent.model.QueryRequest;
import com.legalrag.agent.model.QueryResponse;
import com.legalrag.agent.resilience.IdempotencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * POST /api/v1/rag/query
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key within 24h returns the stored response without re-running the agent.
 *
 * GET /api/v1/rag/health
 */
@RestController
@RequestMapping("/api/v1/rag")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final AgenticRagOrchestrator orchestrator;
    private final IdempotencyService idempotencyService;

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        log.info("Query request [idempotencyKey={}]", idempotencyKey);

        if (idempotent) {
            Optional<QueryResponse> cached = idempotencyService.lookup(idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            idempotencyService.claim(idempotencyKey);
        }

        QueryResponse response;
        try {
            response = orchestrator.query(request.getQuestion(), request.getMaxIterations(),
                    request.getTopK(), request.getEnableWebSearch());
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.release(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            idempotencyService.complete(idempotencyKey, response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean initialized = orchestrator.isInitialized();
        boolean vectorStore = orchestrator.isVectorStoreHealthy();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", initialized && vectorStore ? "UP" : "DEGRADED");
        body.put("initialized", initialized);
        body.put("vectorStore", vectorStore ? "UP" : "DOWN");
        body.put("webSearchAvailable", orchestrator.isWebSearchAvailable());
        return ResponseEntity.ok(body);
    }
}
