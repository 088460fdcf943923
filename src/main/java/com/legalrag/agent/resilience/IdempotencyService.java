package com.legalrag.agent.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalrag.agent.model.QueryResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed idempotency for the query endpoint.
 *
 * A query costs several LLM round trips, so a client retrying after a
 * network timeout should get the stored envelope instead of a second run.
 * Requests without an Idempotency-Key header always execute.
 *
 * Key pattern: rag:idempotency:{key}, TTL 24h. While a request is running the
 * key holds an in-flight marker, claimed with SET NX.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "rag:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    static final String IN_FLIGHT_MARKER = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public IdempotencyService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the stored response for a completed request with this key, or empty
     *         if the key is unknown, still in flight, or holds an unreadable value
     */
    public Optional<QueryResponse> lookup(String idempotencyKey) {
        String stored = redisTemplate.opsForValue().get(KEY_PREFIX + idempotencyKey);
        if (stored == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_MARKER.equals(stored)) {
            log.warn("Idempotency key {} is in flight, executing again", idempotencyKey);
            return Optional.empty();
        }
        try {
            QueryResponse response = objectMapper.readValue(stored, QueryResponse.class);
            log.info("Idempotency hit for key={}", idempotencyKey);
            return Optional.of(response);
        } catch (JsonProcessingException e) {
            log.warn("Stored response for key={} is unreadable, executing again: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    /** @return true if this caller now owns the key */
    public boolean claim(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + idempotencyKey, IN_FLIGHT_MARKER, TTL);
        return Boolean.TRUE.equals(claimed);
    }

    public void complete(String idempotencyKey, QueryResponse response) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + idempotencyKey,
                    objectMapper.writeValueAsString(response), TTL);
            log.debug("Stored response for idempotency key={}", idempotencyKey);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize response for key={}, releasing it", idempotencyKey, e);
            release(idempotencyKey);
        }
    }

    /** Drop the key after a failed request so the client can retry */
    public void release(String idempotencyKey) {
        redisTemplate.delete(KEY_PREFIX + idempotencyKey);
        log.debug("Released idempotency key={}", idempotencyKey);
    }
}
