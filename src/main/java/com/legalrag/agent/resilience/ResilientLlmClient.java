package com.legalrag.agent.resilience;

import com.legalrag.agent.exception.AgentException;
import com.legalrag.agent.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the active LLM client that adds retry + circuit breaker.
 *
 * Retry config (application.yml): 3 attempts, exponential backoff 1s → 2s,
 * AgentException is ignored (configuration errors are not transient).
 *
 * Circuit breaker config: opens at 50% failures over a window of 10 calls,
 * half-opens after 30s.
 *
 * Fallbacks rethrow as AgentException. The agent nodes catch it at their
 * boundary and take their safe default transition.
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public String generate(String prompt, String systemPrompt, double temperature, int maxTokens) {
        return delegate.generate(prompt, systemPrompt, temperature, maxTokens);
    }

    public String retryFallback(String prompt, String systemPrompt, double temperature, int maxTokens,
                                Exception ex) {
        if (ex instanceof AgentException agentException) {
            throw agentException;
        }
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        throw new AgentException("LLM unavailable after retries: " + ex.getMessage(), ex);
    }

    public String circuitBreakerFallback(String prompt, String systemPrompt, double temperature, int maxTokens,
                                         CallNotPermittedException ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new AgentException("LLM service temporarily unavailable (circuit open)", ex);
    }
}
