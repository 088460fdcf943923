package com.legalrag.agent.llm;

import com.legalrag.agent.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client. Works with OpenAI, Groq and any
 * server exposing /chat/completions.
 *
 * Error handling strategy:
 *
 * | Error                    | Action                                        |
 * |--------------------------|-----------------------------------------------|
 * | 401 invalid_api_key      | AgentException (not retried, not CB failure)  |
 * | 400 model_decommissioned | AgentException with loud guidance message     |
 * | 429 rate limit           | RuntimeException (retried)                    |
 * | 4xx other                | AgentException (not retried, not CB failure)  |
 * | 5xx server error         | RuntimeException (retried, counts as failure) |
 * | network error            | ResourceAccessException (retried)             |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String generate(String prompt, String systemPrompt, double temperature, int maxTokens) {
        Map<String, Object> requestBody = buildRequestBody(prompt, systemPrompt, temperature, maxTokens);

        log.debug("Sending prompt to {} [model={}, promptLength={}, temperature={}]",
                providerName, props.getModel(), prompt.length(), temperature);

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes());
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes());
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    /**
     * Maps 4xx codes to exception types so retry and the circuit breaker
     * only react to transient failures.
     */
    private void handle4xxError(String body, int statusCode) {
        if (body.contains("model_decommissioned")) {
            log.error("================================================================");
            log.error("  MODEL DECOMMISSIONED: {} is no longer supported.", props.getModel());
            log.error("  Update llm.{}.model in application.yml", providerName);
            log.error("================================================================");
            throw new AgentException("Model '" + props.getModel() + "' is decommissioned.");
        }

        if (statusCode == 401) {
            throw new AgentException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new AgentException(providerName + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String prompt, String systemPrompt,
                                                 double temperature, int maxTokens) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("messages", messages);
        return body;
    }

    @SuppressWarnings("unchecked")
    private String parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new AgentException(providerName + " returned an empty body");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new AgentException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message != null ? message.get("content") : null;
        if (content == null) {
            throw new AgentException(providerName + " returned a choice without content");
        }
        return content.toString().trim();
    }
}
