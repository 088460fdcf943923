package com.legalrag.agent.llm;

import com.legalrag.agent.exception.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for Ollama's native /api/generate endpoint (non-streaming).
 *
 * Ollama has no API key; the model must already be pulled on the server.
 * {@link #isModelAvailable()} lets startup code warn early when it is not.
 */
@Slf4j
public class OllamaLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final RestClient restClient;

    public OllamaLlmClient(LlmProviderProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String generate(String prompt, String systemPrompt, double temperature, int maxTokens) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of(
                "temperature", temperature,
                "num_predict", maxTokens));
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            body.put("system", systemPrompt);
        }

        log.debug("Sending prompt to ollama [model={}, promptLength={}]", props.getModel(), prompt.length());

        Map<String, Object> response = restClient.post()
                .uri("/api/generate")
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String errorBody = new String(res.getBody().readAllBytes());
                    throw new AgentException("ollama client error [" + res.getStatusCode() + "]: " + errorBody);
                })
                .body(new ParameterizedTypeReference<>() {});

        if (response == null || response.get("response") == null) {
            throw new AgentException("ollama returned no 'response' field");
        }
        return response.get("response").toString().trim();
    }

    @SuppressWarnings("unchecked")
    public boolean isModelAvailable() {
        try {
            Map<String, Object> tags = restClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .body(new ParameterizedTypeReference<>() {});
            List<Map<String, Object>> models = tags != null
                    ? (List<Map<String, Object>>) tags.getOrDefault("models", List.of())
                    : List.of();
            return models.stream()
                    .map(m -> String.valueOf(m.get("name")))
                    .anyMatch(name -> name.startsWith(props.getModel()));
        } catch (Exception e) {
            log.warn("Could not reach ollama at {}: {}", props.getBaseUrl(), e.getMessage());
            return false;
        }
    }
}
