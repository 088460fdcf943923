package com.legalrag.agent.llm;

import lombok.Data;

/**
 * Connection settings for a single LLM provider.
 * Sampling settings are per call, so they are not part of this object.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
}
