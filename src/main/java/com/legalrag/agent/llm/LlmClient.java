package com.legalrag.agent.llm;

/**
 * Text-generation capability used by the decision, refine and answer steps.
 *
 * Implementations throw on any transport or provider error; callers decide
 * how to degrade.
 */
public interface LlmClient {

    /**
     * Generate a completion for a single prompt.
     *
     * @param prompt       the user prompt
     * @param systemPrompt optional system prompt, may be null
     * @param temperature  sampling temperature (0.0 - 1.0)
     * @param maxTokens    upper bound on generated tokens
     * @return the generated text, trimmed
     */
    String generate(String prompt, String systemPrompt, double temperature, int maxTokens);
}
