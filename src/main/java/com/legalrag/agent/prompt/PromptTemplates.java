package com.legalrag.agent.prompt;

import com.legalrag.agent.config.RagProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parameterized prompts for the decision, refine and answer steps.
 *
 * Built-in defaults can be overridden under rag.prompts.* in application.yml
 * or at runtime through {@link #updateTemplate}. Placeholders use the
 * {name} syntax and are substituted literally.
 */
@Component
@Slf4j
public class PromptTemplates {

    public static final String DECISION_PROMPT = "decision_prompt";
    public static final String WEB_SEARCH_GUIDANCE = "web_search_guidance";
    public static final String REFINE_PROMPT = "refine_prompt";
    public static final String SYSTEM_PROMPT = "system_prompt";
    public static final String USER_PROMPT = "user_prompt";

    static final String DEFAULT_DECISION_PROMPT = """
            You are a legal research assistant. Based on the question and the current search results, \
            decide the next action.

            Question: {question}
            Current query: {query}
            Internal results: {num_internal_results}
            Web results: {num_web_results}
            Searches so far: {iteration}

            Current search results:
            {results_preview}

            IMPORTANT ANALYSIS:
            1. Does the question ask for a SPECIFIC FIGURE (amount, percentage, wage level, number of days, date)?
            2. Do the internal results state that exact figure?
            3. If the question asks for a figure but the results only give the general legal framework, more searching is needed.

            Reply with ONE of the following options (one word only):
            - "answer" - if there is enough SPECIFIC information to answer the question
            - "refine" - if the results are irrelevant and the query should be rewritten
            - "search" - if more internal database searching is needed{web_search_option}

            Reply with ONE word only: answer, refine, search{web_search_suffix}.""";

    static final String DEFAULT_WEB_SEARCH_GUIDANCE = """

            - "web_search" - if the question asks for a SPECIFIC FIGURE (amount, %, date) that the internal results do not contain
              EXAMPLE: "what is the regional minimum wage for region 1" needs web_search: the Code only says "by region", not the amount
              EXAMPLE: "the LATEST 2024 regulation" needs web_search to find new decrees
              EXAMPLE: "the current social insurance contribution rate" needs web_search for the exact %""";

    static final String DEFAULT_REFINE_PROMPT = """
            You are a labor-law expert. Extract the core LEGAL CONCEPT from the question to search the Labor Code.

            Original question: {question}
            Current query: {current_query}
            Searches so far: {iteration}
            Articles found: {articles_found}

            Write a NEW search query that:
            1. Focuses on the core legal concept (e.g. "probation wage", "probation period", "labor contract")
            2. Removes specifics (amounts, concrete durations, names)
            3. Uses standard Labor Code terminology

            Examples:
            - "Salary 10 million during 2 months of probation" -> "probation wage"
            - "Do I get an allowance if I quit" -> "severance allowance"

            Reply with the new query only (2-6 words), NO explanation.""";

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are a professional legal assistant specialized in the Labor Code.

            MANDATORY RULES (STRICT):
            1. ONLY use information from the sources provided below
            2. Do NOT invent regulations, percentages or figures that are not in the sources
            3. Do NOT say "generally" or "as a rule" unless the sources say so
            4. If the information is NOT ENOUGH to fully answer, say: "The sources found do not cover [specific issue]"
            5. ALWAYS cite the exact article and clause (or web source) for every statement
            6. If the question asks for a specific figure (%, amount, days) the sources do not state, say: "The sources do not specify [issue]"

            Answer clearly, precisely and honestly.""";

    static final String DEFAULT_USER_PROMPT = """
            Based STRICTLY and ONLY on the following sources, answer the question:

            {context}

            Question: {question}

            Structure the answer as:
            1. Relevant provisions (cite article and clause numbers, or the web source)
            2. Analysis and answer based on the content of those sources
            3. Caveats (if the information is not enough to fully answer)

            Remember: ONLY use the information above, do NOT make anything up.""";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public PromptTemplates(RagProperties properties) {
        templates.put(DECISION_PROMPT, DEFAULT_DECISION_PROMPT);
        templates.put(WEB_SEARCH_GUIDANCE, DEFAULT_WEB_SEARCH_GUIDANCE);
        templates.put(REFINE_PROMPT, DEFAULT_REFINE_PROMPT);
        templates.put(SYSTEM_PROMPT, DEFAULT_SYSTEM_PROMPT);
        templates.put(USER_PROMPT, DEFAULT_USER_PROMPT);

        properties.getPrompts().forEach((name, content) -> {
            updateTemplate(name, content);
            log.info("Prompt template [{}] overridden from configuration", name);
        });
    }

    public String getDecisionPrompt(String question, String query, int numInternalResults,
                                    int numWebResults, int iteration, String resultsPreview,
                                    boolean webSearchEnabled) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("question", question);
        vars.put("query", query);
        vars.put("num_internal_results", numInternalResults);
        vars.put("num_web_results", numWebResults);
        vars.put("iteration", iteration);
        vars.put("results_preview", resultsPreview);
        vars.put("web_search_option", webSearchEnabled ? templates.get(WEB_SEARCH_GUIDANCE) : "");
        vars.put("web_search_suffix", webSearchEnabled ? ", or web_search" : "");
        return render(templates.get(DECISION_PROMPT), vars);
    }

    public String getRefinePrompt(String question, String currentQuery, int iteration, String articlesFound) {
        return render(templates.get(REFINE_PROMPT), Map.of(
                "question", question,
                "current_query", currentQuery,
                "iteration", iteration,
                "articles_found", articlesFound));
    }

    public String getSystemPrompt() {
        return templates.get(SYSTEM_PROMPT);
    }

    public String getUserPrompt(String context, String question) {
        return render(templates.get(USER_PROMPT), Map.of(
                "context", context,
                "question", question));
    }

    /**
     * @throws IllegalArgumentException if no template with that name exists
     */
    public void updateTemplate(String name, String content) {
        if (!templates.containsKey(name)) {
            throw new IllegalArgumentException(
                    "Template '" + name + "' does not exist. Available templates: " + templates.keySet());
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Template '" + name + "' must not be blank");
        }
        templates.put(name, content);
    }

    public Map<String, String> getAllTemplates() {
        return Map.copyOf(templates);
    }

    // Single pass so that substituted values containing "{...}" are never re-expanded
    private static String render(String template, Map<String, ?> vars) {
        StringBuilder out = new StringBuilder(template.length() + 256);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                int close = template.indexOf('}', i + 1);
                if (close > i) {
                    String key = template.substring(i + 1, close);
                    if (vars.containsKey(key)) {
                        out.append(vars.get(key));
                        i = close + 1;
                        continue;
                    }
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }
}
