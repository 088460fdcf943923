package com.legalrag.agent.core;

import java.util.Locale;

/**
 * Closed set of actions the decision step can choose.
 *
 * {@link #parse} first tries an exact match of the canonical words, then falls
 * back to substring matching for chatty replies ("I think we should refine"),
 * and defaults to {@link #ANSWER}.
 */
public enum AgentAction {
    ANSWER, REFINE, SEARCH, WEB_SEARCH;

    public static AgentAction parse(String reply, boolean webSearchEnabled) {
        if (reply == null || reply.isBlank()) {
            return ANSWER;
        }

        String normalized = reply.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("^[\\s\"'`*.:-]+|[\\s\"'`*.:!-]+$", "");

        switch (normalized) {
            case "answer":
                return ANSWER;
            case "refine":
                return REFINE;
            case "search":
                return SEARCH;
            case "web_search":
            case "web search":
            case "web-search":
            case "websearch":
            case "web":
                return webSearchEnabled ? WEB_SEARCH : SEARCH;
            default:
                break;
        }

        if (normalized.contains("refine")) return REFINE;
        if (normalized.contains("web") && webSearchEnabled) return WEB_SEARCH;
        if (normalized.contains("search")) return SEARCH;
        return ANSWER;
    }
}
