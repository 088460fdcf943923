package com.legalrag.agent.websearch;

import java.util.List;

/**
 * Web-search capability. Implementations throw on transport or provider
 * errors so the caller can tell "no results" from "search failed".
 */
public interface WebSearchClient {

    List<WebSearchHit> search(String query, int maxResults);

    /** Short provider name for logs */
    String name();
}
