package com.legalrag.agent.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ranked hit from the internal store. Payload fields other than the
 * passage text end up in {@code metadata}.
 */
public record ScoredPassage(double score, String text, Map<String, Object> metadata) {

    public ScoredPassage {
        text = text != null ? text : "";
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
