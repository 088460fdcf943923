package com.legalrag.agent.websearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One item returned by a web-search provider: either a ranked article or a
 * provider-generated answer summary (no title / url).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebSearchHit {

    public enum Kind {
        ARTICLE, ANSWER;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private Kind type;
    private String title;
    private String url;
    private String content;
    private Double score;
    private String engine;
}
