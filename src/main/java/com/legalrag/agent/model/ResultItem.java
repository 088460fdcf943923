package com.legalrag.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.legalrag.agent.search.ScoredPassage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A retrieved passage in the shape the answer step consumes.
 * {@code sourceType} is only set once the item is tagged for answer generation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultItem {

    public enum SourceType {
        INTERNAL, WEB;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private String text;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private Double score;

    @JsonProperty("source_type")
    private SourceType sourceType;

    public static ResultItem fromPassage(ScoredPassage passage) {
        return ResultItem.builder()
                .text(passage.text())
                .metadata(new LinkedHashMap<>(passage.metadata()))
                .score(passage.score())
                .build();
    }
}
