package com.legalrag.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.legalrag.agent.websearch.WebSearchHit;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String answer;

    @Builder.Default
    @JsonProperty("search_results")
    private List<ResultItem> searchResults = new ArrayList<>();

    @Builder.Default
    @JsonProperty("web_results")
    private List<WebSearchHit> webResults = new ArrayList<>();

    private int iterations;

    @JsonProperty("query_used")
    private String queryUsed;
}
