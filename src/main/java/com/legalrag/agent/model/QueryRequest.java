package com.legalrag.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    @NotBlank(message = "question must not be blank")
    private String question;

    /** Optional; falls back to rag.agent.max-iterations */
    @Min(1)
    @Max(10)
    @JsonProperty("max_iterations")
    private Integer maxIterations;

    @Min(1)
    @Max(20)
    @JsonProperty("top_k")
    private Integer topK;

    @JsonProperty("enable_web_search")
    private Boolean enableWebSearch;
}
