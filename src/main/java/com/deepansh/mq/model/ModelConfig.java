package com.deepansh.mq.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A model registry entry: what a shortname resolves to.
 * Sampling parameters are optional and only sent when set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"provider", "model", "sysprompt", "temperature", "top_p", "top_k"})
public class ModelConfig {

    private String provider;
    private String model;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String sysprompt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double temperature;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Double topP;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Integer topK;
}
