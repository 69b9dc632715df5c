package com.tony.winProbability.model.dto;

import com.tony.winProbability.model.CombinationMethod;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.List;

/**
 * Surcharges optionnelles d'un run. Tout champ null reprend la configuration superlearner.*.
 */
@Data
public class PipelineRunRequest {
    private String datasetPath;

    @Min(2)
    private Integer folds;
    private Boolean shuffle;
    private Long seed;
    private CombinationMethod method;
    private List<String> learners;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private Double binWidth;

    private Integer timeLeftMin;
    private Integer timeLeftMax;
    private Integer differentialMin;
    private Integer differentialMax;
}
