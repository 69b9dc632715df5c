package com.tony.winProbability.model.dto;

import com.tony.winProbability.model.AucEstimate;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.PipelineReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Vue compacte du dernier run pour le endpoint /latest.
 */
@Value
@Builder
public class PipelineSummary {
    Instant completedAt;
    long durationMs;
    int observationCount;
    int folds;
    List<Integer> foldSizes;
    CombinationMethod method;
    boolean weightsNormalized;
    Map<String, Double> weights;
    Map<String, Double> cvRisk;
    List<AucEstimate> learnerAucs;
    AucEstimate ensembleAuc;
    double confidenceLevel;
    int differentialMin;
    int differentialMax;

    public static PipelineSummary from(PipelineReport report) {
        return PipelineSummary.builder()
                .completedAt(report.getCompletedAt())
                .durationMs(report.getDurationMs())
                .observationCount(report.getObservationCount())
                .folds(report.getFolds().foldCount())
                .foldSizes(Arrays.stream(report.getFolds().foldSizes()).boxed().toList())
                .method(report.getWeights().getMethod())
                .weightsNormalized(report.getWeights().isNormalized())
                .weights(report.getWeights().getWeights())
                .cvRisk(report.getWeights().getCvRisk())
                .learnerAucs(report.getEvaluation().getLearners())
                .ensembleAuc(report.getEvaluation().getEnsemble())
                .confidenceLevel(report.getEvaluation().getConfidenceLevel())
                .differentialMin(report.getDifferentialRange().min())
                .differentialMax(report.getDifferentialRange().max())
                .build();
    }
}
