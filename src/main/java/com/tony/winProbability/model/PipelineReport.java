package com.tony.winProbability.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PipelineReport {
    Instant completedAt;
    long durationMs;
    PipelineSettings settings;
    int observationCount;
    Dataset dataset;

    FoldAssignment folds;
    PredictionMatrix outOfFold;
    CombinationWeights weights;
    EnsembleModel ensemble;
    EvaluationReport evaluation;

    IntRange differentialRange;
    List<PredictionGridCell> winGrid;
    List<TieProbabilityCell> tieGrid;
    List<CalibrationBin> winCalibration;
    List<CalibrationBin> tieCalibration;
}
