package com.tony.winProbability.model;

import com.tony.winProbability.config.SuperLearnerProperties;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Paramètres figés d'un run (configuration + éventuelles surcharges de la requête).
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {
    int folds;
    boolean shuffle;
    long seed;
    CombinationMethod method;
    List<String> learners;
    double binWidth;
    IntRange timeLeftRange;
    IntRange differentialRange; // null = déduit des données
    int loglikMaxIterations;
    double loglikTolerance;

    public static PipelineSettings fromProperties(SuperLearnerProperties props) {
        IntRange differential = (props.getDifferentialMin() != null && props.getDifferentialMax() != null)
                ? IntRange.of(props.getDifferentialMin(), props.getDifferentialMax())
                : null;
        return PipelineSettings.builder()
                .folds(props.getFolds())
                .shuffle(props.isShuffle())
                .seed(props.getSeed())
                .method(props.getMethod())
                .learners(List.copyOf(props.getLearners()))
                .binWidth(props.getBinWidth())
                .timeLeftRange(IntRange.of(props.getTimeLeftMin(), props.getTimeLeftMax()))
                .differentialRange(differential)
                .loglikMaxIterations(props.getLoglikMaxIterations())
                .loglikTolerance(props.getLoglikTolerance())
                .build();
    }
}
