package com.tony.winProbability.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EvaluationReport {
    List<AucEstimate> learners;
    AucEstimate ensemble;
    double confidenceLevel;

    public AucEstimate learner(String name) {
        return learners.stream()
                .filter(a -> a.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Aucune évaluation pour l'apprenant " + name));
    }
}
