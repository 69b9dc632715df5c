package com.tony.winProbability.model;

import com.tony.winProbability.learner.TrainedModel;

import java.util.Map;

/**
 * Sortie du stacking : Z hors-fold et modèles réajustés sur l'ensemble des lignes (jamais utilisés pour Z).
 */
public record StackingResult(PredictionMatrix outOfFold, Map<String, TrainedModel> fullModels) {

    public StackingResult {
        fullModels = Map.copyOf(fullModels);
    }
}
