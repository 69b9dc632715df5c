package com.tony.winProbability.model;

import java.util.Objects;

/**
 * Une ligne du jeu de données : prédicteurs numériques, label binaire et identifiant de groupe (match).
 * Le groupId est transporté mais n'intervient pas dans l'affectation des folds.
 */
public record Observation(double[] features, int label, String groupId) {

    public Observation {
        Objects.requireNonNull(features, "features");
        if (features.length == 0) {
            throw new IllegalArgumentException("Une observation doit avoir au moins un prédicteur");
        }
        if (label != 0 && label != 1) {
            throw new IllegalArgumentException("Label binaire attendu (0/1), reçu : " + label);
        }
        features = features.clone();
    }

    @Override
    public double[] features() {
        return features.clone();
    }

    public double feature(int index) {
        return features[index];
    }

    public int featureCount() {
        return features.length;
    }
}
