package com.tony.winProbability.model;

/**
 * Une combinaison (écart, temps restant) de la grille. {@code predictedProbability} vaut null tant que
 * la grille n'a pas été passée dans l'ensemble.
 */
public record PredictionGridCell(int scoreDifferential, int timeLeft, Double predictedProbability) {

    public static PredictionGridCell empty(int scoreDifferential, int timeLeft) {
        return new PredictionGridCell(scoreDifferential, timeLeft, null);
    }

    public PredictionGridCell withPrediction(double probability) {
        return new PredictionGridCell(scoreDifferential, timeLeft, probability);
    }

    public double[] features() {
        return GameStateFeatures.of(scoreDifferential, timeLeft);
    }

    public GameStateKey key() {
        return new GameStateKey(scoreDifferential, timeLeft);
    }

    public boolean isPredicted() {
        return predictedProbability != null;
    }
}
