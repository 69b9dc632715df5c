package com.tony.winProbability.model;

/**
 * Probabilité de nul déduite par symétrie : 1 - (p(d) + p(-d)).
 * Jamais bornée : une valeur négative signale une mauvaise calibration, le diagramme de calibration doit la voir.
 */
public record TieProbabilityCell(int scoreDifferential, int timeLeft,
                                 double winProbability, double mirroredWinProbability, double tieProbability) {

    public static TieProbabilityCell derive(int scoreDifferential, int timeLeft, double winProbability, double mirroredWinProbability) {
        return new TieProbabilityCell(scoreDifferential, timeLeft, winProbability, mirroredWinProbability,
                1 - (winProbability + mirroredWinProbability));
    }

    public PredictionGridCell asGridCell() {
        return new PredictionGridCell(scoreDifferential, timeLeft, tieProbability);
    }
}
