package com.tony.winProbability.learner;

/**
 * Modèle ajusté, opaque pour le moteur de stacking.
 */
@FunctionalInterface
public interface TrainedModel {

    /**
     * @return une probabilité de label positif par ligne de {@code features}
     */
    double[] predict(double[][] features);
}
