package com.tony.winProbability.learner;

import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Référence naïve : le taux de victoire observé, quel que soit l'état de match.
 */
@Component
public class MeanLearner implements BaseLearner {

    public static final String NAME = "mean";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TrainedModel train(double[][] features, int[] labels, long seed) {
        if (labels.length == 0) {
            throw new IllegalArgumentException("Aucune ligne d'entraînement");
        }
        double rate = Arrays.stream(labels).average().orElseThrow();
        return x -> {
            double[] out = new double[x.length];
            Arrays.fill(out, rate);
            return out;
        };
    }
}
