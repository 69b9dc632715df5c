package com.tony.winProbability.learner;

import com.tony.winProbability.config.SuperLearnerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * k plus proches voisins sur prédicteurs centrés-réduits : la probabilité est la part de labels positifs
 * parmi les voisins. Capte les interactions écart x temps que la logistique linéaire ignore.
 */
@Component
public class KNearestNeighborsLearner implements BaseLearner {

    public static final String NAME = "knn";

    private final int neighbors;

    @Autowired
    public KNearestNeighborsLearner(SuperLearnerProperties properties) {
        this(properties.getKnnNeighbors());
    }

    public KNearestNeighborsLearner(int neighbors) {
        if (neighbors < 1) {
            throw new IllegalArgumentException("k doit être >= 1 : " + neighbors);
        }
        this.neighbors = neighbors;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TrainedModel train(double[][] features, int[] labels, long seed) {
        if (labels.length == 0) {
            throw new IllegalArgumentException("Aucune ligne d'entraînement");
        }
        FeatureScaler scaler = FeatureScaler.fit(features);
        double[][] reference = scaler.transform(features);
        int[] referenceLabels = labels.clone();
        int k = Math.min(neighbors, reference.length);

        return rows -> {
            double[] out = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                out[i] = vote(scaler.transform(rows[i]), reference, referenceLabels, k);
            }
            return out;
        };
    }

    private static double vote(double[] query, double[][] reference, int[] labels, int k) {
        // Tas max de taille k sur (distance, index)
        PriorityQueue<double[]> nearest = new PriorityQueue<>(k,
                Comparator.<double[]>comparingDouble(e -> e[0]).thenComparingDouble(e -> e[1]).reversed());
        for (int r = 0; r < reference.length; r++) {
            double d = squaredDistance(query, reference[r]);
            if (nearest.size() < k) {
                nearest.add(new double[]{d, r});
            } else {
                // Parcours par index croissant : à distance égale, le premier voisin retenu reste
                if (d < nearest.peek()[0]) {
                    nearest.poll();
                    nearest.add(new double[]{d, r});
                }
            }
        }
        double positives = 0;
        for (double[] e : nearest) positives += labels[(int) e[1]];
        return positives / nearest.size();
    }

    private static double squaredDistance(double[] a, double[] b) {
        double sum = 0;
        for (int j = 0; j < a.length; j++) {
            double diff = a[j] - b[j];
            sum += diff * diff;
        }
        return sum;
    }
}
