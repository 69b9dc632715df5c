package com.tony.winProbability.model;

import java.util.List;

/**
 * Jeu de données en lecture seule. Les matrices sont copiées une fois à la construction
 * puis servies par copie, pour que les workers parallèles ne partagent rien de mutable.
 */
public final class Dataset {

    private final List<Observation> observations;
    private final int featureCount;
    private final double[][] features;
    private final int[] labels;

    public Dataset(List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("Le jeu de données est vide");
        }
        this.observations = List.copyOf(observations);
        this.featureCount = observations.get(0).featureCount();
        this.features = new double[observations.size()][];
        this.labels = new int[observations.size()];

        for (int i = 0; i < observations.size(); i++) {
            Observation o = observations.get(i);
            if (o.featureCount() != featureCount) {
                throw new IllegalArgumentException("Ligne " + i + " : " + o.featureCount()
                        + " prédicteurs au lieu de " + featureCount);
            }
            features[i] = o.features();
            labels[i] = o.label();
        }
    }

    public int size() {
        return observations.size();
    }

    public int featureCount() {
        return featureCount;
    }

    public Observation observation(int row) {
        return observations.get(row);
    }

    public List<Observation> observations() {
        return observations;
    }

    public double[][] features() {
        return subsetFeatures(allRows());
    }

    public int[] labels() {
        return labels.clone();
    }

    public double[][] subsetFeatures(int[] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = features[rows[i]].clone();
        }
        return out;
    }

    public int[] subsetLabels(int[] rows) {
        int[] out = new int[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = labels[rows[i]];
        }
        return out;
    }

    private int[] allRows() {
        int[] rows = new int[labels.length];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        return rows;
    }
}
