package com.tony.winProbability.learner;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Centrage-réduction appris sur les lignes d'entraînement d'un fold.
 */
final class FeatureScaler {

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    static FeatureScaler fit(double[][] features) {
        int p = features[0].length;
        double[] means = new double[p];
        double[] scales = new double[p];
        for (int j = 0; j < p; j++) {
            double[] column = new double[features.length];
            for (int i = 0; i < features.length; i++) column[i] = features[i][j];
            means[j] = new Mean().evaluate(column);
            double sd = new StandardDeviation(false).evaluate(column);
            // Colonne constante : on ne réduit pas
            scales[j] = sd > 0 ? sd : 1.0;
        }
        return new FeatureScaler(means, scales);
    }

    double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) out[j] = (row[j] - means[j]) / scales[j];
        return out;
    }

    double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) out[i] = transform(rows[i]);
        return out;
    }
}
