package com.tony.winProbability.learner;

import com.tony.winProbability.config.SuperLearnerProperties;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.FastMath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Régression logistique à pénalité ridge, ajustée par moindres carrés repondérés (IRLS).
 * L'intercept n'est pas pénalisé ; la pénalité est proportionnelle au nombre de lignes.
 */
@Component
public class LogisticRegressionLearner implements BaseLearner {

    public static final String NAME = "logistic";

    private static final int MAX_ITERATIONS = 100;
    private static final double TOLERANCE = 1e-8;
    private static final double PROB_FLOOR = 1e-10;

    private final double ridge;

    @Autowired
    public LogisticRegressionLearner(SuperLearnerProperties properties) {
        this(properties.getLogisticRidge());
    }

    public LogisticRegressionLearner(double ridge) {
        if (ridge < 0) {
            throw new IllegalArgumentException("La pénalité ridge doit être positive : " + ridge);
        }
        this.ridge = ridge;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TrainedModel train(double[][] features, int[] labels, long seed) {
        FeatureScaler scaler = FeatureScaler.fit(features);
        RealMatrix x = design(scaler.transform(features));
        int n = x.getRowDimension();
        int p = x.getColumnDimension();
        double penalty = ridge * n;

        RealVector beta = new ArrayRealVector(p);
        boolean converged = false;

        for (int iter = 0; iter < MAX_ITERATIONS && !converged; iter++) {
            RealVector eta = x.operate(beta);
            RealVector gradient = new ArrayRealVector(p);
            RealMatrix hessian = new Array2DRowRealMatrix(p, p);

            for (int i = 0; i < n; i++) {
                double mu = clamp(sigmoid(eta.getEntry(i)));
                double w = mu * (1.0 - mu);
                double residual = labels[i] - mu;
                for (int a = 0; a < p; a++) {
                    double xa = x.getEntry(i, a);
                    gradient.addToEntry(a, xa * residual);
                    for (int b = a; b < p; b++) {
                        hessian.addToEntry(a, b, w * xa * x.getEntry(i, b));
                    }
                }
            }
            for (int a = 0; a < p; a++) {
                for (int b = 0; b < a; b++) hessian.setEntry(a, b, hessian.getEntry(b, a));
            }
            // Pénalité sur les pentes uniquement (colonne 0 = intercept)
            for (int a = 1; a < p; a++) {
                gradient.addToEntry(a, -penalty * beta.getEntry(a));
                hessian.addToEntry(a, a, penalty);
            }

            RealVector step;
            try {
                step = new LUDecomposition(hessian).getSolver().solve(gradient);
            } catch (SingularMatrixException e) {
                throw new IllegalStateException("Hessienne singulière à l'itération " + iter, e);
            }
            beta = beta.add(step);
            converged = step.getLInfNorm() < TOLERANCE;
        }

        if (!converged) {
            throw new IllegalStateException("IRLS non convergent après " + MAX_ITERATIONS + " itérations");
        }

        double[] coefficients = beta.toArray();
        return rows -> {
            double[][] scaled = scaler.transform(rows);
            double[] out = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                double eta = coefficients[0];
                for (int j = 0; j < scaled[i].length; j++) eta += coefficients[j + 1] * scaled[i][j];
                out[i] = sigmoid(eta);
            }
            return out;
        };
    }

    private static RealMatrix design(double[][] scaled) {
        int p = scaled[0].length + 1;
        double[][] data = new double[scaled.length][p];
        for (int i = 0; i < scaled.length; i++) {
            data[i][0] = 1.0;
            System.arraycopy(scaled[i], 0, data[i], 1, scaled[i].length);
        }
        return new Array2DRowRealMatrix(data, false);
    }

    private static double sigmoid(double eta) {
        return 1.0 / (1.0 + FastMath.exp(-eta));
    }

    private static double clamp(double p) {
        return Math.max(PROB_FLOOR, Math.min(1.0 - PROB_FLOOR, p));
    }
}
