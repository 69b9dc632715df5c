package com.tony.winProbability.service.combination;

import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.PredictionMatrix;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Maximisation de la log-vraisemblance binomiale de p = Z·w sur le simplexe.
 * <p>
 * Pour un label y, la vraisemblance d'une ligne vaut Σ w_l q_l avec q_l = z_l si y = 1, 1 - z_l sinon :
 * c'est un mélange, et la mise à jour multiplicative w_l ← w_l · mean(q_l / p) (algorithme EM) monte
 * la vraisemblance à chaque pas sans quitter le simplexe. L'objectif étant concave, le point fixe est l'optimum.
 */
@Slf4j
public class NnLogLikCombination implements CombinationStrategy {

    /** Bornes d'écrêtage de Z avant le log. */
    public static final double EPSILON = 1e-15;

    private final int maxIterations;
    private final double tolerance;

    public NnLogLikCombination(int maxIterations, double tolerance) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    @Override
    public CombinationMethod method() {
        return CombinationMethod.NNLOGLIK;
    }

    @Override
    public CombinationWeights solve(PredictionMatrix z, int[] labels) {
        int n = z.rowCount();
        int learners = z.learnerCount();

        // q[i][l] : probabilité attribuée par l'apprenant l au label réellement observé
        double[][] q = new double[n][learners];
        double[] risks = new double[learners];
        for (int i = 0; i < n; i++) {
            double[] row = z.row(i);
            for (int l = 0; l < learners; l++) {
                double p = clamp(row[l]);
                q[i][l] = labels[i] == 1 ? p : 1.0 - p;
                risks[l] -= Math.log(q[i][l]) / n;
            }
        }

        double[] w = new double[learners];
        Arrays.fill(w, 1.0 / learners);
        double logLik = logLikelihood(q, w);

        for (int iter = 1; iter <= maxIterations; iter++) {
            double[] next = new double[learners];
            for (int i = 0; i < n; i++) {
                double p = mix(q[i], w);
                for (int l = 0; l < learners; l++) {
                    next[l] += w[l] * q[i][l] / p;
                }
            }
            double total = Arrays.stream(next).sum();
            for (int l = 0; l < learners; l++) next[l] /= total;

            double nextLogLik = logLikelihood(q, next);
            boolean converged = Math.abs(nextLogLik - logLik) <= tolerance * Math.max(1.0, Math.abs(logLik));
            w = next;
            logLik = nextLogLik;

            if (converged) {
                log.debug("NNLOGLIK convergé en {} itérations, logL={}", iter, logLik);
                return CombinationWeights.of(method(), z.learnerNames(), w, risks, true);
            }
        }

        throw new NumericalInstabilityException("NNLOGLIK non convergent après " + maxIterations
                + " itérations : poids " + Arrays.toString(w) + ", logL=" + logLik);
    }

    private static double logLikelihood(double[][] q, double[] w) {
        double sum = 0;
        for (double[] row : q) sum += Math.log(mix(row, w));
        return sum;
    }

    private static double mix(double[] row, double[] w) {
        double p = 0;
        for (int l = 0; l < w.length; l++) p += w[l] * row[l];
        return p;
    }

    static double clamp(double p) {
        return Math.max(EPSILON, Math.min(1.0 - EPSILON, p));
    }
}
