package com.tony.winProbability.service.combination;

import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.PredictionMatrix;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Moindres carrés non négatifs (Lawson-Hanson) de labels ~ Z·w.
 * Les sous-problèmes passent par une SVD, qui reste définie quand deux apprenants sont colinéaires.
 * <p>
 * Le choix entre poids bruts et poids renormalisés se fait hors échantillon : sur Z les poids bruts
 * minimisent déjà l'erreur quadratique, la comparaison n'y départagerait rien.
 */
@Slf4j
public class NnlsCombination implements CombinationStrategy {

    private static final double TOLERANCE = 1e-10;
    static final int DEFAULT_FOLDS = 10;

    private final FoldAssignment folds;

    /**
     * @param folds plan de validation des lignes de Z ; {@code null} pour un plan i mod V par défaut
     */
    public NnlsCombination(FoldAssignment folds) {
        this.folds = folds;
    }

    @Override
    public CombinationMethod method() {
        return CombinationMethod.NNLS;
    }

    @Override
    public CombinationWeights solve(PredictionMatrix z, int[] labels) {
        RealMatrix a = new Array2DRowRealMatrix(z.toArray(), false);
        RealVector b = new ArrayRealVector(Arrays.stream(labels).asDoubleStream().toArray(), false);
        int learners = z.learnerCount();

        double[] raw = lawsonHanson(a, b);
        double[] risks = new double[learners];
        for (int l = 0; l < learners; l++) {
            risks[l] = squaredError(a.getColumnVector(l), b);
        }

        double sum = Arrays.stream(raw).sum();
        if (sum <= 0.0) {
            // Z dégénérée : tous les poids sont nuls, repli sur l'uniforme
            log.warn("⚠️ NNLS : tous les apprenants ont un poids nul, poids uniformes appliqués");
            return CombinationWeights.of(method(), z.learnerNames(), uniform(learners), risks, true);
        }

        double[] normalized = Arrays.stream(raw).map(w -> w / sum).toArray();
        FoldAssignment plan = folds != null ? folds : defaultPlan(z.rowCount());
        if (plan == null) {
            return CombinationWeights.of(method(), z.learnerNames(), raw, risks, false);
        }

        double[] heldOut = heldOutRisks(a, b, plan);
        if (heldOut[1] <= heldOut[0]) {
            log.debug("NNLS : renormalisation retenue (risque hors-fold {} <= {})", heldOut[1], heldOut[0]);
            return CombinationWeights.of(method(), z.learnerNames(), normalized, risks, true);
        }
        log.info("NNLS : renormalisation refusée (risque hors-fold {} > {})", heldOut[1], heldOut[0]);
        return CombinationWeights.of(method(), z.learnerNames(), raw, risks, false);
    }

    /**
     * Risque quadratique moyen sur les folds, {brut, renormalisé}, des poids ajustés sans le fold évalué.
     * Un fold d'entraînement dégénéré (poids tous nuls) est renormalisé vers l'uniforme, comme l'ajustement complet.
     */
    private double[] heldOutRisks(RealMatrix a, RealVector b, FoldAssignment plan) {
        int[] columns = new int[a.getColumnDimension()];
        for (int j = 0; j < columns.length; j++) columns[j] = j;

        double rawRisk = 0.0;
        double normalizedRisk = 0.0;
        for (int f = 0; f < plan.foldCount(); f++) {
            int[] train = plan.trainingRows(f);
            int[] validation = plan.validationRows(f);

            double[] fitted = lawsonHanson(a.getSubMatrix(train, columns), subVector(b, train));
            double foldSum = Arrays.stream(fitted).sum();
            double[] rescaled = foldSum > 0.0
                    ? Arrays.stream(fitted).map(w -> w / foldSum).toArray()
                    : uniform(columns.length);

            RealMatrix heldOut = a.getSubMatrix(validation, columns);
            RealVector expected = subVector(b, validation);
            rawRisk += squaredError(heldOut.operate(new ArrayRealVector(fitted, false)), expected);
            normalizedRisk += squaredError(heldOut.operate(new ArrayRealVector(rescaled, false)), expected);
        }
        return new double[]{rawRisk / plan.foldCount(), normalizedRisk / plan.foldCount()};
    }

    private static FoldAssignment defaultPlan(int rows) {
        if (rows < 2) return null;
        int v = Math.min(DEFAULT_FOLDS, rows);
        int[] assignment = new int[rows];
        for (int i = 0; i < rows; i++) assignment[i] = i % v;
        return new FoldAssignment(assignment, v);
    }

    private static RealVector subVector(RealVector v, int[] rows) {
        double[] values = new double[rows.length];
        for (int k = 0; k < rows.length; k++) values[k] = v.getEntry(rows[k]);
        return new ArrayRealVector(values, false);
    }

    private static double[] uniform(int size) {
        double[] weights = new double[size];
        Arrays.fill(weights, 1.0 / size);
        return weights;
    }

    private double[] lawsonHanson(RealMatrix a, RealVector b) {
        int p = a.getColumnDimension();
        int maxIterations = 3 * Math.max(p, 1);
        double[] x = new double[p];
        boolean[] passive = new boolean[p];

        RealVector gradient = a.transpose().operate(b.subtract(a.operate(new ArrayRealVector(x))));
        int iterations = 0;

        while (true) {
            int candidate = -1;
            double best = TOLERANCE;
            for (int j = 0; j < p; j++) {
                if (!passive[j] && gradient.getEntry(j) > best) {
                    best = gradient.getEntry(j);
                    candidate = j;
                }
            }
            if (candidate < 0) break;
            passive[candidate] = true;

            double[] s = solvePassive(a, b, passive);
            while (minPassive(s, passive) <= 0.0) {
                if (++iterations > maxIterations) {
                    throw new NumericalInstabilityException("NNLS non convergent après " + maxIterations
                            + " itérations internes, poids courants " + Arrays.toString(x));
                }
                double alpha = Double.POSITIVE_INFINITY;
                for (int j = 0; j < p; j++) {
                    if (passive[j] && s[j] <= 0.0) {
                        alpha = Math.min(alpha, x[j] / (x[j] - s[j]));
                    }
                }
                for (int j = 0; j < p; j++) {
                    x[j] += alpha * (s[j] - x[j]);
                    if (passive[j] && x[j] <= TOLERANCE) {
                        passive[j] = false;
                        x[j] = 0.0;
                    }
                }
                s = solvePassive(a, b, passive);
            }
            x = s;

            if (++iterations > maxIterations) {
                throw new NumericalInstabilityException("NNLS non convergent après " + maxIterations
                        + " itérations, poids courants " + Arrays.toString(x));
            }
            gradient = a.transpose().operate(b.subtract(a.operate(new ArrayRealVector(x))));
        }
        return x;
    }

    private double[] solvePassive(RealMatrix a, RealVector b, boolean[] passive) {
        List<Integer> columns = new ArrayList<>();
        for (int j = 0; j < passive.length; j++) {
            if (passive[j]) columns.add(j);
        }
        double[] s = new double[passive.length];
        if (columns.isEmpty()) return s;

        int[] rows = new int[a.getRowDimension()];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        RealMatrix sub = a.getSubMatrix(rows, columns.stream().mapToInt(Integer::intValue).toArray());
        RealVector solution = new SingularValueDecomposition(sub).getSolver().solve(b);
        for (int k = 0; k < columns.size(); k++) {
            s[columns.get(k)] = solution.getEntry(k);
        }
        return s;
    }

    private static double minPassive(double[] s, boolean[] passive) {
        double min = Double.POSITIVE_INFINITY;
        for (int j = 0; j < s.length; j++) {
            if (passive[j]) min = Math.min(min, s[j]);
        }
        return min;
    }

    private static double squaredError(RealVector predicted, RealVector labels) {
        RealVector residual = labels.subtract(predicted);
        return residual.dotProduct(residual) / labels.getDimension();
    }
}
