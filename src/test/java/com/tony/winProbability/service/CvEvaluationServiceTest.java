package com.tony.winProbability.service;

import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.model.AucEstimate;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.EvaluationReport;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.PredictionMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CvEvaluationServiceTest {

    private CvEvaluationService evaluator;
    private FoldAssignment folds;
    private int[] labels;

    @BeforeEach
    void setUp() {
        evaluator = new CvEvaluationService();
        // V impair + labels alternés : chaque fold contient 10 positifs et 10 négatifs
        folds = new FoldPlanService().assign(100, 5);
        labels = new int[100];
        for (int i = 0; i < labels.length; i++) labels[i] = i % 2;
    }

    @Test
    @DisplayName("Un séparateur parfait a une AUC exactement égale à 1")
    void perfectSeparatorHasAucOfOne() {
        double[] predictions = new double[labels.length];
        for (int i = 0; i < labels.length; i++) predictions[i] = labels[i];

        AucEstimate estimate = evaluator.estimateWithInterval("perfect", predictions, labels, folds);

        assertThat(estimate.getCvAuc()).isEqualTo(1.0);
        assertThat(estimate.getFoldAucs()).hasSize(5).containsOnly(1.0);
        assertThat(estimate.getStandardError()).isEqualTo(0.0);
        assertThat(estimate.getCiLower()).isEqualTo(1.0);
        assertThat(estimate.getCiUpper()).isEqualTo(1.0);
        assertThat(estimate.getBrierScore()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Des prédictions indépendantes du label donnent 0.5, à l'intérieur de l'intervalle")
    void labelIndependentPredictionsGiveOneHalf() {
        // Les lignes i et i+5 (même fold, labels opposés) partagent la même prédiction
        double[] predictions = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            int block = i / 10;
            int pair = (i % 10) % 5;
            predictions[i] = (block * 5 + pair + 0.5) / 50.0;
        }

        AucEstimate estimate = evaluator.estimateWithInterval("noise", predictions, labels, folds);

        assertThat(estimate.getCvAuc()).isCloseTo(0.5, within(1e-12));
        assertThat(estimate.hasConfidenceInterval()).isTrue();
        assertThat(estimate.getCiLower()).isLessThan(0.5);
        assertThat(estimate.getCiUpper()).isGreaterThan(0.5);
    }

    @Test
    @DisplayName("Bruit aléatoire sur 2000 lignes : AUC proche de 0.5 et erreur standard positive")
    void randomNoiseIsNearOneHalf() {
        Random random = new Random(42);
        int n = 2000;
        int[] y = new int[n];
        double[] predictions = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = random.nextBoolean() ? 1 : 0;
            predictions[i] = random.nextDouble();
        }
        FoldAssignment tenFolds = new FoldPlanService().assign(n, 10);

        AucEstimate estimate = evaluator.estimateWithInterval("noise", predictions, y, tenFolds);

        assertThat(estimate.getCvAuc()).isCloseTo(0.5, within(0.1));
        assertThat(estimate.getStandardError()).isPositive();
        assertThat(estimate.getCiLower()).isGreaterThanOrEqualTo(0.0);
        assertThat(estimate.getCiUpper()).isLessThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Un fold sans positif rend l'AUC indéfinie et nomme le fold")
    void singleClassFoldIsNumericalInstability() {
        // V = 2 et labels alternés : le fold 0 ne contient que des négatifs
        FoldAssignment twoFolds = new FoldPlanService().assign(10, 2);
        int[] y = new int[10];
        for (int i = 0; i < y.length; i++) y[i] = i % 2;

        assertThatThrownBy(() -> evaluator.estimateWithInterval("x", new double[10], y, twoFolds))
                .isInstanceOf(NumericalInstabilityException.class)
                .hasMessageContaining("fold 0");
    }

    @Test
    @DisplayName("L'ensemble est évalué sur Z·w, sans intervalle de confiance")
    void ensembleHasPointEstimateOnly() {
        double[] perfect = new double[labels.length];
        double[] inverted = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            perfect[i] = labels[i];
            inverted[i] = 1 - labels[i];
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("perfect", perfect);
        columns.put("inverted", inverted);
        PredictionMatrix z = PredictionMatrix.fromColumns(columns);
        CombinationWeights weights = CombinationWeights.of(CombinationMethod.NNLOGLIK, List.of("perfect", "inverted"),
                new double[]{0.8, 0.2}, new double[]{0.0, 1.0}, true);

        EvaluationReport report = evaluator.evaluate(z, labels, folds, weights);

        assertThat(report.getLearners()).extracting(AucEstimate::getName).containsExactly("perfect", "inverted");
        assertThat(report.learner("inverted").getCvAuc()).isEqualTo(0.0);
        assertThat(report.getEnsemble().getCvAuc()).isEqualTo(1.0);
        assertThat(report.getEnsemble().hasConfidenceInterval()).isFalse();
        assertThat(report.getEnsemble().getStandardError()).isNull();
        assertThat(report.getConfidenceLevel()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Brier et log-loss d'une prédiction constante à 0.5")
    void backtestMetricsOfConstantPrediction() {
        double[] half = new double[labels.length];
        Arrays.fill(half, 0.5);

        assertThat(evaluator.brierScore(half, labels)).isCloseTo(0.25, within(1e-12));
        assertThat(evaluator.logLoss(half, labels)).isCloseTo(Math.log(2), within(1e-12));
    }

    @Test
    @DisplayName("La log-loss est plafonnée pour une prédiction certaine et fausse")
    void logLossIsFloored() {
        assertThat(evaluator.logLoss(new double[]{0.0}, new int[]{1})).isCloseTo(-Math.log(1e-15), within(1e-9));
    }
}
