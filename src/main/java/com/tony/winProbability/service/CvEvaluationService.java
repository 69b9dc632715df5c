package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.model.AucEstimate;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.EvaluationReport;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.PredictionMatrix;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * AUC validée croisée (moyenne des AUC par fold) avec intervalle de confiance par la fonction d'influence,
 * plus les métriques de backtest (Brier, log-loss) sur les prédictions hors-fold.
 */
@Service
@Slf4j
public class CvEvaluationService {

    public static final double CONFIDENCE_LEVEL = 0.95;
    private static final double LOG_FLOOR = 1e-15;

    private final NaturalRanking ranking = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);
    private final double zCritical = new NormalDistribution().inverseCumulativeProbability(1 - (1 - CONFIDENCE_LEVEL) / 2);

    public EvaluationReport evaluate(PredictionMatrix z, int[] labels, FoldAssignment folds, CombinationWeights weights) {
        if (z.rowCount() != labels.length || folds.size() != labels.length) {
            throw new ConfigurationException("Tailles incohérentes : Z=" + z.rowCount() + ", labels=" + labels.length
                    + ", folds=" + folds.size());
        }

        List<AucEstimate> learners = new ArrayList<>();
        for (String name : z.learnerNames()) {
            AucEstimate estimate = estimateWithInterval(name, z.column(name), labels, folds);
            learners.add(estimate);
            log.info("🎯 {} : cvAUC={} IC95%=[{}, {}] Brier={} LogLoss={}", name,
                    String.format("%.4f", estimate.getCvAuc()),
                    String.format("%.4f", estimate.getCiLower()),
                    String.format("%.4f", estimate.getCiUpper()),
                    String.format("%.4f", estimate.getBrierScore()),
                    String.format("%.4f", estimate.getLogLoss()));
        }

        // Les poids ont été ajustés sur ces mêmes prédictions hors-fold : l'AUC de l'ensemble est optimiste
        // et son intervalle n'a pas de couverture garantie sans validation croisée imbriquée. On n'en publie pas.
        double[] ensemblePredictions = z.combine(weights);
        AucEstimate ensemble = pointEstimate("ensemble", ensemblePredictions, labels, folds);
        log.info("🏆 Ensemble : cvAUC={} Brier={} LogLoss={}",
                String.format("%.4f", ensemble.getCvAuc()),
                String.format("%.4f", ensemble.getBrierScore()),
                String.format("%.4f", ensemble.getLogLoss()));

        return EvaluationReport.builder()
                .learners(List.copyOf(learners))
                .ensemble(ensemble)
                .confidenceLevel(CONFIDENCE_LEVEL)
                .build();
    }

    public AucEstimate estimateWithInterval(String name, double[] predictions, int[] labels, FoldAssignment folds) {
        int n = labels.length;
        int positives = 0;
        for (int y : labels) positives += y;
        if (positives == 0 || positives == n) {
            throw new NumericalInstabilityException("AUC indéfinie pour " + name + " : une seule classe dans les données");
        }
        double w1 = (double) n / positives;
        double w0 = (double) n / (n - positives);

        double[] foldAucs = new double[folds.foldCount()];
        double variance = 0;
        for (int f = 0; f < folds.foldCount(); f++) {
            FoldRanks r = rankFold(name, f, predictions, labels, folds.validationRows(f));
            foldAucs[f] = r.auc();

            double sumSquares = 0;
            for (int k = 0; k < r.rows.length; k++) {
                double ic;
                if (r.labels[k] == 1) {
                    double fracNegSmaller = (r.rankAll[k] - r.rankWithinClass[k]) / r.n0;
                    ic = w1 * (fracNegSmaller - foldAucs[f]);
                } else {
                    double fracPosLarger = (r.n1 - (r.rankAll[k] - r.rankWithinClass[k])) / r.n1;
                    ic = w0 * (fracPosLarger - foldAucs[f]);
                }
                sumSquares += ic * ic;
            }
            variance += sumSquares / r.rows.length;
        }
        variance /= folds.foldCount();

        double cvAuc = mean(foldAucs);
        double se = Math.sqrt(variance / n);
        return AucEstimate.builder()
                .name(name)
                .cvAuc(cvAuc)
                .foldAucs(toList(foldAucs))
                .standardError(se)
                .ciLower(Math.max(0.0, cvAuc - zCritical * se))
                .ciUpper(Math.min(1.0, cvAuc + zCritical * se))
                .brierScore(brierScore(predictions, labels))
                .logLoss(logLoss(predictions, labels))
                .build();
    }

    public AucEstimate pointEstimate(String name, double[] predictions, int[] labels, FoldAssignment folds) {
        double[] foldAucs = new double[folds.foldCount()];
        for (int f = 0; f < folds.foldCount(); f++) {
            foldAucs[f] = rankFold(name, f, predictions, labels, folds.validationRows(f)).auc();
        }
        return AucEstimate.builder()
                .name(name)
                .cvAuc(mean(foldAucs))
                .foldAucs(toList(foldAucs))
                .brierScore(brierScore(predictions, labels))
                .logLoss(logLoss(predictions, labels))
                .build();
    }

    public double brierScore(double[] predictions, int[] labels) {
        double sum = 0;
        for (int i = 0; i < labels.length; i++) {
            sum += Math.pow(predictions[i] - labels[i], 2);
        }
        return sum / labels.length;
    }

    public double logLoss(double[] predictions, int[] labels) {
        double sum = 0;
        for (int i = 0; i < labels.length; i++) {
            double p = labels[i] == 1 ? predictions[i] : 1 - predictions[i];
            sum -= Math.log(Math.max(p, LOG_FLOOR));
        }
        return sum / labels.length;
    }

    /**
     * Rangs moyens d'un fold, sur toutes les lignes puis à l'intérieur de chaque classe.
     * rankAll - rankWithinClass compte, pour une ligne, les lignes de l'autre classe classées sous elle (égalités pour 1/2).
     */
    private FoldRanks rankFold(String name, int fold, double[] predictions, int[] allLabels, int[] rows) {
        double[] values = new double[rows.length];
        int[] labels = new int[rows.length];
        int n1 = 0;
        for (int k = 0; k < rows.length; k++) {
            values[k] = predictions[rows[k]];
            labels[k] = allLabels[rows[k]];
            n1 += labels[k];
        }
        int n0 = rows.length - n1;
        if (n1 == 0 || n0 == 0) {
            throw new NumericalInstabilityException("AUC indéfinie pour " + name + " : le fold " + fold
                    + " ne contient qu'une classe (" + n1 + " positifs, " + n0 + " négatifs)");
        }

        double[] rankAll = rankOrFail(name, fold, values);
        double[] rankWithinClass = new double[rows.length];
        for (int cls = 0; cls <= 1; cls++) {
            int size = cls == 1 ? n1 : n0;
            double[] subset = new double[size];
            int[] positions = new int[size];
            int j = 0;
            for (int k = 0; k < rows.length; k++) {
                if (labels[k] == cls) {
                    subset[j] = values[k];
                    positions[j++] = k;
                }
            }
            double[] ranks = rankOrFail(name, fold, subset);
            for (int m = 0; m < size; m++) rankWithinClass[positions[m]] = ranks[m];
        }

        double r1 = 0;
        for (int k = 0; k < rows.length; k++) {
            if (labels[k] == 1) r1 += rankAll[k];
        }
        double auc = (r1 - n1 * (n1 + 1) / 2.0) / ((double) n1 * n0);
        return new FoldRanks(rows, labels, rankAll, rankWithinClass, n1, n0, auc);
    }

    private double[] rankOrFail(String name, int fold, double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new NumericalInstabilityException("Prédiction non finie (" + v + ") pour " + name + " dans le fold " + fold);
            }
        }
        return ranking.rank(values);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static List<Double> toList(double[] values) {
        List<Double> out = new ArrayList<>(values.length);
        for (double v : values) out.add(v);
        return List.copyOf(out);
    }

    private record FoldRanks(int[] rows, int[] labels, double[] rankAll, double[] rankWithinClass,
                             double n1, double n0, double auc) {
    }
}
