package com.tony.winProbability.service;

import com.tony.winProbability.exception.ConfigurationException;
import com.tony.winProbability.exception.NumericalInstabilityException;
import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.FoldAssignment;
import com.tony.winProbability.model.PredictionMatrix;
import com.tony.winProbability.service.combination.CombinationStrategy;
import com.tony.winProbability.service.combination.NnLogLikCombination;
import com.tony.winProbability.service.combination.NnlsCombination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WeightSolverService {

    public static final int DEFAULT_MAX_ITERATIONS = 100_000;
    public static final double DEFAULT_TOLERANCE = 1e-12;

    public CombinationWeights solve(PredictionMatrix z, int[] labels, CombinationMethod method) {
        return solve(z, labels, method, null, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public CombinationWeights solve(PredictionMatrix z, int[] labels, CombinationMethod method,
                                    int maxIterations, double tolerance) {
        return solve(z, labels, method, null, maxIterations, tolerance);
    }

    /**
     * Ajuste le méta-modèle sur Z. Z doit être complète : toute valeur non finie est signalée avec sa position.
     * Le plan de folds sert à NNLS pour arbitrer la renormalisation hors échantillon ; {@code null} = plan par défaut.
     */
    public CombinationWeights solve(PredictionMatrix z, int[] labels, CombinationMethod method, FoldAssignment folds,
                                    int maxIterations, double tolerance) {
        if (method == null) {
            throw new ConfigurationException("Méthode de combinaison non renseignée");
        }
        if (z.rowCount() != labels.length || (folds != null && folds.size() != labels.length)) {
            throw new ConfigurationException("Z a " + z.rowCount() + " lignes pour " + labels.length + " labels");
        }
        for (int i = 0; i < z.rowCount(); i++) {
            double[] row = z.row(i);
            for (int l = 0; l < row.length; l++) {
                if (!Double.isFinite(row[l])) {
                    throw new NumericalInstabilityException("Z[" + i + "][" + z.learnerNames().get(l) + "] = " + row[l]);
                }
            }
        }

        CombinationStrategy strategy = switch (method) {
            case NNLS -> new NnlsCombination(folds);
            case NNLOGLIK -> new NnLogLikCombination(maxIterations, tolerance);
        };
        CombinationWeights weights = strategy.solve(z, labels);

        log.info("⚖️ Poids {} : {} (normalisés : {})", method, weights.getWeights(), weights.isNormalized());
        log.info("📉 Risque CV par apprenant : {}", weights.getCvRisk());
        return weights;
    }
}
