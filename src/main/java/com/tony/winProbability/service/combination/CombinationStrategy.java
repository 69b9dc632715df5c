package com.tony.winProbability.service.combination;

import com.tony.winProbability.model.CombinationMethod;
import com.tony.winProbability.model.CombinationWeights;
import com.tony.winProbability.model.PredictionMatrix;

/**
 * Méta-apprenant : transforme Z et les labels en poids non négatifs.
 */
public interface CombinationStrategy {

    CombinationMethod method();

    CombinationWeights solve(PredictionMatrix z, int[] labels);
}
