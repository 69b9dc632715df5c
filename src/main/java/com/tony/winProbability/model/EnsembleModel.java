package com.tony.winProbability.model;

import com.tony.winProbability.learner.TrainedModel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Artefact final d'un run : modèles ajustés sur toutes les données + poids du méta-modèle.
 * Si chaque composante prédit dans [0,1] et que les poids sont sur le simplexe, la sortie reste dans [0,1].
 */
public final class EnsembleModel {

    private final Map<String, TrainedModel> fullModels;
    private final CombinationWeights weights;

    public EnsembleModel(Map<String, TrainedModel> fullModels, CombinationWeights weights) {
        for (String name : weights.getWeights().keySet()) {
            if (!fullModels.containsKey(name)) {
                throw new IllegalArgumentException("Aucun modèle complet pour l'apprenant pondéré " + name);
            }
        }
        this.fullModels = Collections.unmodifiableMap(new LinkedHashMap<>(fullModels));
        this.weights = weights;
    }

    public CombinationWeights weights() {
        return weights;
    }

    public Map<String, TrainedModel> fullModels() {
        return fullModels;
    }

    public double[] predict(double[][] features) {
        double[] out = new double[features.length];
        for (Map.Entry<String, Double> e : weights.getWeights().entrySet()) {
            double w = e.getValue();
            if (w == 0.0) continue;
            double[] p = fullModels.get(e.getKey()).predict(features);
            if (p.length != features.length) {
                throw new IllegalStateException("L'apprenant " + e.getKey() + " a renvoyé " + p.length
                        + " prédictions pour " + features.length + " lignes");
            }
            for (int i = 0; i < out.length; i++) out[i] += w * p[i];
        }
        return out;
    }

    public double predict(double[] row) {
        return predict(new double[][]{row})[0];
    }
}
