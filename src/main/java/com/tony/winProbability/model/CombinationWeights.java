package com.tony.winProbability.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Poids du méta-modèle, indexés par nom d'apprenant, avec le risque CV de chaque apprenant.
 */
@Getter
public final class CombinationWeights {

    private final CombinationMethod method;
    private final Map<String, Double> weights;
    private final Map<String, Double> cvRisk;
    private final boolean normalized;

    public CombinationWeights(CombinationMethod method, Map<String, Double> weights,
                              Map<String, Double> cvRisk, boolean normalized) {
        weights.forEach((name, w) -> {
            if (w == null || !Double.isFinite(w) || w < 0) {
                throw new IllegalArgumentException("Poids invalide pour " + name + " : " + w);
            }
        });
        this.method = method;
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
        this.cvRisk = Collections.unmodifiableMap(new LinkedHashMap<>(cvRisk));
        this.normalized = normalized;
    }

    public static CombinationWeights of(CombinationMethod method, List<String> learnerNames, double[] vector,
                                        double[] risks, boolean normalized) {
        Map<String, Double> w = new LinkedHashMap<>();
        Map<String, Double> r = new LinkedHashMap<>();
        for (int l = 0; l < learnerNames.size(); l++) {
            w.put(learnerNames.get(l), vector[l]);
            r.put(learnerNames.get(l), risks[l]);
        }
        return new CombinationWeights(method, w, r, normalized);
    }

    public double weightOf(String learnerName) {
        return weights.getOrDefault(learnerName, 0.0);
    }

    public double sum() {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double[] toVector(List<String> learnerNames) {
        double[] out = new double[learnerNames.size()];
        for (int l = 0; l < out.length; l++) out[l] = weightOf(learnerNames.get(l));
        return out;
    }
}
