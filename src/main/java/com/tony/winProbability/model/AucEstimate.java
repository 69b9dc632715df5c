package com.tony.winProbability.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AucEstimate {
    String name;
    double cvAuc;
    List<Double> foldAucs;

    // Null pour l'ensemble : pas d'intervalle valide sans validation croisée imbriquée
    Double standardError;
    Double ciLower;
    Double ciUpper;

    // Métriques de backtest sur les prédictions hors-fold
    double brierScore;
    double logLoss;

    public boolean hasConfidenceInterval() {
        return ciLower != null && ciUpper != null;
    }
}
