package com.tony.winProbability.model;

import lombok.Builder;
import lombok.Value;

/**
 * Tranche [lowerBound, upperBound) de probabilités prédites (la dernière tranche inclut 1).
 */
@Value
@Builder
public class CalibrationBin {
    double lowerBound;
    double upperBound;
    double meanPredicted;
    Double meanEmpirical; // null si aucune cellule de la tranche n'a de fréquence observée
    int count;            // cellules sans fréquence observée comprises
    int empiricalCount;
}
