package com.tony.winProbability.model;

/**
 * Données importées : observations d'entraînement et fréquences empiriques de victoire et de nul.
 */
public record GameStateDataset(Dataset dataset, EmpiricalRateTable winRates, EmpiricalRateTable tieRates) {
}
