package com.tony.winProbability.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Objectif utilisé par le méta-modèle pour combiner les prédictions hors-fold.
 */
public enum CombinationMethod {
    /** Moindres carrés non négatifs sur Z, renormalisés si le risque hors-fold ne se dégrade pas. */
    NNLS,
    /** Log-vraisemblance binomiale maximisée sur le simplexe. */
    NNLOGLIK;

    /**
     * Lecture JSON insensible à la casse, comme la configuration ({@code nnls}, {@code nnloglik}).
     */
    @JsonCreator
    public static CombinationMethod fromValue(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(m -> m.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Méthode de combinaison inconnue '" + value + "', attendu : "
                        + Arrays.stream(values()).map(m -> m.name().toLowerCase()).collect(Collectors.joining(", "))));
    }
}
