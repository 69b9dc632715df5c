package com.tony.winProbability.model;

import com.tony.winProbability.exception.ConfigurationException;

/**
 * Bornes entières incluses d'une dimension de la grille.
 */
public record IntRange(int min, int max) {

    public static IntRange of(int min, int max) {
        return new IntRange(min, max);
    }

    public IntRange requireValid(String label) {
        if (min > max) {
            throw new ConfigurationException("Plage " + label + " invalide : min=" + min + " > max=" + max);
        }
        return this;
    }

    public int size() {
        return max - min + 1;
    }
}
