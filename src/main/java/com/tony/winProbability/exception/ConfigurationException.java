package com.tony.winProbability.exception;

/**
 * Paramétrage invalide (nombre de folds, apprenants, plages de grille, largeur de tranche).
 * Levée avant tout entraînement.
 */
public class ConfigurationException extends SuperLearnerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
