package com.tony.winProbability.exception;

/**
 * Solveur non convergent ou valeurs numériques dégénérées (NaN, fold mono-classe...).
 */
public class NumericalInstabilityException extends SuperLearnerException {

    public NumericalInstabilityException(String message) {
        super(message);
    }
}
