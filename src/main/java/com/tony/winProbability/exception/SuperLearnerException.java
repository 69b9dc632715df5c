package com.tony.winProbability.exception;

/**
 * Racine des erreurs du pipeline. Aucune n'est rejouée automatiquement :
 * le message doit suffire pour relancer le run après correction.
 */
public abstract class SuperLearnerException extends RuntimeException {

    protected SuperLearnerException(String message) {
        super(message);
    }

    protected SuperLearnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
