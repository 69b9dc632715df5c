package com.tony.winProbability.exception;

import lombok.Getter;

import java.util.OptionalInt;

/**
 * Un apprenant a échoué sur un fold donné (ou sur l'ajustement complet).
 * Une matrice Z partielle étant inutilisable, le run entier est interrompu.
 */
@Getter
public class LearnerTrainingException extends SuperLearnerException {

    private final String learnerName;
    private final Integer fold; // null = ajustement sur toutes les données

    public LearnerTrainingException(String learnerName, Integer fold, String reason, Throwable cause) {
        super(describe(learnerName, fold, reason), cause);
        this.learnerName = learnerName;
        this.fold = fold;
    }

    public LearnerTrainingException(String learnerName, Integer fold, String reason) {
        this(learnerName, fold, reason, null);
    }

    public OptionalInt foldIndex() {
        return fold == null ? OptionalInt.empty() : OptionalInt.of(fold);
    }

    private static String describe(String learnerName, Integer fold, String reason) {
        String where = fold == null ? "ajustement complet" : "fold " + fold;
        return "Apprenant '" + learnerName + "' en échec (" + where + ") : " + reason;
    }
}
