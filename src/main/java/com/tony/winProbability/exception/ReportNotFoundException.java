package com.tony.winProbability.exception;

public class ReportNotFoundException extends SuperLearnerException {

    public ReportNotFoundException() {
        super("Aucun run terminé pour le moment");
    }
}
