package com.tony.winProbability.exception;

public class DatasetImportException extends SuperLearnerException {

    public DatasetImportException(String message) {
        super(message);
    }

    public DatasetImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
