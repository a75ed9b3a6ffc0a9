package com.pvmetrics.exception;

public class InvalidEvaluationOptionsException extends PvMetricsException {
    public InvalidEvaluationOptionsException(String message) {
        super("INVALID_EVALUATION_OPTIONS", message);
    }
    public InvalidEvaluationOptionsException(String message, Throwable cause) {
        super("INVALID_EVALUATION_OPTIONS", message, cause);
    }
}
