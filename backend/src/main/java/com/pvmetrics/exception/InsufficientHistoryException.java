package com.pvmetrics.exception;

public class InsufficientHistoryException extends PvMetricsException {
    public InsufficientHistoryException(String entityId, String requirement) {
        super("INSUFFICIENT_HISTORY", "Entity '" + entityId + "' has too little history: " + requirement + ".");
    }
}
