package com.pvmetrics.exception;

import lombok.Getter;

@Getter
public abstract class PvMetricsException extends RuntimeException {
    private final String errorCode;
    protected PvMetricsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected PvMetricsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
