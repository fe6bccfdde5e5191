package com.RK8.FieldReport.Exception;

import lombok.Getter;

import java.util.Map;

/**
 * Base of every failure that aborts a report run. Carries the code and details the
 * caller needs to build a structured error response.
 */
@Getter
public abstract class ReportException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected ReportException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    protected ReportException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected ReportException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
