package com.RK8.FieldReport.Exception;

/**
 * The run was stopped from outside (timeout, interruption) rather than failing on
 * its own inputs.
 */
public class ReportAbortedException extends ReportException {

    public ReportAbortedException(String message) {
        super(ErrorCode.ABORTED, message);
    }

    public ReportAbortedException(String message, Throwable cause) {
        super(ErrorCode.ABORTED, message, null, cause);
    }
}
