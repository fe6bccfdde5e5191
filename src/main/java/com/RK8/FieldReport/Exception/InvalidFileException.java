package com.RK8.FieldReport.Exception;

import java.util.Map;

public class InvalidFileException extends ReportException {

    public InvalidFileException(String field, String message) {
        super(ErrorCode.INVALID_FILE, message, Map.of("field", field));
    }

    public InvalidFileException(String field, String message, Throwable cause) {
        super(ErrorCode.INVALID_FILE, message, Map.of("field", field), cause);
    }
}
