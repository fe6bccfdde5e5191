package com.RK8.FieldReport.Exception;

import com.RK8.FieldReport.DTO.ExtractKind;

import java.util.Map;

public class MalformedExtractException extends ReportException {

    public MalformedExtractException(ExtractKind kind, String message, Throwable cause) {
        super(ErrorCode.MALFORMED_EXTRACT,
                "Could not read " + kind.getDisplayName() + " file: " + message,
                Map.of("extract", kind.name()),
                cause);
    }
}
