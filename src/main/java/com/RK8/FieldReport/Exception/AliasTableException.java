package com.RK8.FieldReport.Exception;

import java.util.Map;

public class AliasTableException extends ReportException {

    public AliasTableException(String location, String message) {
        super(ErrorCode.ALIAS_TABLE_INVALID, message, Map.of("location", location));
    }

    public AliasTableException(String location, String message, Throwable cause) {
        super(ErrorCode.ALIAS_TABLE_INVALID, message, Map.of("location", location), cause);
    }
}
