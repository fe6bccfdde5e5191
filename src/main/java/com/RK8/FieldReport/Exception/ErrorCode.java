package com.RK8.FieldReport.Exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    MISSING_COLUMN("MISSING_COLUMN", 400),
    EMPTY_DATASET("EMPTY_DATASET", 400),
    DATE_RANGE_INVALID("DATE_RANGE_INVALID", 400),
    MALFORMED_EXTRACT("MALFORMED_EXTRACT", 400),
    INVALID_FILE("INVALID_FILE", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    ABORTED("ABORTED", 503),
    ALIAS_TABLE_INVALID("ALIAS_TABLE_INVALID", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
