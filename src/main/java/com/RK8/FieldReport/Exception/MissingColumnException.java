package com.RK8.FieldReport.Exception;

import com.RK8.FieldReport.DTO.ExtractKind;
import lombok.Getter;

import java.util.Map;

@Getter
public class MissingColumnException extends ReportException {

    private final ExtractKind kind;
    private final String column;

    public MissingColumnException(ExtractKind kind, String column) {
        super(ErrorCode.MISSING_COLUMN,
                "Missing required column in " + kind.getDisplayName() + " file: " + column,
                Map.of("extract", kind.name(), "column", column));
        this.kind = kind;
        this.column = column;
    }
}
