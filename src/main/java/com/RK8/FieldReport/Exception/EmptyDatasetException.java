package com.RK8.FieldReport.Exception;

import com.RK8.FieldReport.DTO.ExtractKind;
import lombok.Getter;

import java.util.Map;

@Getter
public class EmptyDatasetException extends ReportException {

    private final ExtractKind kind;

    public EmptyDatasetException(ExtractKind kind, int totalRows, int rejectedRows) {
        super(ErrorCode.EMPTY_DATASET,
                String.format("The %s file has no usable rows (%d of %d rejected)",
                        kind.getDisplayName(), rejectedRows, totalRows),
                Map.of("extract", kind.name(), "totalRows", totalRows, "rejectedRows", rejectedRows));
        this.kind = kind;
    }
}
