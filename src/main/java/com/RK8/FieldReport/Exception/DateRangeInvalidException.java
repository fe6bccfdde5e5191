package com.RK8.FieldReport.Exception;

import java.time.LocalDate;
import java.util.Map;

public class DateRangeInvalidException extends ReportException {

    public DateRangeInvalidException(LocalDate startDate, LocalDate endDate) {
        super(ErrorCode.DATE_RANGE_INVALID,
                "End date " + endDate + " is before start date " + startDate,
                Map.of("startDate", String.valueOf(startDate), "endDate", String.valueOf(endDate)));
    }

    public DateRangeInvalidException(String message) {
        super(ErrorCode.DATE_RANGE_INVALID, message);
    }
}
