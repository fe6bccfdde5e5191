package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Everything one report run needs: the raw bytes of the four extracts and the
 * inclusive date window.
 */
@Value
@Builder
public class ReportRequest {
    byte[] plannedVisits;
    byte[] unplannedVisits;
    byte[] counters;
    byte[] users;
    LocalDate startDate;
    LocalDate endDate;
}
