package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Comparator;

/**
 * One report line: a single visit enriched with counter and user metadata and
 * normalized geography.
 */
@Value
@Builder(toBuilder = true)
public class ReconciledRow {

    /**
     * Report order: state, district, counter name, visit date, then every remaining
     * column so that equal-looking rows still have a fixed position.
     */
    public static final Comparator<ReconciledRow> REPORT_ORDER = Comparator
            .comparing(ReconciledRow::getCanonicalState)
            .thenComparing(ReconciledRow::getCanonicalDistrict)
            .thenComparing(ReconciledRow::getCounterName)
            .thenComparing(ReconciledRow::getVisitDate)
            .thenComparing(ReconciledRow::getVisitTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ReconciledRow::getVisitType)
            .thenComparing(ReconciledRow::getCounterId)
            .thenComparing(ReconciledRow::getVisitId)
            .thenComparing(ReconciledRow::getAssignedUserId)
            .thenComparing(ReconciledRow::getStatus)
            .thenComparing(ReconciledRow::getLeadId);

    String canonicalState;
    String canonicalDistrict;
    boolean geographyResolved;
    String counterId;
    String counterName;
    String visitId;
    String leadId;
    String assignedUserId;
    String userName;
    String employeeId;
    String territory;
    VisitType visitType;
    LocalDate visitDate;
    LocalTime visitTime;
    String status;
    // earliest and latest visit time of the owner's day; null when the day has no timed visit
    LocalTime firstVisitTime;
    LocalTime lastVisitTime;
    // null = not the first/last visit of the owner's day
    Boolean lateStart;
    Boolean workedLate;
    String digipin;
}
