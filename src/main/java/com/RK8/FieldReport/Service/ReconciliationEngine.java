package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.Config.DuplicateKeyPolicy;
import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.CounterRecord;
import com.RK8.FieldReport.DTO.GeographyResolution;
import com.RK8.FieldReport.DTO.ReconciledRow;
import com.RK8.FieldReport.DTO.UserRecord;
import com.RK8.FieldReport.DTO.VisitRecord;
import com.RK8.FieldReport.DTO.VisitType;
import com.RK8.FieldReport.Exception.DateRangeInvalidException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Joins visit events to counter and user metadata and produces the report rows.
 *
 * <p>Every visit inside the date window yields exactly one row. A visit whose
 * counter or user cannot be found still appears, with the unresolved marker in the
 * joined columns. Counter geography wins over whatever the visit export says; the
 * visit's own state and district are only used, unchanged, when the counter is
 * unknown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final GeographyNormalizer geographyNormalizer;
    private final WorkdayFlagCalculator workdayFlagCalculator;
    private final DigipinEncoder digipinEncoder;
    private final ReportProperties properties;

    public List<ReconciledRow> reconcile(
            List<VisitRecord> planned,
            List<VisitRecord> unplanned,
            List<CounterRecord> counters,
            List<UserRecord> users,
            LocalDate startDate,
            LocalDate endDate
    ) {
        if (startDate == null || endDate == null) {
            throw new DateRangeInvalidException("Start date and end date are both required");
        }
        if (endDate.isBefore(startDate)) {
            throw new DateRangeInvalidException(startDate, endDate);
        }

        Map<String, CounterRecord> counterIndex = index(counters, CounterRecord::getCounterId, "counter");
        Map<String, UserRecord> userIndex = index(users, UserRecord::getUserId, "user");

        List<ReconciledRow> rows = new ArrayList<>();
        int outOfRange = 0;
        int counterMisses = 0;
        int userMisses = 0;
        int unresolvedGeography = 0;

        for (VisitType type : VisitType.values()) {
            List<VisitRecord> visits = type == VisitType.PLANNED ? planned : unplanned;
            for (VisitRecord visit : visits) {
                if (!inRange(visit.getVisitDate(), startDate, endDate)) {
                    outOfRange++;
                    continue;
                }

                CounterRecord counter = counterIndex.get(visit.getCounterId());
                UserRecord user = userIndex.get(nullToEmpty(visit.getAssignedUserId()));
                ReconciledRow row = toRow(visit, type, counter, user);

                if (counter == null) counterMisses++;
                if (user == null) userMisses++;
                if (!row.isGeographyResolved()) unresolvedGeography++;
                rows.add(row);
            }
        }

        rows.sort(ReconciledRow.REPORT_ORDER);
        List<ReconciledRow> result = workdayFlagCalculator.apply(rows);

        log.info("Reconciled {} visits between {} and {} ({} outside the range)",
                result.size(), startDate, endDate, outOfRange);
        if (counterMisses > 0 || userMisses > 0 || unresolvedGeography > 0) {
            log.info("Unresolved: {} counters, {} users, {} districts without an alias rule",
                    counterMisses, userMisses, unresolvedGeography);
        }
        return result;
    }

    private ReconciledRow toRow(VisitRecord visit, VisitType type, CounterRecord counter, UserRecord user) {
        String unresolved = properties.getReconciliation().getUnresolvedMarker();
        ReconciledRow.ReconciledRowBuilder row = ReconciledRow.builder()
                .counterId(visit.getCounterId())
                .visitId(visit.getVisitId())
                .leadId(nullToEmpty(visit.getLeadId()))
                .assignedUserId(nullToEmpty(visit.getAssignedUserId()))
                .visitType(type)
                .visitDate(visit.getVisitDate())
                .visitTime(visit.getVisitTime())
                .status(nullToEmpty(visit.getStatus()));

        if (counter != null) {
            String state = nullToEmpty(counter.getRawState());
            GeographyResolution resolution = geographyNormalizer.resolve(state, nullToEmpty(counter.getRawDistrict()));
            row.canonicalState(state)
                    .canonicalDistrict(resolution.getCanonicalDistrict())
                    .geographyResolved(resolution.isResolved())
                    .counterName(nullToEmpty(counter.getCounterName()))
                    .digipin(digipinEncoder.encode(counter.getLatitude(), counter.getLongitude()).orElse(""));
        } else {
            String district = nullToEmpty(visit.getRawDistrict());
            row.canonicalState(nullToEmpty(visit.getRawState()))
                    .canonicalDistrict(district.isEmpty() ? unresolved : district)
                    .geographyResolved(false)
                    .counterName(unresolved)
                    .digipin("");
        }

        if (user != null) {
            row.userName(nullToEmpty(user.getUserName()))
                    .territory(nullToEmpty(user.getTerritory()))
                    .employeeId(nullToEmpty(user.getEmployeeId()));
        } else {
            row.userName(unresolved)
                    .territory(unresolved)
                    .employeeId(unresolved);
        }
        return row.build();
    }

    private <T> Map<String, T> index(List<T> records, Function<T, String> key, String label) {
        DuplicateKeyPolicy policy = properties.getReconciliation().getDuplicateKeyPolicy();
        Map<String, T> index = new HashMap<>();
        int duplicates = 0;
        for (T record : records) {
            String k = key.apply(record);
            if (index.containsKey(k)) {
                duplicates++;
                if (policy == DuplicateKeyPolicy.FIRST_WINS) continue;
            }
            index.put(k, record);
        }
        if (duplicates > 0) {
            log.warn("{} duplicate {} keys found; keeping the {} occurrence",
                    duplicates, label, policy == DuplicateKeyPolicy.FIRST_WINS ? "first" : "last");
        }
        return index;
    }

    private boolean inRange(LocalDate date, LocalDate start, LocalDate end) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
