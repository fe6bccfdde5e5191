package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.DTO.CounterVisitSummary;
import com.RK8.FieldReport.DTO.ReconciledRow;
import com.RK8.FieldReport.DTO.VisitType;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts planned and unplanned visits per counter. This is a view over the
 * reconciled rows; it never replaces the per-visit report.
 */
@Component
public class CounterSummaryProjection {

    static final Comparator<CounterVisitSummary> SUMMARY_ORDER = Comparator
            .comparing(CounterVisitSummary::getCanonicalState)
            .thenComparing(CounterVisitSummary::getCanonicalDistrict)
            .thenComparing(CounterVisitSummary::getCounterName)
            .thenComparing(CounterVisitSummary::getCounterId);

    public List<CounterVisitSummary> summarize(List<ReconciledRow> rows) {
        Map<CounterKey, long[]> counts = new HashMap<>();
        for (ReconciledRow row : rows) {
            CounterKey key = new CounterKey(row.getCanonicalState(), row.getCanonicalDistrict(),
                    row.getCounterId(), row.getCounterName());
            long[] c = counts.computeIfAbsent(key, k -> new long[2]);
            c[row.getVisitType() == VisitType.PLANNED ? 0 : 1]++;
        }

        List<CounterVisitSummary> out = new ArrayList<>(counts.size());
        counts.forEach((key, c) -> out.add(CounterVisitSummary.builder()
                .canonicalState(key.getState())
                .canonicalDistrict(key.getDistrict())
                .counterId(key.getCounterId())
                .counterName(key.getCounterName())
                .plannedVisits(c[0])
                .unplannedVisits(c[1])
                .build()));
        out.sort(SUMMARY_ORDER);
        return out;
    }

    @Value
    private static class CounterKey {
        String state;
        String district;
        String counterId;
        String counterName;
    }
}
