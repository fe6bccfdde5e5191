package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.ReconciledRow;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags each field user's first and last visit of the day.
 *
 * <p>Rows are grouped by (assigned user, visit date). Within a group the earliest
 * visit gets {@code lateStart} and the latest gets {@code workedLate}. Each flag is
 * true when the visit time is after its threshold. Every other row keeps both flags
 * empty, and so do rows without a time of day. Equal times go to the row that comes
 * first in report order, so the input must already be sorted.
 *
 * <p>Every row of a group, timed or not, also carries the group's earliest and latest
 * visit time so that a flag can be checked against the visits that produced it.
 */
@Component
public class WorkdayFlagCalculator {

    private final LocalTime lateStartAfter;
    private final LocalTime workedLateAfter;

    @Autowired
    public WorkdayFlagCalculator(ReportProperties properties) {
        this(LocalTime.parse(properties.getReconciliation().getLateStartAfter()),
                LocalTime.parse(properties.getReconciliation().getWorkedLateAfter()));
    }

    public WorkdayFlagCalculator(LocalTime lateStartAfter, LocalTime workedLateAfter) {
        this.lateStartAfter = lateStartAfter;
        this.workedLateAfter = workedLateAfter;
    }

    public List<ReconciledRow> apply(List<ReconciledRow> sortedRows) {
        Map<DayKey, int[]> firstAndLast = new LinkedHashMap<>();
        for (int i = 0; i < sortedRows.size(); i++) {
            ReconciledRow row = sortedRows.get(i);
            if (row.getVisitTime() == null || row.getAssignedUserId().isEmpty()) continue;

            DayKey key = new DayKey(row.getAssignedUserId(), row.getVisitDate());
            int[] idx = firstAndLast.get(key);
            if (idx == null) {
                firstAndLast.put(key, new int[]{i, i});
                continue;
            }
            if (row.getVisitTime().isBefore(sortedRows.get(idx[0]).getVisitTime())) idx[0] = i;
            if (row.getVisitTime().isAfter(sortedRows.get(idx[1]).getVisitTime())) idx[1] = i;
        }

        List<ReconciledRow> out = new ArrayList<>(sortedRows);
        for (int i = 0; i < out.size(); i++) {
            ReconciledRow row = out.get(i);
            if (row.getAssignedUserId().isEmpty()) continue;

            int[] idx = firstAndLast.get(new DayKey(row.getAssignedUserId(), row.getVisitDate()));
            if (idx == null) continue;
            out.set(i, row.toBuilder()
                    .firstVisitTime(sortedRows.get(idx[0]).getVisitTime())
                    .lastVisitTime(sortedRows.get(idx[1]).getVisitTime())
                    .build());
        }
        for (int[] idx : firstAndLast.values()) {
            ReconciledRow first = out.get(idx[0]);
            out.set(idx[0], first.toBuilder()
                    .lateStart(first.getVisitTime().isAfter(lateStartAfter))
                    .build());
            ReconciledRow last = out.get(idx[1]);
            out.set(idx[1], last.toBuilder()
                    .workedLate(last.getVisitTime().isAfter(workedLateAfter))
                    .build());
        }
        return out;
    }

    @Value
    private static class DayKey {
        String userId;
        LocalDate date;
    }
}
