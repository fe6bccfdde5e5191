package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.DTO.CounterVisitSummary;
import com.RK8.FieldReport.DTO.ReconciledRow;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes report rows as UTF-8 CSV. The output depends only on the rows: no
 * timestamps, no locale-specific formatting, fixed column order, {@code \r\n} line
 * ends, and quotes only around values containing a comma, quote or line break.
 */
@Component
public class ReportSerializer {

    public static final List<String> REPORT_HEADERS = List.of(
            "State", "District", "Geography Resolved", "Counter Code", "Counter Name",
            "Visit Id", "Lead Id", "Task Owner Email", "User Name", "Employee Id", "Territory",
            "Visit Type", "Visit Date", "Visit Time", "Status", "First Visit Time", "Last Visit Time",
            "Late Start", "Worked Late", "Digipin");

    public static final List<String> SUMMARY_HEADERS = List.of(
            "State", "District", "Counter Code", "Counter Name",
            "Planned Visits", "Unplanned Visits", "Total Visits");

    private static final String LINE_END = "\r\n";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    public byte[] serialize(List<ReconciledRow> rows) {
        return write(REPORT_HEADERS, csv -> {
            for (ReconciledRow r : rows) {
                csv.writeNext(new String[]{
                        r.getCanonicalState(),
                        r.getCanonicalDistrict(),
                        String.valueOf(r.isGeographyResolved()),
                        r.getCounterId(),
                        r.getCounterName(),
                        r.getVisitId(),
                        r.getLeadId(),
                        r.getAssignedUserId(),
                        r.getUserName(),
                        r.getEmployeeId(),
                        r.getTerritory(),
                        r.getVisitType().getLabel(),
                        r.getVisitDate().toString(),
                        time(r.getVisitTime()),
                        r.getStatus(),
                        time(r.getFirstVisitTime()),
                        time(r.getLastVisitTime()),
                        flag(r.getLateStart()),
                        flag(r.getWorkedLate()),
                        r.getDigipin()
                }, false);
            }
        });
    }

    public byte[] serializeSummary(List<CounterVisitSummary> summaries) {
        return write(SUMMARY_HEADERS, csv -> {
            for (CounterVisitSummary s : summaries) {
                csv.writeNext(new String[]{
                        s.getCanonicalState(),
                        s.getCanonicalDistrict(),
                        s.getCounterId(),
                        s.getCounterName(),
                        Long.toString(s.getPlannedVisits()),
                        Long.toString(s.getUnplannedVisits()),
                        Long.toString(s.getTotalVisits())
                }, false);
            }
        });
    }

    public String suggestedFilename(LocalDate startDate, LocalDate endDate) {
        return String.format("final_report_%s_to_%s.csv", startDate, endDate);
    }

    public String suggestedSummaryFilename(LocalDate startDate, LocalDate endDate) {
        return String.format("counter_summary_%s_to_%s.csv", startDate, endDate);
    }

    private byte[] write(List<String> headers, RowWriter body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             ICSVWriter csv = new CSVWriterBuilder(writer).withLineEnd(LINE_END).build()) {
            csv.writeNext(headers.toArray(new String[0]), false);
            body.write(csv);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report", e);
        }
        return out.toByteArray();
    }

    private static String time(LocalTime value) {
        return value == null ? "" : value.format(TIME_FORMAT);
    }

    private static String flag(Boolean value) {
        if (value == null) return "";
        return value ? "1" : "0";
    }

    @FunctionalInterface
    private interface RowWriter {
        void write(ICSVWriter csv);
    }
}
