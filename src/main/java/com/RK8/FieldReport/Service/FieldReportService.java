package com.RK8.FieldReport.Service;

import com.RK8.FieldReport.DTO.CounterRecord;
import com.RK8.FieldReport.DTO.CounterVisitSummary;
import com.RK8.FieldReport.DTO.ParsedExtract;
import com.RK8.FieldReport.DTO.ReconciledRow;
import com.RK8.FieldReport.DTO.ReportOutput;
import com.RK8.FieldReport.DTO.ReportRequest;
import com.RK8.FieldReport.DTO.UserRecord;
import com.RK8.FieldReport.DTO.VisitRecord;
import com.RK8.FieldReport.Exception.DateRangeInvalidException;
import com.RK8.FieldReport.Exception.ReportAbortedException;
import com.RK8.FieldReport.Parser.ExtractParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one report from the four uploaded extracts to CSV bytes. A run either
 * produces the whole report or throws; nothing is returned for a failed run.
 *
 * <p>An interrupted thread (a run cancelled after its time limit) stops at the next
 * stage boundary with {@link ReportAbortedException}, so an abandoned run frees its
 * worker instead of finishing a report nobody will read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FieldReportService {

    private final ExtractParser extractParser;
    private final ReconciliationEngine reconciliationEngine;
    private final CounterSummaryProjection summaryProjection;
    private final ReportSerializer reportSerializer;

    public ReportOutput generateReport(ReportRequest request) {
        List<ReconciledRow> rows = reconcile(request);
        checkNotCancelled("serializing the report");
        byte[] content = reportSerializer.serialize(rows);
        String filename = reportSerializer.suggestedFilename(request.getStartDate(), request.getEndDate());
        log.info("Report {} ready: {} rows, {} bytes", filename, rows.size(), content.length);
        return new ReportOutput(filename, content, rows.size());
    }

    public ReportOutput generateSummary(ReportRequest request) {
        List<CounterVisitSummary> summaries = summaryProjection.summarize(reconcile(request));
        checkNotCancelled("serializing the summary");
        byte[] content = reportSerializer.serializeSummary(summaries);
        String filename = reportSerializer.suggestedSummaryFilename(request.getStartDate(), request.getEndDate());
        log.info("Counter summary {} ready: {} counters", filename, summaries.size());
        return new ReportOutput(filename, content, summaries.size());
    }

    private List<ReconciledRow> reconcile(ReportRequest request) {
        validateDateRange(request);

        checkNotCancelled("parsing planned visits");
        ParsedExtract<VisitRecord> planned = extractParser.parsePlannedVisits(request.getPlannedVisits());
        checkNotCancelled("parsing unplanned visits");
        ParsedExtract<VisitRecord> unplanned = extractParser.parseUnplannedVisits(request.getUnplannedVisits());
        checkNotCancelled("parsing counters");
        ParsedExtract<CounterRecord> counters = extractParser.parseCounters(request.getCounters());
        checkNotCancelled("parsing users");
        ParsedExtract<UserRecord> users = extractParser.parseUsers(request.getUsers());

        checkNotCancelled("reconciling");
        return reconciliationEngine.reconcile(
                planned.getRecords(),
                unplanned.getRecords(),
                counters.getRecords(),
                users.getRecords(),
                request.getStartDate(),
                request.getEndDate());
    }

    // leaves the interrupt flag set for the caller
    private void checkNotCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Report run cancelled before {}", stage);
            throw new ReportAbortedException("Report run was cancelled before " + stage);
        }
    }

    // checked before any file is parsed
    private void validateDateRange(ReportRequest request) {
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new DateRangeInvalidException("Start date and end date are both required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new DateRangeInvalidException(request.getStartDate(), request.getEndDate());
        }
    }
}
