package com.RK8.FieldReport.Controller;

import com.RK8.FieldReport.DTO.ReportOutput;
import com.RK8.FieldReport.DTO.ReportRequest;
import com.RK8.FieldReport.Exception.InvalidFileException;
import com.RK8.FieldReport.Service.FieldReportService;
import com.RK8.FieldReport.Service.ReportExecutionService;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Locale;

@RestController
@RequestMapping("/api/reports")
public class FieldReportController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv;charset=UTF-8");

    private final FieldReportService reportService;
    private final ReportExecutionService executionService;

    public FieldReportController(FieldReportService reportService, ReportExecutionService executionService) {
        this.reportService = reportService;
        this.executionService = executionService;
    }

    @PostMapping("/final")
    public ResponseEntity<ByteArrayResource> finalReport(
            @RequestPart("plannedVisitFile") MultipartFile plannedVisitFile,
            @RequestPart("unplannedVisitFile") MultipartFile unplannedVisitFile,
            @RequestPart("countersFile") MultipartFile countersFile,
            @RequestPart("usersFile") MultipartFile usersFile,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        ReportRequest request = buildRequest(plannedVisitFile, unplannedVisitFile, countersFile, usersFile,
                startDate, endDate);
        return download(executionService.execute(() -> reportService.generateReport(request)));
    }

    @PostMapping("/counter-summary")
    public ResponseEntity<ByteArrayResource> counterSummary(
            @RequestPart("plannedVisitFile") MultipartFile plannedVisitFile,
            @RequestPart("unplannedVisitFile") MultipartFile unplannedVisitFile,
            @RequestPart("countersFile") MultipartFile countersFile,
            @RequestPart("usersFile") MultipartFile usersFile,
            @RequestParam("startDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam("endDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        ReportRequest request = buildRequest(plannedVisitFile, unplannedVisitFile, countersFile, usersFile,
                startDate, endDate);
        return download(executionService.execute(() -> reportService.generateSummary(request)));
    }

    private ReportRequest buildRequest(MultipartFile planned, MultipartFile unplanned,
                                       MultipartFile counters, MultipartFile users,
                                       LocalDate startDate, LocalDate endDate) {
        return ReportRequest.builder()
                .plannedVisits(readCsv("plannedVisitFile", planned))
                .unplannedVisits(readCsv("unplannedVisitFile", unplanned))
                .counters(readCsv("countersFile", counters))
                .users(readCsv("usersFile", users))
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }

    private byte[] readCsv(String field, MultipartFile file) {
        String name = file.getOriginalFilename();
        if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new InvalidFileException(field, "Invalid file type: " + name + ". All files must be CSVs.");
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidFileException(field, "Could not read upload " + name + ": " + e.getMessage(), e);
        }
    }

    private ResponseEntity<ByteArrayResource> download(ReportOutput output) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + output.getFilename() + "\"")
                .header("X-Report-Rows", Integer.toString(output.getRowCount()))
                .contentType(TEXT_CSV)
                .contentLength(output.getContent().length)
                .body(new ByteArrayResource(output.getContent()));
    }
}
