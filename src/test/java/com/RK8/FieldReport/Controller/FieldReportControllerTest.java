package com.RK8.FieldReport.Controller;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.ExtractKind;
import com.RK8.FieldReport.DTO.ReportOutput;
import com.RK8.FieldReport.DTO.ReportRequest;
import com.RK8.FieldReport.Exception.GlobalExceptionHandler;
import com.RK8.FieldReport.Exception.MissingColumnException;
import com.RK8.FieldReport.Exception.ReportAbortedException;
import com.RK8.FieldReport.Service.FieldReportService;
import com.RK8.FieldReport.Service.ReportExecutionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Standalone MockMvc tests for the report upload endpoints.
 */
@ExtendWith(MockitoExtension.class)
class FieldReportControllerTest {

    private static final byte[] REPORT = "State,District\r\nKARNATAKA,Bengaluru Urban\r\n"
            .getBytes(StandardCharsets.UTF_8);

    @Mock
    private FieldReportService reportService;

    private ExecutorService executor;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        ReportExecutionService executionService = new ReportExecutionService(executor, new ReportProperties());
        FieldReportController controller = new FieldReportController(reportService, executionService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("POST /api/reports/final returns the CSV as an attachment")
    void finalReportDownload() throws Exception {
        when(reportService.generateReport(any()))
                .thenReturn(new ReportOutput("final_report_2024-03-01_to_2024-03-31.csv", REPORT, 1));

        mockMvc.perform(upload("/api/reports/final", "planned.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"final_report_2024-03-01_to_2024-03-31.csv\""))
                .andExpect(header().string("X-Report-Rows", "1"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().bytes(REPORT));

        ArgumentCaptor<ReportRequest> captor = ArgumentCaptor.forClass(ReportRequest.class);
        verify(reportService).generateReport(captor.capture());
        ReportRequest request = captor.getValue();
        assertThat(request.getStartDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(request.getEndDate()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(new String(request.getCounters(), StandardCharsets.UTF_8)).startsWith("Counter Code");
    }

    @Test
    @DisplayName("POST /api/reports/counter-summary uses the summary projection")
    void counterSummaryDownload() throws Exception {
        when(reportService.generateSummary(any()))
                .thenReturn(new ReportOutput("counter_summary_2024-03-01_to_2024-03-31.csv", REPORT, 1));

        mockMvc.perform(upload("/api/reports/counter-summary", "planned.csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"counter_summary_2024-03-01_to_2024-03-31.csv\""));
    }

    @Test
    @DisplayName("Non-CSV upload is rejected before any processing")
    void nonCsvUpload() throws Exception {
        mockMvc.perform(upload("/api/reports/final", "planned.xlsx"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FILE"))
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid file type: planned.xlsx. All files must be CSVs."))
                .andExpect(jsonPath("$.details.field").value("plannedVisitFile"))
                .andExpect(jsonPath("$.path").value("/api/reports/final"));

        verifyNoInteractions(reportService);
    }

    @Test
    @DisplayName("Extract errors map to 400 with the column named")
    void missingColumn() throws Exception {
        when(reportService.generateReport(any()))
                .thenThrow(new MissingColumnException(ExtractKind.COUNTER, "District"));

        mockMvc.perform(upload("/api/reports/final", "planned.csv"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_COLUMN"))
                .andExpect(jsonPath("$.message").value("Missing required column in counters file: District"));
    }

    @Test
    @DisplayName("Aborted run maps to 503")
    void aborted() throws Exception {
        when(reportService.generateReport(any()))
                .thenThrow(new ReportAbortedException("Report run exceeded the time limit of PT1M"));

        mockMvc.perform(upload("/api/reports/final", "planned.csv"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("ABORTED"));
    }

    @Test
    @DisplayName("Missing upload is a bad request")
    void missingPart() throws Exception {
        mockMvc.perform(multipart("/api/reports/final")
                        .file(csv("plannedVisitFile", "planned.csv"))
                        .param("startDate", "2024-03-01")
                        .param("endDate", "2024-03-31"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

        verifyNoInteractions(reportService);
    }

    @Test
    @DisplayName("Unparseable date parameter is a bad request")
    void badDateParameter() throws Exception {
        mockMvc.perform(upload("/api/reports/final", "planned.csv", "01/03/2024"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Non-multipart body is a 400 upload error, not a server error")
    void notMultipart() throws Exception {
        mockMvc.perform(post("/api/reports/final")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startDate\":\"2024-03-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FILE"))
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(reportService);
    }

    @Test
    @DisplayName("Wrong HTTP method keeps its 405 status")
    void wrongMethod() throws Exception {
        mockMvc.perform(get("/api/reports/final"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.status").value(405))
                .andExpect(jsonPath("$.path").value("/api/reports/final"));
    }

    @Test
    @DisplayName("Unexpected failure is a 500 without internals")
    void unexpectedFailure() throws Exception {
        when(reportService.generateReport(any())).thenThrow(new IllegalStateException("index out of sync"));

        mockMvc.perform(upload("/api/reports/final", "planned.csv"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }

    private MockMultipartHttpServletRequestBuilder upload(String path, String plannedName) {
        return upload(path, plannedName, "2024-03-01");
    }

    private MockMultipartHttpServletRequestBuilder upload(String path, String plannedName, String startDate) {
        MockMultipartHttpServletRequestBuilder builder = multipart(path)
                .file(csv("plannedVisitFile", plannedName))
                .file(csv("unplannedVisitFile", "unplanned.csv"))
                .file(csv("countersFile", "counters.csv"))
                .file(csv("usersFile", "users.csv"));
        builder.param("startDate", startDate);
        builder.param("endDate", "2024-03-31");
        return builder;
    }

    private static MockMultipartFile csv(String field, String filename) {
        String body = field.equals("countersFile")
                ? "Counter Code,Counter Name,State,District\nC1,Sharma,KARNATAKA,Bangalore\n"
                : "Id\n1\n";
        return new MockMultipartFile(field, filename, "text/csv", body.getBytes(StandardCharsets.UTF_8));
    }
}
