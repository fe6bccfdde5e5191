package com.RK8.FieldReport;

import com.RK8.FieldReport.Service.GeographyNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class FieldReportApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private GeographyNormalizer geographyNormalizer;

    @Test
    void contextLoadsBundledAliasTable() {
        assertThat(geographyNormalizer.getRuleCount()).isGreaterThan(0);
        assertThat(geographyNormalizer.hasRulesFor("KARNATAKA")).isTrue();
        assertThat(geographyNormalizer.resolve("KARNATAKA", "Bangalore").getCanonicalDistrict())
                .isEqualTo("Bengaluru Urban");
    }

    @Test
    void reportFromFixtureExtracts() throws Exception {
        MvcResult result = mockMvc.perform(multipart("/api/reports/final")
                        .file(fixture("plannedVisitFile", "planned_visits.csv"))
                        .file(fixture("unplannedVisitFile", "unplanned_visits.csv"))
                        .file(fixture("countersFile", "counters.csv"))
                        .file(fixture("usersFile", "users.csv"))
                        .param("startDate", "2024-03-01")
                        .param("endDate", "2024-03-31"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Report-Rows", "5"))
                .andReturn();

        String csv = new String(result.getResponse().getContentAsByteArray(), StandardCharsets.UTF_8);
        String[] lines = csv.split("\r\n");

        assertThat(lines).hasSize(6);
        assertThat(lines[1]).startsWith(",Unresolved,false,CTR-09,Unresolved,A-2001,,ravi@example.com,Ravi Sen,");
        assertThat(lines[2]).isEqualTo("ANDHRA PRADESH,Nellore,true,CTR-02,\"Reddy & Sons, Nellore\",T-1002,,"
                + "asha@example.com,Asha Rao,E-101,South,Planned,2024-03-05,11:45:00,Completed,09:05:00,18:10:00,,,");
        assertThat(lines[3]).isEqualTo("ANDHRA PRADESH,Nellore,true,CTR-02,\"Reddy & Sons, Nellore\",A-2002,,"
                + "asha@example.com,Asha Rao,E-101,South,Unplanned,2024-03-05,18:10:00,Closed,09:05:00,18:10:00,,1,");
        assertThat(lines[4]).isEqualTo("KARNATAKA,Bengaluru Urban,true,CTR-01,Sharma Traders,T-1001,L-77,"
                + "asha@example.com,Asha Rao,E-101,South,Planned,2024-03-05,09:05:00,Completed,09:05:00,18:10:00,0,,4P3-JK8-52C9");
        assertThat(lines[5]).startsWith("WEST BENGAL,North 24 Pgs.,true,CTR-03,Kolkata Paints,T-1003,");
        assertThat(lines[5]).contains(",2024-03-06,16:20:00,Completed,08:30:00,16:20:00,,1,");
    }

    private static MockMultipartFile fixture(String field, String name) throws IOException {
        try (InputStream in = new ClassPathResource("fixtures/" + name).getInputStream()) {
            return new MockMultipartFile(field, name, "text/csv", in.readAllBytes());
        }
    }
}
