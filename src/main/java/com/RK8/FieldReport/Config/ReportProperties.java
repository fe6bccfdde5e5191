package com.RK8.FieldReport.Config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private Geography geography = new Geography();
    private Parser parser = new Parser();
    private Reconciliation reconciliation = new Reconciliation();
    private Execution execution = new Execution();

    @Data
    public static class Geography {
        private String aliasTable = "classpath:district_mapping.yml";
        // missing table = every district passes through unchanged
        private boolean failIfMissing = false;
    }

    @Data
    public static class Parser {
        /**
         * Largest tolerated share of rejected rows in one extract. 1.0 fails only
         * when no row at all is usable.
         */
        private double maxRejectedFraction = 1.0;
    }

    @Data
    public static class Reconciliation {
        private DuplicateKeyPolicy duplicateKeyPolicy = DuplicateKeyPolicy.LAST_WINS;
        private String unresolvedMarker = "Unresolved";
        // HH:mm
        private String lateStartAfter = "09:15";
        private String workedLateAfter = "16:00";
    }

    @Data
    public static class Execution {
        // null = no timeout
        private Duration timeout;
        private int poolSize = 4;
    }
}
