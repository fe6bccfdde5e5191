package com.RK8.FieldReport;

import com.RK8.FieldReport.Config.ReportProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReportProperties.class)
public class FieldReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(FieldReportApplication.class, args);
    }
}
