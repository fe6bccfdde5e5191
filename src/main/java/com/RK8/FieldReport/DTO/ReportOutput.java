package com.RK8.FieldReport.DTO;

import lombok.Value;

@Value
public class ReportOutput {
    String filename;
    byte[] content;
    int rowCount;
}
