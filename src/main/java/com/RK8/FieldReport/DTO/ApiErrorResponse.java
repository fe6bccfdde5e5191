package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ApiErrorResponse {
    String code;
    int status;
    String message;
    Map<String, Object> details;
    String path;
    String timestamp;
}
