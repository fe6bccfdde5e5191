package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UserRecord {
    String userId;
    String userName;
    String territory;
    String employeeId;
}
