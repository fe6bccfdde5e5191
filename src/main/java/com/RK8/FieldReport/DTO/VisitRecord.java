package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

@Value
@Builder(toBuilder = true)
public class VisitRecord {
    String visitId;
    VisitType visitType;
    String counterId;
    String leadId;
    String rawState;
    String rawDistrict;
    LocalDate visitDate;
    // null when the export carried a date only
    LocalTime visitTime;
    String assignedUserId;
    String status;
}
