package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CounterVisitSummary {
    String canonicalState;
    String canonicalDistrict;
    String counterId;
    String counterName;
    long plannedVisits;
    long unplannedVisits;

    public long getTotalVisits() {
        return plannedVisits + unplannedVisits;
    }
}
