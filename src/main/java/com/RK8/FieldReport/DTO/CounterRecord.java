package com.RK8.FieldReport.DTO;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CounterRecord {
    String counterId;
    String counterName;
    String rawState;
    String rawDistrict;
    Double latitude;
    Double longitude;
}
