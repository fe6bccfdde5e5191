package com.RK8.FieldReport.DTO;

import lombok.Value;

@Value
public class GeographyResolution {
    String canonicalDistrict;
    boolean resolved;
}
