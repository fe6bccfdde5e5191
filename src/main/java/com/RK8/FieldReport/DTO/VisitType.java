package com.RK8.FieldReport.DTO;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum VisitType {
    PLANNED("Planned"),
    UNPLANNED("Unplanned");

    private final String label;
}
