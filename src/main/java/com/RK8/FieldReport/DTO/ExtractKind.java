package com.RK8.FieldReport.DTO;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The four CSV exports a report run is built from.
 */
@Getter
@RequiredArgsConstructor
public enum ExtractKind {
    PLANNED_VISIT("planned visits"),
    UNPLANNED_VISIT("unplanned visits"),
    COUNTER("counters"),
    USER("users");

    private final String displayName;
}
