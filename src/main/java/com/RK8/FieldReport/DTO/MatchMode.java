package com.RK8.FieldReport.DTO;

public enum MatchMode {
    EXACT,
    PREFIX_WILDCARD
}
