package com.RK8.FieldReport.DTO;

import lombok.Value;

import java.util.List;

@Value
public class ParsedExtract<T> {
    ExtractKind kind;
    List<T> records;
    int totalRows;
    int rejectedRows;
}
