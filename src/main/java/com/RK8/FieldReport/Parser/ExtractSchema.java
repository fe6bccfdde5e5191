package com.RK8.FieldReport.Parser;

import com.RK8.FieldReport.DTO.ExtractKind;
import com.RK8.FieldReport.Exception.MissingColumnException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column layout of each extract. Every logical column lists the header names the
 * CRM has used for it, most specific first; headers are compared ignoring case and
 * surrounding whitespace. When an export carries several of them, all are kept and
 * each row reads the first one that is filled in.
 */
@Getter
public class ExtractSchema {
    public static final String VISIT_ID = "VISIT_ID";
    public static final String COUNTER_ID = "COUNTER_ID";
    public static final String LEAD_ID = "LEAD_ID";
    public static final String STATE = "STATE";
    public static final String DISTRICT = "DISTRICT";
    public static final String VISIT_DATE = "VISIT_DATE";
    public static final String USER_ID = "USER_ID";
    public static final String STATUS = "STATUS";
    public static final String COUNTER_NAME = "COUNTER_NAME";
    public static final String LATITUDE = "LATITUDE";
    public static final String LONGITUDE = "LONGITUDE";
    public static final String USER_NAME = "USER_NAME";
    public static final String TERRITORY = "TERRITORY";
    public static final String EMPLOYEE_ID = "EMPLOYEE_ID";

    private static final Map<ExtractKind, ExtractSchema> SCHEMAS = new EnumMap<>(ExtractKind.class);

    static {
        SCHEMAS.put(ExtractKind.PLANNED_VISIT, new ExtractSchema(ExtractKind.PLANNED_VISIT, List.of(
                required(VISIT_ID, "Visit Id", "Task Id", "Id"),
                required(COUNTER_ID, "Counter Code"),
                optional(LEAD_ID, "Lead Id", "Counter Number"),
                optional(STATE, "State", "Operational States"),
                optional(DISTRICT, "District", "Operational Cities", "Taluka or District"),
                required(VISIT_DATE, "Task Completed", "Completed On", "CompletedOn", "Visit Date"),
                required(USER_ID, "Task Owner Email", "Assigned User Id", "Owner Email"),
                optional(STATUS, "Status", "Task Status")
        )));
        SCHEMAS.put(ExtractKind.UNPLANNED_VISIT, new ExtractSchema(ExtractKind.UNPLANNED_VISIT, List.of(
                required(VISIT_ID, "Visit Id", "Activity Id", "Id"),
                required(COUNTER_ID, "Counter Code"),
                optional(LEAD_ID, "Lead Id", "Counter Number"),
                optional(STATE, "State", "Operational States"),
                optional(DISTRICT, "District", "Operational Cities", "Taluka or District"),
                required(VISIT_DATE, "Activity Date", "Completed On", "CompletedOn", "Visit Date"),
                required(USER_ID, "Activity Created By Email", "Task Owner Email", "Assigned User Id"),
                optional(STATUS, "Status", "Activity Status")
        )));
        SCHEMAS.put(ExtractKind.COUNTER, new ExtractSchema(ExtractKind.COUNTER, List.of(
                required(COUNTER_ID, "Counter Code"),
                required(COUNTER_NAME, "Counter Name"),
                required(STATE, "State", "Operational States"),
                required(DISTRICT, "District", "Taluka or District", "Operational Cities"),
                optional(LATITUDE, "Latitude", "Lat"),
                optional(LONGITUDE, "Longitude", "Long", "Lng")
        )));
        SCHEMAS.put(ExtractKind.USER, new ExtractSchema(ExtractKind.USER, List.of(
                required(USER_ID, "Email Address", "User Id", "Email"),
                required(USER_NAME, "User Name", "Name", "Full Name"),
                optional(TERRITORY, "Territory", "Region"),
                optional(EMPLOYEE_ID, "Employee Id")
        )));
    }

    private final ExtractKind kind;
    private final List<Column> columns;

    private ExtractSchema(ExtractKind kind, List<Column> columns) {
        this.kind = kind;
        this.columns = columns;
    }

    public static ExtractSchema forKind(ExtractKind kind) {
        return SCHEMAS.get(kind);
    }

    /**
     * Maps each logical column to the positions of its matching headers, in alias order.
     *
     * @throws MissingColumnException naming the first required column with no matching header
     */
    public Map<String, List<Integer>> buildColumnMap(String[] header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String h = normalizeHeader(header[i]);
            if (!h.isEmpty()) {
                positions.putIfAbsent(h, i);
            }
        }

        Map<String, List<Integer>> map = new HashMap<>();
        for (Column column : columns) {
            List<Integer> matched = new ArrayList<>();
            for (String name : column.getHeaders()) {
                Integer idx = positions.get(normalizeHeader(name));
                if (idx != null && !matched.contains(idx)) {
                    matched.add(idx);
                }
            }
            if (!matched.isEmpty()) {
                map.put(column.getKey(), List.copyOf(matched));
            } else if (column.isRequired()) {
                throw new MissingColumnException(kind, column.getHeaders().get(0));
            }
        }
        return map;
    }

    static String normalizeHeader(String header) {
        if (header == null) return "";
        return header.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static Column required(String key, String... headers) {
        return new Column(key, true, List.of(headers));
    }

    private static Column optional(String key, String... headers) {
        return new Column(key, false, List.of(headers));
    }

    @Getter
    public static class Column {
        private final String key;
        private final boolean required;
        private final List<String> headers;

        Column(String key, boolean required, List<String> headers) {
            this.key = key;
            this.required = required;
            this.headers = headers;
        }
    }
}
