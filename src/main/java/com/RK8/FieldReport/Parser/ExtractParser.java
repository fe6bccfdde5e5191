package com.RK8.FieldReport.Parser;

import com.RK8.FieldReport.Config.ReportProperties;
import com.RK8.FieldReport.DTO.CounterRecord;
import com.RK8.FieldReport.DTO.ExtractKind;
import com.RK8.FieldReport.DTO.ParsedExtract;
import com.RK8.FieldReport.DTO.UserRecord;
import com.RK8.FieldReport.DTO.VisitRecord;
import com.RK8.FieldReport.DTO.VisitType;
import com.RK8.FieldReport.Exception.EmptyDatasetException;
import com.RK8.FieldReport.Exception.MalformedExtractException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the four CRM extracts into typed records. This is the only place that sees
 * raw CSV rows: header variations are resolved through {@link ExtractSchema}, and
 * rows that cannot be typed are dropped and counted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractParser {

    private final ExtractDecoder decoder;
    private final VisitDateParser dateParser;
    private final ReportProperties properties;

    public ParsedExtract<VisitRecord> parsePlannedVisits(byte[] bytes) {
        return parse(ExtractKind.PLANNED_VISIT, bytes, (row, col) -> toVisit(row, col, VisitType.PLANNED));
    }

    public ParsedExtract<VisitRecord> parseUnplannedVisits(byte[] bytes) {
        return parse(ExtractKind.UNPLANNED_VISIT, bytes, (row, col) -> toVisit(row, col, VisitType.UNPLANNED));
    }

    public ParsedExtract<CounterRecord> parseCounters(byte[] bytes) {
        return parse(ExtractKind.COUNTER, bytes, this::toCounter);
    }

    public ParsedExtract<UserRecord> parseUsers(byte[] bytes) {
        return parse(ExtractKind.USER, bytes, this::toUser);
    }

    /**
     * Untyped entry point for callers that only know the extract kind.
     */
    public ParsedExtract<?> parse(ExtractKind kind, byte[] bytes) {
        switch (kind) {
            case PLANNED_VISIT:
                return parsePlannedVisits(bytes);
            case UNPLANNED_VISIT:
                return parseUnplannedVisits(bytes);
            case COUNTER:
                return parseCounters(bytes);
            case USER:
                return parseUsers(bytes);
            default:
                throw new IllegalArgumentException("Unknown extract kind: " + kind);
        }
    }

    private <T> ParsedExtract<T> parse(ExtractKind kind, byte[] bytes, RowMapper<T> mapper) {
        ExtractSchema schema = ExtractSchema.forKind(kind);
        String text = decoder.decode(bytes);

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {

            String[] header = reader.readNext();
            while (header != null && isBlankRow(header)) {
                header = reader.readNext();
            }
            if (header == null) {
                throw new EmptyDatasetException(kind, 0, 0);
            }
            Map<String, List<Integer>> col = schema.buildColumnMap(header);

            List<T> out = new ArrayList<>();
            int total = 0;
            int rejected = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (isBlankRow(row)) continue;
                total++;

                Optional<T> record = mapper.map(row, col);
                if (record.isPresent()) {
                    out.add(record.get());
                } else {
                    rejected++;
                    log.debug("Rejected {} row at line {}", kind.getDisplayName(), reader.getLinesRead());
                }
            }

            checkUsable(kind, total, rejected);
            if (rejected > 0) {
                log.warn("{}: skipped {} of {} rows (missing key or unparseable date)",
                        kind.getDisplayName(), rejected, total);
            }
            log.info("{} parser: loaded {} records", kind.getDisplayName(), out.size());
            return new ParsedExtract<>(kind, List.copyOf(out), total, rejected);

        } catch (IOException | CsvException e) {
            throw new MalformedExtractException(kind, e.getMessage(), e);
        }
    }

    private void checkUsable(ExtractKind kind, int total, int rejected) {
        int usable = total - rejected;
        if (usable == 0) {
            throw new EmptyDatasetException(kind, total, rejected);
        }
        double rejectedFraction = (double) rejected / total;
        if (rejectedFraction > properties.getParser().getMaxRejectedFraction()) {
            throw new EmptyDatasetException(kind, total, rejected);
        }
    }

    private Optional<VisitRecord> toVisit(String[] row, Map<String, List<Integer>> col, VisitType type) {
        String visitId = cell(row, col, ExtractSchema.VISIT_ID);
        String counterId = cell(row, col, ExtractSchema.COUNTER_ID);
        if (visitId.isEmpty() || counterId.isEmpty()) {
            return Optional.empty();
        }

        return dateParser.parse(cell(row, col, ExtractSchema.VISIT_DATE))
                .map(ts -> VisitRecord.builder()
                        .visitId(visitId)
                        .visitType(type)
                        .counterId(counterId)
                        .leadId(cell(row, col, ExtractSchema.LEAD_ID))
                        .rawState(cell(row, col, ExtractSchema.STATE))
                        .rawDistrict(cell(row, col, ExtractSchema.DISTRICT))
                        .visitDate(ts.getDate())
                        .visitTime(ts.getTime())
                        .assignedUserId(cell(row, col, ExtractSchema.USER_ID))
                        .status(cell(row, col, ExtractSchema.STATUS))
                        .build());
    }

    private Optional<CounterRecord> toCounter(String[] row, Map<String, List<Integer>> col) {
        String counterId = cell(row, col, ExtractSchema.COUNTER_ID);
        if (counterId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(CounterRecord.builder()
                .counterId(counterId)
                .counterName(cell(row, col, ExtractSchema.COUNTER_NAME))
                .rawState(cell(row, col, ExtractSchema.STATE))
                .rawDistrict(cell(row, col, ExtractSchema.DISTRICT))
                .latitude(parseCoordinate(cell(row, col, ExtractSchema.LATITUDE)))
                .longitude(parseCoordinate(cell(row, col, ExtractSchema.LONGITUDE)))
                .build());
    }

    private Optional<UserRecord> toUser(String[] row, Map<String, List<Integer>> col) {
        String userId = cell(row, col, ExtractSchema.USER_ID);
        if (userId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(UserRecord.builder()
                .userId(userId)
                .userName(cell(row, col, ExtractSchema.USER_NAME))
                .territory(cell(row, col, ExtractSchema.TERRITORY))
                .employeeId(cell(row, col, ExtractSchema.EMPLOYEE_ID))
                .build());
    }

    private String cell(String[] row, Map<String, List<Integer>> col, String key) {
        for (int idx : col.getOrDefault(key, List.of())) {
            if (idx < row.length && row[idx] != null) {
                String value = row[idx].trim();
                if (!value.isEmpty()) return value;
            }
        }
        return "";
    }

    private Double parseCoordinate(String value) {
        if (value.isEmpty()) return null;
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean isBlankRow(String[] row) {
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        Optional<T> map(String[] row, Map<String, List<Integer>> col);
    }
}
