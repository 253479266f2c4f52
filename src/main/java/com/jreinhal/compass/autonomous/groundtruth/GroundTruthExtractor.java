package com.jreinhal.compass.autonomous.groundtruth;

import com.jreinhal.compass.model.GroundTruthRecord;
import com.jreinhal.compass.model.GroundTruthRecord.FieldValue;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads known-correct values out of a source sheet. One record per keyed row; each cell
 * becomes a {@link FieldValue} carrying its confidence and a {@code Sheet!RowN} locator.
 */
@Component
public class GroundTruthExtractor {
    private static final Logger log = LoggerFactory.getLogger(GroundTruthExtractor.class);

    static final double NUMBER_CONFIDENCE = 0.95;
    static final double TEXT_CONFIDENCE = 0.8;
    private static final double IMPLAUSIBLE_MAGNITUDE = 1e12;
    private static final double IMPLAUSIBLE_PENALTY = 0.8;

    private static final Set<String> TRUE_WORDS = Set.of("true", "yes", "예", "y");
    private static final Set<String> FALSE_WORDS = Set.of("false", "no", "아니오", "n");
    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern PERIOD_SEPARATORS = Pattern.compile("[년월\\-/\\s]");
    private static final Pattern SIX_DIGITS = Pattern.compile("^\\d{6}$");
    private static final Pattern FOUR_DIGITS = Pattern.compile("^\\d{4}$");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})[^\\d]*(\\d{1,2})");

    private final Clock clock;

    public GroundTruthExtractor(Clock clock) {
        this.clock = clock;
    }

    public List<GroundTruthRecord> extract(SourceSheet sheet, ExtractionConfig config) {
        List<GroundTruthRecord> records = new ArrayList<>();
        int skippedRows = 0;
        List<Map<String, Object>> rows = sheet.rows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            Object key = cellValue(row, config.keyColumn());
            if (isBlank(key) && config.skipNullKeys()) {
                skippedRows++;
                continue;
            }

            Map<String, String> entity = new LinkedHashMap<>();
            if (!isBlank(key)) {
                entity.put("employeeId", keyText(key));
            }
            if (config.periodColumn() != null) {
                Object period = cellValue(row, config.periodColumn());
                if (!isBlank(period)) {
                    entity.put("period", normalizePeriod(keyText(period)));
                }
            }

            Instant now = Instant.now(this.clock);
            String source = sheet.name() + "!Row" + (i + 2);
            Map<String, FieldValue> fieldValues = new LinkedHashMap<>();
            Collection<String> columns = config.fields().isEmpty() ? row.keySet() : config.fields();
            for (String column : columns) {
                if (column.equals(config.keyColumn()) || column.equals(config.periodColumn())) {
                    continue;
                }
                Object raw = cellValue(row, column);
                double confidence = fieldConfidence(raw);
                if (confidence >= config.minConfidence()) {
                    fieldValues.put(normalizeFieldName(column), new FieldValue(normalizeValue(raw), confidence, source, now));
                }
            }
            if (fieldValues.isEmpty()) {
                skippedRows++;
                continue;
            }
            records.add(new GroundTruthRecord(config.schemaId(), config.documentId(), entity, fieldValues, now));
        }
        log.info("Extracted {} ground truth records from sheet {} ({} rows, {} skipped)",
                records.size(), sheet.name(), rows.size(), skippedRows);
        return records;
    }

    /**
     * Numbers lose thousands separators, yes/no words become booleans, anything else is kept as
     * trimmed text.
     */
    public static Object normalizeValue(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        if (raw instanceof Boolean) {
            return raw;
        }
        String text = String.valueOf(raw).trim();
        String withoutCommas = text.replace(",", "");
        if (NUMERIC.matcher(withoutCommas).matches()) {
            return Double.parseDouble(withoutCommas);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (TRUE_WORDS.contains(lower)) {
            return Boolean.TRUE;
        }
        if (FALSE_WORDS.contains(lower)) {
            return Boolean.FALSE;
        }
        return text;
    }

    public static String normalizePeriod(String raw) {
        if (raw == null) {
            return null;
        }
        String stripped = PERIOD_SEPARATORS.matcher(raw).replaceAll("");
        if (SIX_DIGITS.matcher(stripped).matches()) {
            return stripped;
        }
        if (FOUR_DIGITS.matcher(stripped).matches()) {
            return stripped + "01";
        }
        Matcher match = YEAR_MONTH.matcher(raw);
        if (match.find()) {
            return match.group(1) + String.format("%02d", Integer.parseInt(match.group(2)));
        }
        return stripped;
    }

    public static String normalizeFieldName(String name) {
        return name.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("[\\s_-]+", "_")
                .replaceAll("[^a-z0-9가-힣_]", "");
    }

    static double fieldConfidence(Object raw) {
        if (raw == null || (raw instanceof String text && text.isBlank())) {
            return 0.0;
        }
        if (raw instanceof Number number) {
            return Math.abs(number.doubleValue()) > IMPLAUSIBLE_MAGNITUDE
                    ? NUMBER_CONFIDENCE * IMPLAUSIBLE_PENALTY : NUMBER_CONFIDENCE;
        }
        return TEXT_CONFIDENCE;
    }

    private static Object cellValue(Map<String, Object> row, String column) {
        if (row.containsKey(column)) {
            return row.get(column);
        }
        // header cells often carry stray whitespace
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(column.trim())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static boolean isBlank(Object value) {
        return value == null || String.valueOf(value).isBlank();
    }

    private static String keyText(Object value) {
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return String.valueOf(number.longValue());
        }
        return String.valueOf(value).trim();
    }
}
