package com.jreinhal.compass.calculation;

import com.jreinhal.compass.exception.CalculationException;
import com.jreinhal.compass.schema.MetadataValue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates named calculations over retrieved metadata rows.
 *
 * Each row is the metadata map of one retrieved vector. Required inputs that are missing
 * or not numeric raise {@link CalculationException}; {@link #evaluateSafely} turns that into
 * a failed {@link CalculationOutcome} so one bad calculation never fails a whole query.
 */
@Component
public class CalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(CalculationEngine.class);

    public static final double DEFAULT_TAX_RATE = 0.033;
    private static final String PERIOD_FIELD = "period";

    public CalculationOutcome evaluateSafely(CalculationType type, List<Map<String, MetadataValue>> rows,
            Map<String, Object> params) {
        try {
            return CalculationOutcome.success(evaluate(type, rows, params));
        } catch (CalculationException e) {
            log.warn("Calculation {} failed on field {}: {}", type, e.getField(), e.getMessage());
            return CalculationOutcome.failure(e.getMessage());
        }
    }

    /**
     * Single-row convenience form.
     */
    public CalculationResult evaluate(CalculationType type, Map<String, MetadataValue> fields, Map<String, Object> params) {
        return evaluate(type, fields == null ? List.of() : List.of(fields), params);
    }

    public CalculationResult evaluate(CalculationType type, List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        List<Map<String, MetadataValue>> data = rows == null ? List.of() : rows;
        Map<String, Object> p = params == null ? Map.of() : params;
        return switch (type) {
            case MDRT_GAP -> mdrtGap(data, p);
            case PERIOD_DIFF -> periodDiff(data, p);
            case SUM -> sum(data, p);
            case AVERAGE -> average(data, p);
            case COUNT -> count(data);
            case PERCENTAGE -> percentage(data, p);
            case TAX_REVERSE -> taxReverse(data, p);
        };
    }

    private CalculationResult mdrtGap(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        MdrtStandard standard = standardParam(params).orElse(MdrtStandard.FYC_MDRT);
        String field = stringParam(params, "field")
                .orElse(standard.isFycBased() ? "fycAmount" : "agiAmount");

        List<Double> values = numericValues(rows, field);
        double current = values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        double target = standard.threshold();
        double gap = Math.max(0.0, target - current);

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("standard", standard.id());
        breakdown.put("field", field);
        breakdown.put("current", current);
        breakdown.put("target", target);
        breakdown.put("gap", gap);
        breakdown.put("progress", current / target * 100.0);
        breakdown.put("achieved", current >= target);
        return new CalculationResult(CalculationType.MDRT_GAP, gap, breakdown);
    }

    private CalculationResult periodDiff(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        String field = requireStringParam(params, "field");
        Object rawPeriods = params.get("periods");
        if (!(rawPeriods instanceof Collection<?> periods) || periods.size() != 2) {
            throw new CalculationException("periods", "period_diff needs exactly two periods");
        }
        List<String> pair = periods.stream().map(String::valueOf).toList();
        String from = pair.get(0);
        String to = pair.get(1);

        double fromValue = valueForPeriod(rows, field, from);
        double toValue = valueForPeriod(rows, field, to);
        double difference = toValue - fromValue;

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put(from, fromValue);
        breakdown.put(to, toValue);
        breakdown.put("difference", difference);
        breakdown.put("percentChange", fromValue == 0.0 ? null : difference / Math.abs(fromValue) * 100.0);
        return new CalculationResult(CalculationType.PERIOD_DIFF, difference, breakdown);
    }

    private CalculationResult sum(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        String field = requireStringParam(params, "field");
        List<Double> values = numericValues(rows, field);
        double total = values.stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("field", field);
        breakdown.put("count", values.size());
        breakdown.put("sum", total);
        return new CalculationResult(CalculationType.SUM, total, breakdown);
    }

    private CalculationResult average(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        String field = requireStringParam(params, "field");
        List<Double> values = numericValues(rows, field);
        double total = values.stream().mapToDouble(Double::doubleValue).sum();
        double mean = total / values.size();
        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("field", field);
        breakdown.put("count", values.size());
        breakdown.put("sum", total);
        breakdown.put("average", mean);
        return new CalculationResult(CalculationType.AVERAGE, mean, breakdown);
    }

    private CalculationResult count(List<Map<String, MetadataValue>> rows) {
        return new CalculationResult(CalculationType.COUNT, rows.size(), Map.of("count", rows.size()));
    }

    private CalculationResult percentage(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        String field = requireStringParam(params, "field");
        double total;
        Optional<Double> explicitTotal = numberParam(params, "total");
        if (explicitTotal.isPresent()) {
            total = explicitTotal.get();
        } else {
            total = standardParam(params)
                    .map(standard -> (double) standard.threshold())
                    .orElseThrow(() -> new CalculationException("total", "percentage needs a total or an MDRT standard"));
        }
        if (total == 0.0) {
            throw new CalculationException("total", "percentage total must not be zero");
        }
        double part = numericValues(rows, field).stream().mapToDouble(Double::doubleValue).sum();
        double percent = part / total * 100.0;

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("field", field);
        breakdown.put("part", part);
        breakdown.put("total", total);
        breakdown.put("percentage", percent);
        return new CalculationResult(CalculationType.PERCENTAGE, percent, breakdown);
    }

    private CalculationResult taxReverse(List<Map<String, MetadataValue>> rows, Map<String, Object> params) {
        double rate = numberParam(params, "rate").orElse(DEFAULT_TAX_RATE);
        if (rate < 0.0 || rate >= 1.0) {
            throw new CalculationException("rate", "tax rate must be in [0, 1): " + rate);
        }
        double net;
        Optional<Double> explicitNet = numberParam(params, "netAmount");
        if (explicitNet.isPresent()) {
            net = explicitNet.get();
        } else {
            String field = requireStringParam(params, "field");
            net = numericValues(rows, field).stream().mapToDouble(Double::doubleValue).sum();
        }
        double gross = net / (1.0 - rate);

        Map<String, Object> breakdown = new LinkedHashMap<>();
        breakdown.put("netAmount", net);
        breakdown.put("grossAmount", gross);
        breakdown.put("taxAmount", gross - net);
        breakdown.put("taxRate", rate);
        return new CalculationResult(CalculationType.TAX_REVERSE, gross, breakdown);
    }

    private double valueForPeriod(List<Map<String, MetadataValue>> rows, String field, String period) {
        List<Map<String, MetadataValue>> matching = new ArrayList<>();
        for (Map<String, MetadataValue> row : rows) {
            MetadataValue value = row.get(PERIOD_FIELD);
            if (value != null && period.equals(value.asText())) {
                matching.add(row);
            }
        }
        if (matching.isEmpty()) {
            throw new CalculationException(field, "No " + field + " value for period " + period);
        }
        return numericValues(matching, field).stream().mapToDouble(Double::doubleValue).sum();
    }

    /**
     * Numeric values of {@code field} across the rows that contain it. Throws when no row
     * contains the field or a present value is not numeric.
     */
    private List<Double> numericValues(List<Map<String, MetadataValue>> rows, String field) {
        List<Double> values = new ArrayList<>();
        for (Map<String, MetadataValue> row : rows) {
            MetadataValue value = row.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            Double number = value.asDouble()
                    .orElseThrow(() -> new CalculationException(field,
                            "Field " + field + " is not numeric: " + value.asText()));
            values.add(number);
        }
        if (values.isEmpty()) {
            throw new CalculationException(field, "Required field " + field + " is missing");
        }
        return values;
    }

    private static Optional<MdrtStandard> standardParam(Map<String, Object> params) {
        Optional<String> id = stringParam(params, "standard");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MdrtStandard.fromId(id.get())
                .orElseThrow(() -> new CalculationException("standard", "Unknown MDRT standard: " + id.get())));
    }

    private static Optional<String> stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(value));
    }

    private static String requireStringParam(Map<String, Object> params, String key) {
        return stringParam(params, key)
                .orElseThrow(() -> new CalculationException(key, "Missing required parameter: " + key));
    }

    private static Optional<Double> numberParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        Optional<Double> parsed = MetadataValue.of(String.valueOf(value)).asDouble();
        if (parsed.isEmpty()) {
            throw new CalculationException(key, "Parameter " + key + " is not numeric: " + value);
        }
        return parsed;
    }
}
