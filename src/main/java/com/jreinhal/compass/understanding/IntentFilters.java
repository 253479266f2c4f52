package com.jreinhal.compass.understanding;

import com.jreinhal.compass.calculation.CalculationType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates an intent's filters into the equality/membership filter map understood by the
 * vector store. A list value means "any of".
 */
public final class IntentFilters {
    public static final String PERIOD_KEY = "period";
    public static final String EMPLOYEE_ID_KEY = "employeeId";

    private IntentFilters() {}

    public static Map<String, Object> toVectorFilters(QueryIntent intent, QueryContext context,
            Collection<String> entityFilterFields) {
        Map<String, Object> filters = new LinkedHashMap<>();
        QueryIntent.Filters source = intent.filters();

        List<String> comparedPeriods = comparedPeriods(intent);
        if (!comparedPeriods.isEmpty()) {
            filters.put(PERIOD_KEY, comparedPeriods);
        } else if (source.hasPeriod()) {
            filters.put(PERIOD_KEY, source.period());
        } else if (source.hasYear()) {
            filters.put(PERIOD_KEY, monthsOf(source.year()));
        }
        if (source.metadataType() != null && !source.metadataType().isBlank()) {
            filters.put("metadataType", source.metadataType());
        }
        if (source.chunkType() != null && !source.chunkType().isBlank()) {
            filters.put("chunkType", source.chunkType());
        }
        if (entityFilterFields != null && context != null) {
            for (String field : entityFilterFields) {
                if (EMPLOYEE_ID_KEY.equals(field) && context.employeeId() != null && !context.employeeId().isBlank()) {
                    filters.put(EMPLOYEE_ID_KEY, context.employeeId());
                }
            }
        }
        return filters;
    }

    /**
     * Every {@code YYYYMM} period of the given year.
     */
    public static List<String> monthsOf(String year) {
        List<String> months = new ArrayList<>(12);
        for (int month = 1; month <= 12; month++) {
            months.add(year + String.format("%02d", month));
        }
        return months;
    }

    private static List<String> comparedPeriods(QueryIntent intent) {
        if (intent.calculation() == null || intent.calculation().type() != CalculationType.PERIOD_DIFF) {
            return List.of();
        }
        Object periods = intent.calculation().params().get("periods");
        if (!(periods instanceof Collection<?> values)) {
            return List.of();
        }
        return values.stream().map(String::valueOf).toList();
    }
}
