package com.jreinhal.compass.service;

import com.jreinhal.compass.calculation.CalculationOutcome;
import com.jreinhal.compass.calculation.CalculationResult;
import com.jreinhal.compass.dto.RetrievedRecord;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.schema.FieldCatalog;
import com.jreinhal.compass.schema.MetadataValue;
import com.jreinhal.compass.understanding.PeriodExtractor;
import com.jreinhal.compass.understanding.QueryIntent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds the user-facing answer text from retrieved records and calculation results.
 * Answers only ever restate retrieved values; nothing is generated.
 */
@Component
public class ResponseAssembler {

    public static final String NO_RESULTS = "관련 정보를 찾을 수 없습니다. 질문을 다시 표현해 주세요.";
    public static final String RETRIEVAL_FAILED = "데이터를 조회하는 중 문제가 발생했습니다. 잠시 후 다시 시도해 주세요.";
    private static final Set<String> INTERNAL_FIELDS = Set.of("documentId", "chunkType", "metadataType", "text", "content");
    private static final int MAX_LISTED_FIELDS = 8;

    public String blocked(PipelineStatus.Blocked status) {
        return status.message() + " (예상 대기 시간: 약 " + status.estimatedWaitSeconds() + "초)";
    }

    public String noResults(String clarification) {
        return clarification == null || clarification.isBlank() ? NO_RESULTS : NO_RESULTS + "\n" + clarification;
    }

    public String assemble(QueryIntent intent, List<RetrievedRecord> sources, CalculationOutcome calculation) {
        if (calculation != null) {
            return calculation.success()
                    ? describe(calculation.result())
                    : "계산에 필요한 데이터를 찾을 수 없습니다: " + calculation.error();
        }
        RetrievedRecord top = sources.get(0);
        List<String> lines = new ArrayList<>();
        Object period = top.metadata().get("period");
        if (period != null) {
            lines.add("[" + PeriodExtractor.formatForDisplay(String.valueOf(period)) + "]");
        }
        List<String> fields = intent.fields().isEmpty() ? new ArrayList<>(top.metadata().keySet()) : intent.fields();
        int listed = 0;
        for (String field : fields) {
            Object value = top.metadata().get(field);
            if (value == null || INTERNAL_FIELDS.contains(field) || "period".equals(field)) {
                continue;
            }
            lines.add(FieldCatalog.displayName(field) + ": " + formatValue(value));
            if (++listed >= MAX_LISTED_FIELDS) {
                break;
            }
        }
        if (listed == 0) {
            Object text = top.metadata().getOrDefault("text", top.metadata().get("content"));
            lines.add(text != null ? String.valueOf(text) : NO_RESULTS);
        }
        return String.join("\n", lines);
    }

    String describe(CalculationResult result) {
        Map<String, Object> b = result.breakdown();
        return switch (result.type()) {
            case MDRT_GAP -> Boolean.TRUE.equals(b.get("achieved"))
                    ? String.format("%s 기준을 이미 달성했습니다. (현재 %s원, 기준 %s원)",
                            standardName(b), won(b.get("current")), won(b.get("target")))
                    : String.format("%s 기준까지 %s원 남았습니다. (현재 %s원, 기준 %s원, 달성률 %.1f%%)",
                            standardName(b), won(b.get("gap")), won(b.get("current")), won(b.get("target")),
                            number(b.get("progress")));
            case PERIOD_DIFF -> {
                Object change = b.get("percentChange");
                String percent = change == null ? "" : String.format(" (%+.1f%%)", number(change));
                yield String.format("기간 대비 변화: %s원%s", signedWon(result.value()), percent);
            }
            case SUM -> String.format("%s 합계: %s원 (%s건)", FieldCatalog.displayName(String.valueOf(b.get("field"))),
                    won(result.value()), b.get("count"));
            case AVERAGE -> String.format("%s 평균: %s원 (%s건)", FieldCatalog.displayName(String.valueOf(b.get("field"))),
                    won(result.value()), b.get("count"));
            case COUNT -> String.format("총 %d건입니다.", (long) result.value());
            case PERCENTAGE -> String.format("%s 비율: %.1f%%", FieldCatalog.displayName(String.valueOf(b.get("field"))),
                    result.value());
            case TAX_REVERSE -> String.format("세전 금액은 %s원입니다. (실수령 %s원, 세금 %s원, 세율 %.1f%%)",
                    won(b.get("grossAmount")), won(b.get("netAmount")), won(b.get("taxAmount")),
                    number(b.get("taxRate")) * 100.0);
        };
    }

    private static String standardName(Map<String, Object> breakdown) {
        String id = String.valueOf(breakdown.get("standard")).toLowerCase(Locale.ROOT);
        String basis = id.startsWith("agi") ? "AGI" : "FYC";
        String tier = id.endsWith("tot") ? "TOT" : id.endsWith("cot") ? "COT" : "MDRT";
        return basis + " " + tier;
    }

    private static String formatValue(Object value) {
        return MetadataValue.of(value) instanceof MetadataValue.NumberValue number
                ? won(number.value())
                : String.valueOf(value);
    }

    private static String won(Object value) {
        return String.format("%,.0f", number(value));
    }

    private static String signedWon(double value) {
        return (value > 0 ? "+" : "") + String.format("%,.0f", value);
    }

    private static double number(Object value) {
        return MetadataValue.of(value).asDouble().orElse(0.0);
    }
}
