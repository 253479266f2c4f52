package com.jreinhal.compass.router;

import com.jreinhal.compass.schema.TemplateType;
import com.jreinhal.compass.understanding.IntentType;
import com.jreinhal.compass.understanding.QueryIntent;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds follow-up questions from whatever context an intent is missing.
 *
 * Question wording is chosen deterministically from the original query so the same query
 * always produces the same follow-up.
 */
@Component
public class ClarificationBuilder {

    public enum ClarificationType {
        TEMPLATE(1),
        PERIOD(2),
        FIELD(3),
        CALCULATION(4),
        GENERAL(5);

        private final int priority;

        ClarificationType(int priority) {
            this.priority = priority;
        }

        public int priority() {
            return priority;
        }
    }

    public record MissingContext(boolean period, boolean template, boolean field, boolean calculationType) {
    }

    public record Clarification(String question, ClarificationType type, List<String> options, int priority) {
    }

    private static final Map<ClarificationType, List<String>> QUESTION_TEMPLATES = new EnumMap<>(ClarificationType.class);
    private static final Map<IntentType, String> INTENT_HINTS = new EnumMap<>(IntentType.class);

    static {
        QUESTION_TEMPLATES.put(ClarificationType.PERIOD, List.of(
                "어느 기간의 정보를 찾으시나요?",
                "언제 데이터가 필요하신가요?",
                "몇 월 정보를 확인하고 싶으신가요?"));
        QUESTION_TEMPLATES.put(ClarificationType.TEMPLATE, List.of(
                "어떤 종류의 정보가 필요하신가요?",
                "수수료, MDRT, 일정 중 어떤 것이 궁금하신가요?",
                "무엇에 대해 알고 싶으신가요?"));
        QUESTION_TEMPLATES.put(ClarificationType.FIELD, List.of(
                "어떤 항목을 확인하고 싶으신가요?",
                "구체적으로 어떤 정보가 필요하신가요?"));
        QUESTION_TEMPLATES.put(ClarificationType.CALCULATION, List.of(
                "어떤 계산이 필요하신가요?",
                "비교, 합계, 또는 다른 계산이 필요하신가요?"));
        QUESTION_TEMPLATES.put(ClarificationType.GENERAL, List.of(
                "좀 더 구체적으로 말씀해 주시겠어요?",
                "어떤 정보를 찾고 계신지 조금 더 설명해 주실 수 있나요?",
                "무엇을 도와드릴까요?"));

        INTENT_HINTS.put(IntentType.DIRECT_LOOKUP, "예: \"이번달 총 수수료\", \"11월 커미션\"");
        INTENT_HINTS.put(IntentType.CALCULATION, "예: \"MDRT까지 얼마 남았어?\", \"지난달 대비 증가율\"");
        INTENT_HINTS.put(IntentType.COMPARISON, "예: \"10월과 11월 비교\", \"작년 대비\"");
        INTENT_HINTS.put(IntentType.AGGREGATION, "예: \"올해 총 수입\", \"평균 월 커미션\"");
        INTENT_HINTS.put(IntentType.GENERAL_QA, "예: \"다음주 일정\", \"회사 정책 설명\"");
    }

    private static final List<String> TEMPLATE_OPTIONS = List.of("💰 수수료/커미션", "🏆 MDRT 현황", "📅 일정/일반 정보");
    private static final List<String> PERIOD_OPTIONS = List.of("이번달", "지난달", "올해", "특정 월 (예: 11월)");
    private static final List<String> FIELD_OPTIONS = List.of("총 수수료", "커미션", "인센티브", "오버라이드", "기타");
    private static final List<String> CALCULATION_OPTIONS = List.of("MDRT 달성률", "기간 비교", "합계", "평균");

    private static final Set<IntentType> PERIOD_REQUIRED = EnumSet.of(
            IntentType.DIRECT_LOOKUP, IntentType.CALCULATION, IntentType.COMPARISON, IntentType.AGGREGATION);
    private static final Set<IntentType> FIELD_REQUIRED = EnumSet.of(IntentType.DIRECT_LOOKUP, IntentType.COMPARISON);

    private static final Pattern COMPENSATION_ANSWER = Pattern.compile("수수료|커미션|급여|지급|돈");
    private static final Pattern MDRT_ANSWER = Pattern.compile("mdrt|엠디알티|cot|tot|달성");
    private static final Pattern GENERAL_ANSWER = Pattern.compile("일정|스케줄|일반|기타|정보");
    private static final Pattern FIRST_OPTION = Pattern.compile("^1|첫\\s*번째");
    private static final Pattern SECOND_OPTION = Pattern.compile("^2|두\\s*번째");
    private static final Pattern THIRD_OPTION = Pattern.compile("^3|세\\s*번째");

    public MissingContext analyzeMissingContext(QueryIntent intent) {
        boolean needsPeriod = PERIOD_REQUIRED.contains(intent.intent());
        boolean needsField = FIELD_REQUIRED.contains(intent.intent());
        boolean hasPeriod = intent.filters().hasPeriod() || intent.filters().hasYear();
        return new MissingContext(
                !hasPeriod && needsPeriod,
                intent.template() == null || intent.template() == TemplateType.GENERAL,
                intent.fields().isEmpty() && needsField,
                intent.intent() == IntentType.CALCULATION && intent.calculation() == null);
    }

    public Clarification buildClarification(QueryIntent intent) {
        ClarificationType type = prioritize(analyzeMissingContext(intent));
        String question = pick(QUESTION_TEMPLATES.get(type), intent.originalQuery());
        String hint = intent.intent() == null ? null : INTENT_HINTS.get(intent.intent());
        String fullQuestion = hint == null ? question : question + "\n" + hint;
        return new Clarification(fullQuestion, type, optionsFor(type), type.priority());
    }

    /**
     * Single sentence asking for every missing piece at once.
     */
    public String buildCombinedClarification(QueryIntent intent) {
        MissingContext missing = analyzeMissingContext(intent);
        List<String> parts = new ArrayList<>();
        if (missing.template()) {
            parts.add("어떤 종류의 정보");
        }
        if (missing.period()) {
            parts.add("어느 기간");
        }
        if (missing.field()) {
            parts.add("어떤 항목");
        }
        if (parts.isEmpty()) {
            return QUESTION_TEMPLATES.get(ClarificationType.GENERAL).get(0);
        }
        if (parts.size() == 1) {
            return parts.get(0) + "가 필요하신지 말씀해 주세요.";
        }
        String last = parts.remove(parts.size() - 1);
        return String.join(", ", parts) + "와 " + last + "을 알려주시면 더 정확한 답변을 드릴 수 있어요.";
    }

    /**
     * Reads the user's answer to a template question, either by keyword or by option number.
     */
    public Optional<TemplateType> parseTemplateResponse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String normalized = response.trim().toLowerCase(Locale.ROOT);
        if (COMPENSATION_ANSWER.matcher(normalized).find()) {
            return Optional.of(TemplateType.COMPENSATION);
        }
        if (MDRT_ANSWER.matcher(normalized).find()) {
            return Optional.of(TemplateType.MDRT);
        }
        if (GENERAL_ANSWER.matcher(normalized).find()) {
            return Optional.of(TemplateType.GENERAL);
        }
        if (FIRST_OPTION.matcher(normalized).find()) {
            return Optional.of(TemplateType.COMPENSATION);
        }
        if (SECOND_OPTION.matcher(normalized).find()) {
            return Optional.of(TemplateType.MDRT);
        }
        if (THIRD_OPTION.matcher(normalized).find()) {
            return Optional.of(TemplateType.GENERAL);
        }
        return Optional.empty();
    }

    private ClarificationType prioritize(MissingContext missing) {
        if (missing.template()) {
            return ClarificationType.TEMPLATE;
        }
        if (missing.period()) {
            return ClarificationType.PERIOD;
        }
        if (missing.field()) {
            return ClarificationType.FIELD;
        }
        if (missing.calculationType()) {
            return ClarificationType.CALCULATION;
        }
        return ClarificationType.GENERAL;
    }

    private List<String> optionsFor(ClarificationType type) {
        return switch (type) {
            case TEMPLATE -> TEMPLATE_OPTIONS;
            case PERIOD -> PERIOD_OPTIONS;
            case FIELD -> FIELD_OPTIONS;
            case CALCULATION -> CALCULATION_OPTIONS;
            case GENERAL -> List.of();
        };
    }

    static String pick(List<String> candidates, String seed) {
        int hash = seed == null ? 0 : seed.hashCode();
        return candidates.get(Math.floorMod(hash, candidates.size()));
    }
}
