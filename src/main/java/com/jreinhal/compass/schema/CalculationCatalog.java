package com.jreinhal.compass.schema;

import com.jreinhal.compass.calculation.CalculationType;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Default calculations per template type. Availability is always derived from a field set.
 */
public final class CalculationCatalog {
    private static final Map<TemplateType, List<DiscoveredCalculation>> DEFAULTS = Map.of(
            TemplateType.COMPENSATION, List.of(
                    DiscoveredCalculation.definition(CalculationType.SUM, "합계", "선택 기간의 합계 계산",
                            List.of("totalCommission", "totalOverride", "totalIncentive")),
                    DiscoveredCalculation.definition(CalculationType.PERIOD_DIFF, "기간비교", "두 기간 간 차이 계산",
                            List.of("period", "totalCommission")),
                    DiscoveredCalculation.definition(CalculationType.AVERAGE, "평균", "선택 기간의 평균 계산",
                            List.of("totalCommission"))),
            TemplateType.MDRT, List.of(
                    DiscoveredCalculation.definition(CalculationType.MDRT_GAP, "MDRT 갭", "MDRT 달성까지 남은 금액",
                            List.of("fycAmount", "agiAmount")),
                    DiscoveredCalculation.definition(CalculationType.PERCENTAGE, "달성률", "MDRT 달성률 계산",
                            List.of("fycAmount", "agiAmount"))),
            TemplateType.GENERAL, List.of(
                    DiscoveredCalculation.definition(CalculationType.COUNT, "카운트", "항목 수 계산", List.of())));

    private CalculationCatalog() {}

    public static List<DiscoveredCalculation> defaultsFor(TemplateType templateType) {
        return DEFAULTS.getOrDefault(templateType, DEFAULTS.get(TemplateType.GENERAL));
    }

    public static List<DiscoveredCalculation> deriveFor(TemplateType templateType, Collection<String> fieldNames) {
        return defaultsFor(templateType).stream()
                .map(calc -> calc.deriveFor(fieldNames))
                .toList();
    }
}
