package com.jreinhal.compass.understanding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.compass.calculation.CalculationType;
import com.jreinhal.compass.llm.LlmGenerationException;
import com.jreinhal.compass.llm.LlmGenerator;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.pipeline.SchemaCacheCoordinator;
import com.jreinhal.compass.pipeline.UpdateReason;
import com.jreinhal.compass.reasoning.ReasoningStep;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.schema.DiscoveredField;
import com.jreinhal.compass.schema.DynamicSchema;
import com.jreinhal.compass.schema.FieldCategory;
import com.jreinhal.compass.schema.FieldType;
import com.jreinhal.compass.schema.SchemaOverrideRegistry;
import com.jreinhal.compass.schema.TemplateInference;
import com.jreinhal.compass.schema.TemplateType;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class QueryUnderstandingServiceTest {

    private static final Clock NOVEMBER_2025 = Clock.fixed(Instant.parse("2025-11-15T03:00:00Z"), ZoneOffset.UTC);
    private static final List<String> NAMESPACES = List.of("commission");

    private SchemaCacheCoordinator coordinator;
    private SchemaOverrideRegistry overrideRegistry;
    private LlmGenerator llmGenerator;
    private ReasoningTracer tracer;
    private QueryUnderstandingService service;

    @BeforeEach
    void setUp() {
        coordinator = mock(SchemaCacheCoordinator.class);
        overrideRegistry = new SchemaOverrideRegistry();
        llmGenerator = mock(LlmGenerator.class);
        tracer = mock(ReasoningTracer.class);
        service = new QueryUnderstandingService(coordinator, overrideRegistry, llmGenerator, tracer,
                new ObjectMapper(), NOVEMBER_2025);

        when(coordinator.checkPipelineStatus(anyCollection())).thenReturn(new PipelineStatus.Ready(true, null));
        when(coordinator.getSchemas(anyCollection())).thenReturn(List.of(commissionSchema()));
        when(coordinator.getPrompt(anyCollection())).thenReturn("## 수수료 데이터");
    }

    private static DiscoveredField numberField(String name, String displayName, FieldCategory category) {
        return new DiscoveredField(name, FieldType.NUMBER, displayName, displayName, List.of(), 1.0, category, List.of());
    }

    private static DynamicSchema commissionSchema() {
        List<DiscoveredField> fields = List.of(
                new DiscoveredField("period", FieldType.DATE, "기간", "기간", List.of(), 1.0, FieldCategory.PERIOD, List.of()),
                numberField("totalCommission", "총 수수료", FieldCategory.COMMISSION),
                numberField("netPayment", "실지급액", FieldCategory.PAYMENT),
                numberField("contractCount", "계약 건수", FieldCategory.CONTRACT));
        return new DynamicSchema(TemplateType.COMPENSATION,
                TemplateInference.heuristic(TemplateType.COMPENSATION, 0.8, "commission fields"),
                "commission", fields, List.of(), List.of(), 120, Instant.parse("2025-11-01T00:00:00Z"),
                Instant.parse("2025-11-15T00:00:00Z"));
    }

    private QueryIntent analyze(String query) {
        return service.analyzeQuery(query, QueryContext.forNamespaces(NAMESPACES)).intent();
    }

    @Nested
    @DisplayName("Rule-based intents")
    class RuleBased {

        @Test
        void mdrtGapQuestion() {
            QueryIntent intent = analyze("MDRT까지 얼마 남았어?");

            assertEquals(IntentType.CALCULATION, intent.intent());
            assertEquals(TemplateType.MDRT, intent.template());
            assertEquals(CalculationType.MDRT_GAP, intent.calculation().type());
            assertEquals("fycMdrt", intent.calculation().params().get("standard"));
            assertEquals("totalCommission", intent.calculation().params().get("field"));
            assertEquals(0.8, intent.confidence(), 1e-9);
            assertTrue(intent.semanticSearch().enabled());
            assertEquals(5, intent.semanticSearch().topK());
        }

        @Test
        void achievementRateUsesPercentage() {
            QueryIntent intent = analyze("COT 달성률 계산해줘");

            assertEquals(CalculationType.PERCENTAGE, intent.calculation().type());
            assertEquals("fycCot", intent.calculation().params().get("standard"));
        }

        @Test
        void currentMonthLookup() {
            QueryIntent intent = analyze("이번달 수수료 알려줘");

            assertEquals(IntentType.DIRECT_LOOKUP, intent.intent());
            assertEquals(TemplateType.COMPENSATION, intent.template());
            assertEquals(List.of("totalCommission"), intent.fields());
            assertEquals("202511", intent.filters().period());
            assertNull(intent.calculation());
            assertFalse(intent.semanticSearch().enabled());
            assertEquals(0.9, intent.confidence(), 1e-9);
        }

        @Test
        void comparisonAgainstLastMonth() {
            QueryIntent intent = analyze("지난달 대비 수수료 변화");

            assertEquals(IntentType.COMPARISON, intent.intent());
            assertEquals(CalculationType.PERIOD_DIFF, intent.calculation().type());
            assertEquals(List.of("202510", "202511"), intent.calculation().params().get("periods"));
            assertEquals("totalCommission", intent.calculation().params().get("field"));
        }

        @Test
        void comparisonOfTwoExplicitMonthsIsChronological() {
            QueryIntent intent = analyze("11월과 9월 수수료 비교");

            assertEquals(List.of("202509", "202511"), intent.calculation().params().get("periods"));
        }

        @Test
        void comparisonOfOneMonthUsesMonthBefore() {
            QueryIntent intent = analyze("8월 수수료 변화");

            assertEquals(List.of("202507", "202508"), intent.calculation().params().get("periods"));
        }

        @Test
        void yearlyAggregationUsesYearFilter() {
            QueryIntent intent = analyze("올해 총 수수료");

            assertEquals(IntentType.AGGREGATION, intent.intent());
            assertEquals(CalculationType.SUM, intent.calculation().type());
            assertEquals("2025", intent.filters().year());
            assertNull(intent.filters().period());
            assertEquals(0.9, intent.confidence(), 1e-9);
        }

        @Test
        void countAndAverage() {
            assertEquals(CalculationType.COUNT, analyze("11월 계약 몇 건이야?").calculation().type());
            assertEquals(CalculationType.AVERAGE, analyze("평균 수수료").calculation().type());
        }

        @Test
        void taxReverseUsesNetPaymentField() {
            QueryIntent intent = analyze("세전 금액 계산해줘");

            assertEquals(CalculationType.TAX_REVERSE, intent.calculation().type());
            assertEquals("netPayment", intent.calculation().params().get("field"));
            assertEquals(0.033, intent.calculation().params().get("rate"));
        }

        @Test
        void unmatchedQueryIsGeneral() {
            QueryIntent intent = analyze("회사 정책 설명");

            assertEquals(IntentType.GENERAL_QA, intent.intent());
            assertEquals(TemplateType.GENERAL, intent.template());
            assertEquals(0.5, intent.confidence(), 1e-9);
            assertEquals(List.of(), intent.extractedEntities().get("intentCandidates"));
        }

        @Test
        void confirmedContextFillsGaps() {
            QueryContext context = new QueryContext(NAMESPACES, "E001", null, List.of(), true, "202509",
                    TemplateType.COMPENSATION);

            QueryIntent intent = service.analyzeQuery("얼마야?", context).intent();

            assertEquals("202509", intent.filters().period());
            assertEquals(TemplateType.COMPENSATION, intent.template());
            assertEquals("E001", intent.extractedEntities().get("employeeId"));
        }

        @Test
        void optimizerAliasesResolveFields() {
            overrideRegistry.update("commission", o -> o.withAliases("totalCommission", List.of("보상금")));

            assertEquals(List.of("totalCommission"), analyze("이번달 보상금 알려줘").fields());
        }

        @Test
        void intentAnalysisIsTraced() {
            analyze("이번달 수수료 알려줘");

            verify(tracer).addStep(eq(ReasoningStep.StepType.INTENT_ANALYSIS), eq("Intent Analysis"), anyString(),
                    anyLong(), anyMap());
        }
    }

    @Nested
    @DisplayName("Pipeline gate")
    class Gate {

        @Test
        void blockedPipelineReturnsNoIntent() {
            when(coordinator.checkPipelineStatus(anyCollection())).thenReturn(new PipelineStatus.Blocked(
                    PipelineStatus.BlockReason.NAMESPACE, "업데이트 중", 5000, List.of("commission")));

            UnderstandingResult result = service.analyzeQuery("이번달 수수료", QueryContext.forNamespaces(NAMESPACES));

            assertTrue(result.isBlocked());
            assertNull(result.intent());
            verify(tracer).addStep(eq(ReasoningStep.StepType.PIPELINE_GATE), anyString(), anyString(), anyLong(), anyMap());
            verify(coordinator, never()).getSchemas(anyCollection());
        }

        @Test
        void missingSchemaTriggersInitialDiscovery() {
            when(coordinator.needsInitialUpdate("commission")).thenReturn(true);

            UnderstandingResult result = service.analyzeQuery("이번달 수수료", QueryContext.forNamespaces(NAMESPACES));

            verify(coordinator).requestUpdate(eq("commission"), eq(UpdateReason.INITIAL), isNull());
            assertFalse(result.isBlocked());
            assertEquals(List.of("commission"), result.schemasUsed());
        }
    }

    @Nested
    @DisplayName("LLM refinement")
    class LlmRefinement {

        @BeforeEach
        void enableLlm() {
            ReflectionTestUtils.setField(service, "llmEnabled", true);
        }

        @Test
        void modelOutputReplacesRuleIntent() {
            when(llmGenerator.generate(anyString(), anyString(), any())).thenReturn("""
                    ```json
                    {"intent": "comparison", "template": "compensation", "fields": ["totalCommission"],
                     "calculation": {"type": "period_diff", "params": {"field": "totalCommission", "periods": ["202509", "202510"]}},
                     "filters": {"period": "2025-10"}, "confidence": 0.92}
                    ```""");

            UnderstandingResult result = service.analyzeQuery("9월이랑 10월 비교", QueryContext.forNamespaces(NAMESPACES));

            assertEquals("llm", result.modelUsed());
            assertEquals(IntentType.COMPARISON, result.intent().intent());
            assertEquals("202510", result.intent().filters().period());
            assertEquals(List.of("202509", "202510"), result.intent().calculation().params().get("periods"));
            assertEquals(0.92, result.intent().confidence(), 1e-9);
        }

        @Test
        void failedModelCallKeepsRuleIntent() {
            when(llmGenerator.generate(anyString(), anyString(), any())).thenThrow(new LlmGenerationException("timeout"));

            UnderstandingResult result = service.analyzeQuery("이번달 수수료 알려줘", QueryContext.forNamespaces(NAMESPACES));

            assertEquals("rule-based", result.modelUsed());
            assertEquals(IntentType.DIRECT_LOOKUP, result.intent().intent());
        }

        @Test
        void yearPeriodBecomesYearFilter() throws Exception {
            QueryIntent intent = service.parseLlmResponse(
                    "{\"intent\": \"aggregation\", \"template\": \"unknown\", \"filters\": {\"period\": \"올해\"}}", "올해 총 수입");

            assertEquals("2025", intent.filters().year());
            assertNull(intent.filters().period());
            assertEquals(TemplateType.GENERAL, intent.template());
            assertEquals(0.5, intent.confidence(), 1e-9);
        }
    }

    @Test
    void markdownFencesAreStripped() {
        assertEquals("{\"a\":1}", QueryUnderstandingService.stripMarkdownFences("```json\n{\"a\":1}\n```"));
        assertEquals("", QueryUnderstandingService.stripMarkdownFences(null));
    }

    @Test
    void blankQueryFallsBack() {
        QueryIntent intent = service.analyzeRuleBased("  ", QueryContext.forNamespaces(NAMESPACES), List.of());

        assertEquals(IntentType.GENERAL_QA, intent.intent());
        assertEquals(QueryIntent.FALLBACK_CONFIDENCE, intent.confidence(), 1e-9);
    }
}
