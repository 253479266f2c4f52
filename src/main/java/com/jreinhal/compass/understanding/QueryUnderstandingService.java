package com.jreinhal.compass.understanding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.compass.calculation.CalculationType;
import com.jreinhal.compass.calculation.MdrtStandard;
import com.jreinhal.compass.llm.GenerationOptions;
import com.jreinhal.compass.llm.LlmGenerator;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.pipeline.SchemaCacheCoordinator;
import com.jreinhal.compass.pipeline.UpdateReason;
import com.jreinhal.compass.reasoning.ReasoningStep.StepType;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.schema.DiscoveredField;
import com.jreinhal.compass.schema.DynamicSchema;
import com.jreinhal.compass.schema.FieldCategory;
import com.jreinhal.compass.schema.SchemaOverrideRegistry;
import com.jreinhal.compass.schema.TemplateType;
import com.jreinhal.compass.understanding.PeriodExtractor.PeriodFilter;
import com.jreinhal.compass.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns a routed query into a structured {@link QueryIntent}.
 *
 * The pipeline gate is always checked first: while a schema update is running for any of
 * the requested namespaces no intent is produced. The rule-based reading is deterministic;
 * an optional LLM pass can refine it but never replaces it on failure.
 */
@Service
public class QueryUnderstandingService {

    private static final Logger log = LoggerFactory.getLogger(QueryUnderstandingService.class);

    private static final String RULE_BASED_MODEL = "rule-based";
    private static final double BASE_CONFIDENCE = 0.5;
    private static final double MAX_RULE_CONFIDENCE = 0.9;
    private static final double DEFAULT_TAX_RATE = 0.033;

    private record IntentRule(Pattern pattern, IntentType intent) {
    }

    // Order matters: the first matching rule decides the intent.
    private static final List<IntentRule> INTENT_RULES = List.of(
            new IntentRule(Pattern.compile("까지.*얼마|남았|달성하려면|달성률|계산|세전|역산"), IntentType.CALCULATION),
            new IntentRule(Pattern.compile("대비|비교|변화|추이|차이|증감"), IntentType.COMPARISON),
            new IntentRule(Pattern.compile("총|합계|몇\\s*건|건수|평균|전체|누적"), IntentType.AGGREGATION),
            new IntentRule(Pattern.compile("알려줘|확인|조회|얼마|보여줘|뭐야"), IntentType.DIRECT_LOOKUP));

    private static final Pattern MDRT_TEMPLATE = Pattern.compile(
            "(?<![a-z])(mdrt|cot|tot|fyc|agi)(?![a-z])|달성", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPENSATION_TEMPLATE = Pattern.compile(
            "수수료|커미션|수입|급여|지급|오버라이드|인센티브|시책|환수|소득|세전|실수령");

    private static final Pattern ACHIEVEMENT_RATE = Pattern.compile("달성률");
    private static final Pattern TAX_REVERSE = Pattern.compile("세전|역산");
    private static final Pattern AVERAGE = Pattern.compile("평균");
    private static final Pattern COUNT = Pattern.compile("몇\\s*건|건수");
    private static final Pattern AGI_BASIS = Pattern.compile("(?<![a-z])agi(?![a-z])|소득", Pattern.CASE_INSENSITIVE);
    private static final Pattern COT_TIER = Pattern.compile("(?<![a-z])cot(?![a-z])", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOT_TIER = Pattern.compile("(?<![a-z])tot(?![a-z])", Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKDOWN_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");

    private static final List<String> FYC_FIELD_CANDIDATES = List.of("fycAmount", "fyc", "fycTotal", "totalCommission");
    private static final List<String> AGI_FIELD_CANDIDATES = List.of("agiAmount", "agi", "agiTotal", "totalIncome");
    private static final List<String> TAX_FIELD_CANDIDATES = List.of("netPayment", "finalPayment");
    private static final List<String> AMOUNT_FIELD_CANDIDATES = List.of("totalCommission", "fycAmount", "totalIncome", "finalPayment");

    private static final Map<String, List<String>> FIELD_KEYWORDS = Map.ofEntries(
            Map.entry("totalCommission", List.of("수수료", "커미션", "commission")),
            Map.entry("totalOverride", List.of("오버라이드", "override")),
            Map.entry("totalIncentive", List.of("인센티브", "시책", "incentive")),
            Map.entry("totalClawback", List.of("환수", "clawback")),
            Map.entry("finalPayment", List.of("최종지급", "지급액")),
            Map.entry("netPayment", List.of("실수령")),
            Map.entry("contractCount", List.of("계약 건수", "계약건수", "건수")),
            Map.entry("totalIncome", List.of("수입", "소득", "급여", "income")),
            Map.entry("fycAmount", List.of("fyc", "초년도")),
            Map.entry("agiAmount", List.of("agi")));

    private static final String INTENT_SYSTEM_PROMPT = """
            당신은 정보 조회 시스템의 쿼리 분석 전문가입니다.
            사용자의 비정형 한국어 질문을 분석하여 구조화된 검색 의도로 변환합니다.

            ## 의도 분류
            - direct_lookup: 특정 값을 직접 조회 ("○○ 알려줘", "내 ○○")
            - calculation: 계산이 필요한 경우 ("○○까지 얼마 남았어?", "○○ 계산해줘")
            - comparison: 두 개 이상의 값을 비교 ("○○ 대비", "변화", "추이")
            - aggregation: 합산, 평균, 카운트 ("총 ○○", "몇 건이야?", "평균")
            - general_qa: 위에 해당하지 않는 일반 질문

            ## 기간 해석 규칙
            사용자가 명시적으로 기간을 언급한 경우에만 period 필터를 추가합니다 (YYYYMM 형식).
            "올해"는 연도 필터만 사용하고 period는 생략합니다.
            현재 년월: %s

            ## 응답 형식
            설명 없이 아래 JSON만 출력하세요.
            {"intent": "...", "template": "compensation | mdrt | general", "fields": [],
             "calculation": {"type": "mdrt_gap | period_diff | sum | average | count | percentage | tax_reverse", "params": {}},
             "filters": {"period": "", "metadataType": "", "chunkType": "", "customFilter": ""},
             "semanticSearch": {"enabled": true, "query": "", "topK": 5},
             "confidence": 0.9, "extractedEntities": {}}

            ## 사용 가능한 데이터
            %s
            """;

    private final SchemaCacheCoordinator coordinator;
    private final SchemaOverrideRegistry overrideRegistry;
    private final LlmGenerator llmGenerator;
    private final ReasoningTracer reasoningTracer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${compass.understanding.llm-enabled:false}")
    private boolean llmEnabled;

    @Value("${compass.understanding.top-k.direct-lookup:3}")
    private int lookupTopK = 3;

    @Value("${compass.understanding.top-k.calculation:5}")
    private int calculationTopK = 5;

    @Value("${compass.understanding.top-k.comparison:10}")
    private int comparisonTopK = 10;

    @Value("${compass.understanding.top-k.aggregation:20}")
    private int aggregationTopK = 20;

    @Value("${compass.understanding.top-k.general-qa:5}")
    private int generalTopK = 5;

    public QueryUnderstandingService(SchemaCacheCoordinator coordinator,
                                     SchemaOverrideRegistry overrideRegistry,
                                     LlmGenerator llmGenerator,
                                     ReasoningTracer reasoningTracer,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        this.coordinator = coordinator;
        this.overrideRegistry = overrideRegistry;
        this.llmGenerator = llmGenerator;
        this.reasoningTracer = reasoningTracer;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Query understanding initialized (llmEnabled={}, topK lookup={}, calc={}, comparison={}, aggregation={}, general={})",
                llmEnabled, lookupTopK, calculationTopK, comparisonTopK, aggregationTopK, generalTopK);
    }

    public UnderstandingResult analyzeQuery(String query, QueryContext context) {
        long startTime = System.currentTimeMillis();
        QueryContext ctx = context != null ? context : QueryContext.forNamespaces(List.of());
        List<String> namespaces = ctx.namespaces();

        PipelineStatus status = coordinator.checkPipelineStatus(namespaces);
        if (status.blocked()) {
            return blockedResult(status, startTime);
        }

        boolean requested = false;
        for (String namespace : namespaces) {
            if (coordinator.needsInitialUpdate(namespace)) {
                log.info("Namespace {} has no schema yet, requesting initial discovery", namespace);
                coordinator.requestUpdate(namespace, UpdateReason.INITIAL, null);
                requested = true;
            }
        }
        if (requested) {
            status = coordinator.checkPipelineStatus(namespaces);
            if (status.blocked()) {
                return blockedResult(status, startTime);
            }
        }

        List<DynamicSchema> schemas = coordinator.getSchemas(namespaces);
        QueryIntent intent = analyzeRuleBased(query, ctx, schemas);
        String modelUsed = RULE_BASED_MODEL;

        if (llmEnabled) {
            Optional<QueryIntent> refined = refineWithLlm(query, namespaces);
            if (refined.isPresent()) {
                intent = refined.get();
                modelUsed = "llm";
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        logIntentStep(intent, modelUsed, duration);
        List<String> schemasUsed = schemas.stream().map(DynamicSchema::namespace).toList();
        return new UnderstandingResult(intent, status, duration, modelUsed, schemasUsed);
    }

    /**
     * Deterministic reading of the query against the cached schemas.
     */
    public QueryIntent analyzeRuleBased(String query, QueryContext context, List<DynamicSchema> schemas) {
        String text = query == null ? "" : query.trim();
        if (text.isEmpty()) {
            return QueryIntent.fallback(text);
        }

        List<String> candidates = new ArrayList<>();
        for (IntentRule rule : INTENT_RULES) {
            if (rule.pattern().matcher(text).find()) {
                candidates.add(rule.intent().id());
            }
        }
        IntentType intentType = candidates.isEmpty() ? IntentType.GENERAL_QA : IntentType.fromId(candidates.get(0));

        TemplateType template = detectTemplate(text);
        if (template == TemplateType.GENERAL && context != null && context.confirmedTemplate() != null) {
            template = context.confirmedTemplate();
        }

        PeriodFilter periodFilter = PeriodExtractor.extract(text, clock);
        if (periodFilter.isEmpty() && context != null && PeriodExtractor.isValid(context.confirmedPeriod())) {
            periodFilter = PeriodFilter.ofPeriod(context.confirmedPeriod());
        }

        Set<String> knownFields = new LinkedHashSet<>();
        schemas.forEach(schema -> knownFields.addAll(schema.fieldNames()));
        List<String> fields = resolveFields(text, schemas, context);

        QueryIntent.CalculationSpec calculation = buildCalculation(text, intentType, template, fields, knownFields,
                schemas);

        boolean semanticEnabled = switch (intentType) {
            case DIRECT_LOOKUP -> fields.isEmpty();
            case CALCULATION, GENERAL_QA -> true;
            case COMPARISON, AGGREGATION -> fields.isEmpty();
        };
        QueryIntent.SemanticSearch semanticSearch = new QueryIntent.SemanticSearch(semanticEnabled, text, topKFor(intentType));

        double confidence = BASE_CONFIDENCE;
        if (intentType != IntentType.GENERAL_QA) {
            confidence += 0.2;
        }
        if (template != TemplateType.GENERAL) {
            confidence += 0.1;
        }
        if (!fields.isEmpty()) {
            confidence += 0.1;
        }
        if (!periodFilter.isEmpty()) {
            confidence += 0.05;
        }
        confidence = Math.min(MAX_RULE_CONFIDENCE, confidence);

        Map<String, Object> entities = new LinkedHashMap<>();
        entities.put("intentCandidates", List.copyOf(candidates));
        if (periodFilter.period() != null) {
            entities.put("period", periodFilter.period());
        }
        if (periodFilter.year() != null) {
            entities.put("year", periodFilter.year());
        }
        if (context != null && context.employeeId() != null) {
            entities.put("employeeId", context.employeeId());
        }

        QueryIntent.Filters filters = new QueryIntent.Filters(periodFilter.period(), periodFilter.year(), null, null, null);
        return new QueryIntent(intentType, template, fields, calculation, filters, semanticSearch, confidence,
                entities, text);
    }

    /**
     * Parses model output into an intent. Invalid intents and templates fall back to
     * general values; periods are normalised to {@code YYYYMM}.
     */
    QueryIntent parseLlmResponse(String responseText, String originalQuery) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(stripMarkdownFences(responseText));
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("LLM response is not a JSON object");
        }

        IntentType intentType = IntentType.fromId(root.path("intent").asText(null));
        TemplateType template = TemplateType.fromId(root.path("template").asText(null));

        List<String> fields = new ArrayList<>();
        JsonNode fieldsNode = root.path("fields");
        if (fieldsNode.isArray()) {
            fieldsNode.forEach(node -> {
                if (node.isTextual() && !node.asText().isBlank()) {
                    fields.add(node.asText());
                }
            });
        }

        JsonNode filtersNode = root.path("filters");
        String period = textOrNull(filtersNode, "period");
        String normalizedPeriod = PeriodExtractor.normalize(period, clock);
        String year = null;
        if (normalizedPeriod != null && normalizedPeriod.length() == 4) {
            year = normalizedPeriod;
            normalizedPeriod = null;
        }
        QueryIntent.Filters filters = new QueryIntent.Filters(normalizedPeriod, year,
                textOrNull(filtersNode, "metadataType"), textOrNull(filtersNode, "chunkType"),
                textOrNull(filtersNode, "customFilter"));

        JsonNode searchNode = root.path("semanticSearch");
        QueryIntent.SemanticSearch semanticSearch;
        if (searchNode.isObject()) {
            boolean enabled = !searchNode.has("enabled") || searchNode.path("enabled").asBoolean(true);
            String searchQuery = textOrNull(searchNode, "query");
            int topK = searchNode.path("topK").isNumber() ? searchNode.path("topK").asInt() : topKFor(intentType);
            semanticSearch = new QueryIntent.SemanticSearch(enabled, searchQuery != null ? searchQuery : originalQuery,
                    Math.max(1, topK));
        } else {
            semanticSearch = new QueryIntent.SemanticSearch(intentType == IntentType.GENERAL_QA, originalQuery,
                    topKFor(intentType));
        }

        QueryIntent.CalculationSpec calculation = null;
        JsonNode calcNode = root.path("calculation");
        if (calcNode.isObject()) {
            Optional<CalculationType> type = CalculationType.fromId(textOrNull(calcNode, "type"));
            if (type.isPresent()) {
                Map<String, Object> params = new LinkedHashMap<>();
                JsonNode paramsNode = calcNode.path("params");
                if (paramsNode.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> it = paramsNode.fields();
                    while (it.hasNext()) {
                        Map.Entry<String, JsonNode> entry = it.next();
                        params.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class));
                    }
                }
                calculation = new QueryIntent.CalculationSpec(type.get(), params);
            }
        }

        Map<String, Object> entities = new LinkedHashMap<>();
        JsonNode entitiesNode = root.path("extractedEntities");
        if (entitiesNode.isObject()) {
            entitiesNode.fields().forEachRemaining(entry -> {
                Object value = objectMapper.convertValue(entry.getValue(), Object.class);
                if (value != null) {
                    entities.put(entry.getKey(), value);
                }
            });
        }

        double confidence = root.path("confidence").isNumber() ? root.path("confidence").asDouble() : BASE_CONFIDENCE;
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        return new QueryIntent(intentType, template, fields, calculation, filters, semanticSearch, confidence,
                entities, originalQuery);
    }

    public int topKFor(IntentType intentType) {
        return switch (intentType) {
            case DIRECT_LOOKUP -> lookupTopK;
            case CALCULATION -> calculationTopK;
            case COMPARISON -> comparisonTopK;
            case AGGREGATION -> aggregationTopK;
            case GENERAL_QA -> generalTopK;
        };
    }

    public boolean isLlmEnabled() {
        return llmEnabled;
    }

    static String stripMarkdownFences(String text) {
        if (text == null) {
            return "";
        }
        return MARKDOWN_FENCE.matcher(text.trim()).replaceAll("").trim();
    }

    private Optional<QueryIntent> refineWithLlm(String query, List<String> namespaces) {
        long llmStart = System.currentTimeMillis();
        try {
            String systemPrompt = String.format(INTENT_SYSTEM_PROMPT, PeriodExtractor.current(clock),
                    coordinator.getPrompt(namespaces));
            String response = llmGenerator.generate(systemPrompt, "사용자 질문: \"" + query + "\"",
                    GenerationOptions.DETERMINISTIC);
            QueryIntent parsed = parseLlmResponse(response, query);
            log.debug("LLM intent refinement took {}ms: {}", System.currentTimeMillis() - llmStart, parsed.intent());
            return Optional.of(parsed);
        } catch (Exception e) {
            log.warn("LLM intent refinement failed for {}, keeping rule-based intent: {}",
                    LogSanitizer.querySummary(query), e.getMessage());
            return Optional.empty();
        }
    }

    private TemplateType detectTemplate(String text) {
        if (MDRT_TEMPLATE.matcher(text).find()) {
            return TemplateType.MDRT;
        }
        if (COMPENSATION_TEMPLATE.matcher(text).find()) {
            return TemplateType.COMPENSATION;
        }
        return TemplateType.GENERAL;
    }

    /**
     * Resolves query keywords to schema fields, including aliases added by optimization.
     * Only fields present in at least one cached schema are returned.
     */
    private List<String> resolveFields(String text, List<DynamicSchema> schemas, QueryContext context) {
        if (schemas.isEmpty()) {
            return List.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        List<String> namespaces = context != null ? context.namespaces() : List.of();
        Map<String, List<String>> overrideAliases = overrideRegistry.aliasesAcross(namespaces);

        Set<String> resolved = new LinkedHashSet<>();
        for (DynamicSchema schema : schemas) {
            for (DiscoveredField field : schema.fields()) {
                if (field.category() == FieldCategory.PERIOD || field.category() == FieldCategory.EMPLOYEE_ID) {
                    continue;
                }
                List<String> terms = new ArrayList<>();
                terms.add(field.name());
                terms.add(field.displayName());
                terms.addAll(field.aliases());
                terms.addAll(overrideAliases.getOrDefault(field.name(), List.of()));
                terms.addAll(FIELD_KEYWORDS.getOrDefault(field.name(), List.of()));
                for (String term : terms) {
                    if (term != null && term.length() >= 2 && lower.contains(term.toLowerCase(Locale.ROOT))) {
                        resolved.add(field.name());
                        break;
                    }
                }
            }
        }
        return List.copyOf(resolved);
    }

    private QueryIntent.CalculationSpec buildCalculation(String text, IntentType intentType, TemplateType template,
            List<String> fields, Set<String> knownFields, List<DynamicSchema> schemas) {
        if (intentType == IntentType.CALCULATION) {
            if (TAX_REVERSE.matcher(text).find()) {
                String field = firstPresent(TAX_FIELD_CANDIDATES, knownFields)
                        .or(() -> firstNumeric(fields, schemas))
                        .orElse(TAX_FIELD_CANDIDATES.get(0));
                return new QueryIntent.CalculationSpec(CalculationType.TAX_REVERSE,
                        Map.of("field", field, "rate", DEFAULT_TAX_RATE));
            }
            if (template == TemplateType.MDRT) {
                MdrtStandard standard = chooseStandard(text);
                List<String> candidates = standard.isFycBased() ? FYC_FIELD_CANDIDATES : AGI_FIELD_CANDIDATES;
                String field = firstPresent(candidates, knownFields).orElse(candidates.get(0));
                CalculationType type = ACHIEVEMENT_RATE.matcher(text).find()
                        ? CalculationType.PERCENTAGE
                        : CalculationType.MDRT_GAP;
                return new QueryIntent.CalculationSpec(type, Map.of("standard", standard.id(), "field", field));
            }
            return null;
        }
        if (intentType == IntentType.COMPARISON) {
            String field = firstNumeric(fields, schemas)
                    .or(() -> firstPresent(AMOUNT_FIELD_CANDIDATES, knownFields))
                    .orElse(AMOUNT_FIELD_CANDIDATES.get(0));
            return new QueryIntent.CalculationSpec(CalculationType.PERIOD_DIFF,
                    Map.of("field", field, "periods", comparedPeriods(text)));
        }
        if (intentType == IntentType.AGGREGATION) {
            if (COUNT.matcher(text).find()) {
                return new QueryIntent.CalculationSpec(CalculationType.COUNT, Map.of());
            }
            String field = firstNumeric(fields, schemas)
                    .or(() -> firstPresent(AMOUNT_FIELD_CANDIDATES, knownFields))
                    .orElse(AMOUNT_FIELD_CANDIDATES.get(0));
            CalculationType type = AVERAGE.matcher(text).find() ? CalculationType.AVERAGE : CalculationType.SUM;
            return new QueryIntent.CalculationSpec(type, Map.of("field", field));
        }
        return null;
    }

    /**
     * Two explicit months are compared in chronological order; a single explicit month is
     * compared with the month before it; otherwise last month is compared with this month.
     */
    private List<String> comparedPeriods(String text) {
        List<String> explicit = PeriodExtractor.explicitPeriods(text, clock);
        if (explicit.size() >= 2) {
            return explicit.subList(0, 2).stream().sorted().toList();
        }
        String current = explicit.size() == 1 ? explicit.get(0) : PeriodExtractor.current(clock);
        return List.of(PeriodExtractor.previous(current), current);
    }

    private static MdrtStandard chooseStandard(String text) {
        boolean agi = AGI_BASIS.matcher(text).find();
        if (TOT_TIER.matcher(text).find()) {
            return agi ? MdrtStandard.AGI_TOT : MdrtStandard.FYC_TOT;
        }
        if (COT_TIER.matcher(text).find()) {
            return agi ? MdrtStandard.AGI_COT : MdrtStandard.FYC_COT;
        }
        return agi ? MdrtStandard.AGI_MDRT : MdrtStandard.FYC_MDRT;
    }

    private static Optional<String> firstPresent(List<String> candidates, Set<String> knownFields) {
        return candidates.stream().filter(knownFields::contains).findFirst();
    }

    private static Optional<String> firstNumeric(List<String> fields, List<DynamicSchema> schemas) {
        for (String name : fields) {
            for (DynamicSchema schema : schemas) {
                Optional<DiscoveredField> field = schema.field(name);
                if (field.isPresent() && field.get().isNumeric()) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private static String textOrNull(JsonNode node, String key) {
        JsonNode value = node.path(key);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private UnderstandingResult blockedResult(PipelineStatus status, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> stepData = new LinkedHashMap<>();
        stepData.put("blocked", true);
        if (status instanceof PipelineStatus.Blocked blocked) {
            stepData.put("reason", blocked.reason().name());
            stepData.put("updatingNamespaces", blocked.updatingNamespaces());
            stepData.put("estimatedWaitMs", blocked.estimatedWaitMs());
        }
        reasoningTracer.addStep(StepType.PIPELINE_GATE, "Pipeline Gate",
                "Query blocked while schemas are updating", duration, stepData);
        log.debug("Query blocked by pipeline gate: {}", stepData);
        return UnderstandingResult.blocked(status, duration);
    }

    private void logIntentStep(QueryIntent intent, String modelUsed, long durationMs) {
        Map<String, Object> stepData = new LinkedHashMap<>();
        stepData.put("intent", intent.intent().id());
        stepData.put("template", intent.template().id());
        stepData.put("fields", intent.fields());
        stepData.put("confidence", intent.confidence());
        stepData.put("model", modelUsed);
        intent.optionalCalculation().ifPresent(calc -> stepData.put("calculation", calc.type().id()));

        reasoningTracer.addStep(
                StepType.INTENT_ANALYSIS,
                "Intent Analysis",
                String.format("%s/%s (confidence %.2f)", intent.intent().id(), intent.template().id(), intent.confidence()),
                durationMs,
                stepData);
    }
}
