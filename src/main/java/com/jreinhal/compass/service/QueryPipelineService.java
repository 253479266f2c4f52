package com.jreinhal.compass.service;

import com.jreinhal.compass.calculation.CalculationEngine;
import com.jreinhal.compass.calculation.CalculationOutcome;
import com.jreinhal.compass.dto.QueryRequest;
import com.jreinhal.compass.dto.QueryResponse;
import com.jreinhal.compass.dto.RetrievedRecord;
import com.jreinhal.compass.pipeline.PipelineStatus;
import com.jreinhal.compass.reasoning.QueryMetricsRecorder;
import com.jreinhal.compass.reasoning.ReasoningStep;
import com.jreinhal.compass.reasoning.ReasoningTrace;
import com.jreinhal.compass.reasoning.ReasoningTracer;
import com.jreinhal.compass.router.ClarificationBuilder;
import com.jreinhal.compass.router.IntentThresholds;
import com.jreinhal.compass.router.QueryRouterService;
import com.jreinhal.compass.router.RouteType;
import com.jreinhal.compass.router.RouterDecision;
import com.jreinhal.compass.schema.MetadataValue;
import com.jreinhal.compass.schema.SchemaOverrideRegistry;
import com.jreinhal.compass.understanding.IntentFilters;
import com.jreinhal.compass.understanding.QueryContext;
import com.jreinhal.compass.understanding.QueryIntent;
import com.jreinhal.compass.understanding.UnderstandingResult;
import com.jreinhal.compass.understanding.QueryUnderstandingService;
import com.jreinhal.compass.util.LogSanitizer;
import com.jreinhal.compass.vector.EmbeddingProvider;
import com.jreinhal.compass.vector.NamespaceVectorStore;
import com.jreinhal.compass.vector.QueryOptions;
import com.jreinhal.compass.vector.VectorMatch;
import com.jreinhal.compass.vector.VectorStoreException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one query end to end: router, pipeline gate and understanding, retrieval, calculation
 * and answer assembly. Every stage leaves a step on the reasoning trace.
 */
@Service
public class QueryPipelineService {
    private static final Logger log = LoggerFactory.getLogger(QueryPipelineService.class);

    private final QueryRouterService router;
    private final QueryUnderstandingService understandingService;
    private final ClarificationBuilder clarificationBuilder;
    private final SchemaOverrideRegistry overrideRegistry;
    private final NamespaceVectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final CalculationEngine calculationEngine;
    private final ResponseAssembler assembler;
    private final ReasoningTracer reasoningTracer;
    private final QueryMetricsRecorder metricsRecorder;

    public QueryPipelineService(QueryRouterService router, QueryUnderstandingService understandingService,
                                ClarificationBuilder clarificationBuilder, SchemaOverrideRegistry overrideRegistry,
                                NamespaceVectorStore vectorStore, EmbeddingProvider embeddingProvider,
                                CalculationEngine calculationEngine, ResponseAssembler assembler,
                                ReasoningTracer reasoningTracer, QueryMetricsRecorder metricsRecorder) {
        this.router = router;
        this.understandingService = understandingService;
        this.clarificationBuilder = clarificationBuilder;
        this.overrideRegistry = overrideRegistry;
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.calculationEngine = calculationEngine;
        this.assembler = assembler;
        this.reasoningTracer = reasoningTracer;
        this.metricsRecorder = metricsRecorder;
    }

    public QueryResponse ask(QueryRequest request) {
        return ask(request.query(), request.toContext());
    }

    public QueryResponse ask(String query, QueryContext context) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }
        if (context == null || context.namespaces().isEmpty()) {
            throw new IllegalArgumentException("At least one namespace is required");
        }
        long start = System.currentTimeMillis();
        this.reasoningTracer.startTrace(query, context.namespaces(), context.employeeId());
        log.debug("Processing query {}", LogSanitizer.querySummary(query));
        try {
            return process(query, context, start);
        } catch (RuntimeException e) {
            this.reasoningTracer.addStep(ReasoningStep.StepType.ERROR, "Pipeline Error",
                    e.getClass().getSimpleName(), System.currentTimeMillis() - start);
            this.reasoningTracer.endTrace();
            log.error("Query pipeline failed for {}", LogSanitizer.querySummary(query), e);
            throw e;
        }
    }

    private QueryResponse process(String query, QueryContext context, long start) {
        RouterDecision decision = this.router.route(query, context);
        if (decision.route() == RouteType.INSTANT || decision.route() == RouteType.FALLBACK) {
            return finish(decision.response(), decision.route(), null, null, null, List.of(), Map.of(), null, start);
        }
        if (decision.route() == RouteType.CLARIFY) {
            return finish(decision.clarifyQuestion(), RouteType.CLARIFY, decision.clarifyQuestion(), null, null,
                    List.of(), Map.of(), null, start);
        }

        UnderstandingResult understanding = this.understandingService.analyzeQuery(query, context);
        if (understanding.isBlocked()) {
            PipelineStatus.Blocked blocked = (PipelineStatus.Blocked) understanding.status();
            return finish(this.assembler.blocked(blocked), null, null, null, blocked, List.of(), Map.of(), null, start);
        }
        QueryIntent intent = understanding.intent();
        RouterDecision intentDecision = this.router.routeWithIntent(intent);
        if (intentDecision.route() == RouteType.FALLBACK) {
            return finish(intentDecision.response(), RouteType.FALLBACK, null, intent, null, List.of(), Map.of(), null, start);
        }

        Map<String, Object> filters = IntentFilters.toVectorFilters(intent, context, entityFilters(context.namespaces()));
        List<RetrievedRecord> sources;
        try {
            sources = retrieve(intent, context.namespaces(), filters);
        } catch (VectorStoreException e) {
            log.warn("Retrieval failed for {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            this.reasoningTracer.addStep(ReasoningStep.StepType.ERROR, "Retrieval Error", e.getMessage(),
                    System.currentTimeMillis() - start);
            return finish(ResponseAssembler.RETRIEVAL_FAILED, RouteType.FALLBACK, null, intent, null, List.of(), filters,
                    null, start);
        }
        if (sources.isEmpty()) {
            String clarification = this.clarificationBuilder.buildClarification(intent).question();
            return finish(this.assembler.noResults(clarification), RouteType.CLARIFY, clarification, intent, null,
                    sources, filters, null, start);
        }

        CalculationOutcome calculation = intent.optionalCalculation()
                .map(spec -> calculate(spec, sources))
                .orElse(null);
        long assemblyStart = System.currentTimeMillis();
        String answer = this.assembler.assemble(intent, sources, calculation);
        this.reasoningTracer.addStep(ReasoningStep.StepType.RESPONSE_ASSEMBLY, "Response Assembly",
                "Assembled answer from " + sources.size() + " record(s)", System.currentTimeMillis() - assemblyStart);

        String clarifyQuestion = intentDecision.route() == RouteType.CLARIFY ? intentDecision.clarifyQuestion() : null;
        RouteType route = intentDecision.route() == RouteType.INSTANT ? RouteType.RAG : intentDecision.route();
        return finish(answer, route, clarifyQuestion, intent, null, sources, filters, calculation, start);
    }

    private List<RetrievedRecord> retrieve(QueryIntent intent, List<String> namespaces, Map<String, Object> filters) {
        long stepStart = System.currentTimeMillis();
        String searchText = intent.semanticSearch().query() != null && !intent.semanticSearch().query().isBlank()
                ? intent.semanticSearch().query() : intent.originalQuery();
        int topK = intent.semanticSearch().topK() > 0
                ? intent.semanticSearch().topK() : this.understandingService.topKFor(intent.intent());
        float[] embedding = this.embeddingProvider.embed(searchText);
        QueryOptions options = new QueryOptions(topK, filters, true);

        List<RetrievedRecord> candidates = new ArrayList<>();
        for (String namespace : namespaces) {
            for (VectorMatch match : this.vectorStore.query(namespace, embedding, options)) {
                candidates.add(new RetrievedRecord(match.id(), namespace, match.score(), match.metadata()));
            }
        }
        List<RetrievedRecord> relevant = candidates.stream()
                .filter(record -> record.score() >= IntentThresholds.MINIMUM_RELEVANCE)
                .sorted(Comparator.comparingDouble(RetrievedRecord::score).reversed())
                .limit(topK)
                .toList();
        Map<String, Object> stepData = new LinkedHashMap<>();
        stepData.put("topK", topK);
        stepData.put("candidates", candidates.size());
        stepData.put("relevant", relevant.size());
        stepData.put("filters", filters.keySet());
        this.reasoningTracer.addStep(ReasoningStep.StepType.RETRIEVAL, "Retrieval",
                "Kept " + relevant.size() + " of " + candidates.size() + " matches above "
                        + IntentThresholds.MINIMUM_RELEVANCE, System.currentTimeMillis() - stepStart, stepData);
        if (!relevant.isEmpty() && averageScore(relevant) < IntentThresholds.LOW_RELEVANCE_WARNING) {
            log.debug("Low average relevance {} for intent {}", averageScore(relevant), intent.intent().id());
        }
        return relevant;
    }

    private CalculationOutcome calculate(QueryIntent.CalculationSpec spec, List<RetrievedRecord> sources) {
        long stepStart = System.currentTimeMillis();
        List<Map<String, MetadataValue>> rows = new ArrayList<>(sources.size());
        for (RetrievedRecord source : sources) {
            Map<String, MetadataValue> row = new LinkedHashMap<>();
            source.metadata().forEach((key, value) -> row.put(key, MetadataValue.of(value)));
            rows.add(row);
        }
        CalculationOutcome outcome = this.calculationEngine.evaluateSafely(spec.type(), rows, spec.params());
        this.reasoningTracer.addStep(ReasoningStep.StepType.CALCULATION, "Calculation",
                spec.type().id() + (outcome.success() ? " succeeded" : " failed: " + outcome.error()),
                System.currentTimeMillis() - stepStart, Map.of("type", spec.type().id(), "success", outcome.success()));
        return outcome;
    }

    private Set<String> entityFilters(List<String> namespaces) {
        Set<String> fields = new LinkedHashSet<>();
        namespaces.forEach(namespace -> fields.addAll(this.overrideRegistry.get(namespace).entityFilters()));
        return fields;
    }

    private QueryResponse finish(String answer, RouteType route, String clarifyQuestion, QueryIntent intent,
                                 PipelineStatus status, List<RetrievedRecord> sources, Map<String, Object> filters,
                                 CalculationOutcome calculation, long start) {
        long elapsed = System.currentTimeMillis() - start;
        double topScore = sources.isEmpty() ? 0.0 : sources.get(0).score();
        double avgScore = averageScore(sources);
        this.reasoningTracer.addMetric("totalLatencyMs", elapsed);
        this.reasoningTracer.addMetric("documentsRetrieved", sources.size());
        ReasoningTrace trace = this.reasoningTracer.endTrace();
        this.metricsRecorder.record(new QueryMetricsRecorder.QueryMetric(
                route != null ? route.id() : "blocked",
                intent != null ? intent.intent().id() : null,
                intent != null && intent.template() != null ? intent.template().id() : null,
                intent != null ? intent.confidence() : 0.0,
                status != null && status.blocked(),
                sources.size(),
                elapsed));
        return new QueryResponse(answer, route, clarifyQuestion, intent, status, sources, filters, topScore, avgScore,
                calculation, trace != null ? trace.getStepsAsMaps() : List.of(), trace != null ? trace.getTraceId() : null,
                elapsed);
    }

    private static double averageScore(List<RetrievedRecord> records) {
        return records.stream().mapToDouble(RetrievedRecord::score).average().orElse(0.0);
    }
}
