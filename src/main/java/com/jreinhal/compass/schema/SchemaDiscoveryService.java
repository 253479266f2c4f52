package com.jreinhal.compass.schema;

import com.jreinhal.compass.exception.SchemaDiscoveryException;
import com.jreinhal.compass.vector.EmbeddingProvider;
import com.jreinhal.compass.vector.NamespaceStats;
import com.jreinhal.compass.vector.NamespaceVectorStore;
import com.jreinhal.compass.vector.QueryOptions;
import com.jreinhal.compass.vector.VectorMatch;
import com.jreinhal.compass.vector.VectorStoreException;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Discovers the metadata shape of each namespace by sampling its vectors.
 *
 * <p>There are no static schemas: fields, types, categories, template type, available
 * calculations and example questions are all derived from what the vectors carry at the
 * time of discovery. Overrides written by the optimizer (aliases, pinned fields, extra seed
 * queries, explicit templates) are folded in on every run.</p>
 */
@Service
public class SchemaDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(SchemaDiscoveryService.class);

    static final List<String> SEED_QUERIES = List.of("최근 수수료 정보", "MDRT 달성 현황", "이번달 일정", "총 커미션 합계");
    static final Set<String> INTERNAL_FIELDS = Set.of("id", "chunkIndex", "contentHash", "createdAt");
    private static final int MAX_FIELD_EXAMPLES = 5;
    private static final int MAX_EXAMPLE_QUERIES = 5;
    private static final double FREQUENCY_EPSILON = 1e-9;

    private static final Pattern COMPENSATION_FIELD = Pattern.compile("(commission|override|incentive|payment|clawback)");
    private static final Pattern MDRT_FIELD = Pattern.compile("(fyc|agi|mdrt|^cot|^tot(?!al))");

    private final NamespaceVectorStore vectorStore;
    private final EmbeddingProvider embeddingProvider;
    private final SchemaOverrideRegistry overrideRegistry;
    private final Clock clock;

    @Value("${compass.discovery.sample-size:100}")
    private int sampleSize;
    @Value("${compass.discovery.min-frequency:0.10}")
    private double minFrequency;

    public SchemaDiscoveryService(NamespaceVectorStore vectorStore, EmbeddingProvider embeddingProvider,
                                  SchemaOverrideRegistry overrideRegistry, Clock clock) {
        this.vectorStore = vectorStore;
        this.embeddingProvider = embeddingProvider;
        this.overrideRegistry = overrideRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        log.info("Schema discovery initialized (sampleSize={}, minFrequency={})", this.sampleSize, this.minFrequency);
    }

    /**
     * Discovers the schema of one namespace.
     *
     * @return empty when the namespace holds no vectors or no sample carried metadata
     * @throws SchemaDiscoveryException when the vector store or embedding backend fails
     */
    public Optional<DynamicSchema> discoverNamespaceSchema(String namespace) {
        long startTime = System.currentTimeMillis();
        try {
            NamespaceStats stats = this.vectorStore.getNamespaceStats(namespace);
            if (stats.vectorCount() == 0L) {
                log.info("Namespace {} has no vectors, skipping discovery", namespace);
                return Optional.empty();
            }
            int target = (int) Math.min(this.sampleSize, stats.vectorCount());
            List<Map<String, Object>> samples = sampleMetadata(namespace, target);
            if (samples.isEmpty()) {
                log.warn("Namespace {} returned no metadata samples", namespace);
                return Optional.empty();
            }
            DynamicSchema schema = buildSchema(namespace, samples, stats.vectorCount());
            log.info("Discovered schema for {}: template={}, fields={}, samples={} ({}ms)",
                    namespace, schema.templateType().id(), schema.fields().size(), samples.size(),
                    System.currentTimeMillis() - startTime);
            return Optional.of(schema);
        }
        catch (VectorStoreException e) {
            throw new SchemaDiscoveryException(namespace, "Schema discovery failed for " + namespace + ": " + e.getMessage(), e);
        }
    }

    /**
     * Discovers every namespace independently. A failing namespace is logged and reported in
     * {@link SchemaDiscoveryResult#failures()}; the others still produce schemas.
     */
    public SchemaDiscoveryResult discoverAll(List<String> namespaces) {
        long startTime = System.currentTimeMillis();
        List<DynamicSchema> schemas = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (String namespace : namespaces) {
            try {
                discoverNamespaceSchema(namespace).ifPresent(schemas::add);
            }
            catch (RuntimeException e) {
                log.error("Failed to discover schema for namespace {}", namespace, e);
                failures.put(namespace, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        int totalFields = schemas.stream().mapToInt(s -> s.fields().size()).sum();
        long totalVectors = schemas.stream().mapToLong(DynamicSchema::vectorCount).sum();
        return new SchemaDiscoveryResult(schemas, failures, totalFields, totalVectors, System.currentTimeMillis() - startTime);
    }

    List<Map<String, Object>> sampleMetadata(String namespace, int target) {
        List<String> seeds = new ArrayList<>(SEED_QUERIES);
        seeds.addAll(this.overrideRegistry.get(namespace).semanticAnchors());
        Map<String, Map<String, Object>> byId = new LinkedHashMap<>();
        QueryOptions options = new QueryOptions(target, Map.of(), true);
        for (String seed : seeds) {
            if (byId.size() >= target) {
                break;
            }
            float[] embedding = this.embeddingProvider.embed(seed);
            for (VectorMatch match : this.vectorStore.query(namespace, embedding, options)) {
                if (byId.size() >= target) {
                    break;
                }
                if (!match.metadata().isEmpty()) {
                    byId.putIfAbsent(match.id(), match.metadata());
                }
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Aggregates sampled metadata into a schema. Deterministic for the same input apart from
     * {@code lastDiscoveredAt}.
     */
    public DynamicSchema buildSchema(String namespace, List<Map<String, Object>> samples, long vectorCount) {
        NamespaceOverrides overrides = this.overrideRegistry.get(namespace);
        List<DiscoveredField> fields = discoverFields(samples, overrides);
        TemplateInference inference = inferTemplate(fields, overrides);
        List<DiscoveredCalculation> calculations = CalculationCatalog.deriveFor(inference.type(),
                fields.stream().map(DiscoveredField::name).toList());
        List<String> examples = generateExamples(inference.type(), fields, overrides.queryPatterns());
        return new DynamicSchema(inference.type(), inference, namespace, fields, calculations, examples,
                vectorCount, latestCreatedAt(samples), this.clock.instant());
    }

    private List<DiscoveredField> discoverFields(List<Map<String, Object>> samples, NamespaceOverrides overrides) {
        Map<String, FieldStats> statsByField = new LinkedHashMap<>();
        for (Map<String, Object> sample : samples) {
            for (Map.Entry<String, Object> entry : sample.entrySet()) {
                if (INTERNAL_FIELDS.contains(entry.getKey())) {
                    continue;
                }
                MetadataValue value = MetadataValue.of(entry.getValue());
                if (value.isNull()) {
                    continue;
                }
                statsByField.computeIfAbsent(entry.getKey(), k -> new FieldStats()).observe(value);
            }
        }
        List<DiscoveredField> fields = new ArrayList<>();
        int total = samples.size();
        for (Map.Entry<String, FieldStats> entry : statsByField.entrySet()) {
            String name = entry.getKey();
            FieldStats stats = entry.getValue();
            double frequency = (double) stats.count / total;
            boolean pinned = overrides.pinnedFields().contains(name);
            if (frequency + FREQUENCY_EPSILON < this.minFrequency && !pinned) {
                continue;
            }
            boolean period = MetadataTypeInference.isPeriodFieldName(name) || stats.allYearMonthStrings;
            FieldType type = period ? FieldType.DATE : MetadataTypeInference.resolveType(stats.types);
            FieldCategory category = period ? FieldCategory.PERIOD : MetadataTypeInference.inferCategory(name, stats.examples);
            fields.add(new DiscoveredField(name, type, FieldCatalog.description(name), FieldCatalog.displayName(name),
                    stats.examples, frequency, category, overrides.aliasesFor(name)));
        }
        fields.sort(Comparator.comparingDouble(DiscoveredField::frequency).reversed()
                .thenComparing(DiscoveredField::name));
        return fields;
    }

    TemplateInference inferTemplate(List<DiscoveredField> fields, NamespaceOverrides overrides) {
        if (overrides.templateOverride() != null) {
            return TemplateInference.explicit(overrides.templateOverride());
        }
        List<String> compensationHits = matching(fields, COMPENSATION_FIELD);
        if (!compensationHits.isEmpty()) {
            return TemplateInference.heuristic(TemplateType.COMPENSATION, heuristicConfidence(compensationHits.size()),
                    "Compensation fields present: " + String.join(", ", compensationHits));
        }
        List<String> mdrtHits = matching(fields, MDRT_FIELD);
        if (!mdrtHits.isEmpty()) {
            return TemplateInference.heuristic(TemplateType.MDRT, heuristicConfidence(mdrtHits.size()),
                    "MDRT fields present: " + String.join(", ", mdrtHits));
        }
        return TemplateInference.heuristic(TemplateType.GENERAL, 0.3,
                "No compensation or MDRT indicators among " + fields.size() + " fields");
    }

    private static List<String> matching(List<DiscoveredField> fields, Pattern pattern) {
        return fields.stream()
                .map(DiscoveredField::name)
                .filter(name -> pattern.matcher(name.toLowerCase(Locale.ROOT)).find())
                .toList();
    }

    private static double heuristicConfidence(int hits) {
        return Math.min(0.9, 0.5 + 0.1 * hits);
    }

    public List<String> generateExamples(TemplateType templateType, List<DiscoveredField> fields, List<String> queryPatterns) {
        List<String> examples = new ArrayList<>();
        boolean hasPeriod = fields.stream().anyMatch(f -> f.category() == FieldCategory.PERIOD);
        switch (templateType) {
            case COMPENSATION -> {
                if (hasPeriod) {
                    examples.add("이번달 수수료 알려줘");
                    examples.add("지난달 커미션 얼마야?");
                }
                fields.stream().filter(DiscoveredField::isNumeric).findFirst()
                        .ifPresent(f -> examples.add(f.displayName() + " 합계 알려줘"));
                examples.add("올해 총 수입 얼마야?");
            }
            case MDRT -> {
                examples.add("MDRT 달성률 알려줘");
                examples.add("COT까지 얼마 남았어?");
                examples.add("현재 FYC 금액이 얼마야?");
            }
            default -> {
                examples.add("최근 정보 알려줘");
                if (hasPeriod) {
                    examples.add("이번달 현황 보여줘");
                }
            }
        }
        if (queryPatterns != null) {
            examples.addAll(queryPatterns);
        }
        return examples.stream().distinct().limit(MAX_EXAMPLE_QUERIES).collect(Collectors.toList());
    }

    private Instant latestCreatedAt(List<Map<String, Object>> samples) {
        Instant latest = null;
        for (Map<String, Object> sample : samples) {
            Instant createdAt = parseInstant(sample.get("createdAt"));
            if (createdAt != null && (latest == null || createdAt.isAfter(latest))) {
                latest = createdAt;
            }
        }
        return latest != null ? latest : this.clock.instant();
    }

    private static Instant parseInstant(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Instant instant) {
            return instant;
        }
        if (raw instanceof Date date) {
            return date.toInstant();
        }
        if (raw instanceof Number epochMillis) {
            return Instant.ofEpochMilli(epochMillis.longValue());
        }
        String text = String.valueOf(raw).trim();
        try {
            return Instant.parse(text);
        }
        catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            }
            catch (DateTimeParseException ignored) {
                log.debug("Ignoring unparseable createdAt value");
                return null;
            }
        }
    }

    private static final class FieldStats {
        private final Set<FieldType> types = EnumSet.noneOf(FieldType.class);
        private final Set<MetadataValue> distinct = new LinkedHashSet<>();
        private final List<MetadataValue> examples = new ArrayList<>();
        private int count;
        private boolean allYearMonthStrings = true;

        void observe(MetadataValue value) {
            this.count++;
            this.types.add(MetadataTypeInference.inferType(value));
            if (!(value instanceof MetadataValue.StringValue) || !MetadataTypeInference.isYearMonth(value)) {
                this.allYearMonthStrings = false;
            }
            if (this.examples.size() < MAX_FIELD_EXAMPLES && this.distinct.add(value)) {
                this.examples.add(value);
            }
        }
    }
}
