package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.model.OptimizationAction;
import com.jreinhal.compass.pipeline.SchemaCacheCoordinator;
import com.jreinhal.compass.pipeline.UpdateReason;
import com.jreinhal.compass.repository.OptimizationActionRepository;
import com.jreinhal.compass.schema.FieldCatalog;
import com.jreinhal.compass.schema.NamespaceOverrides;
import com.jreinhal.compass.schema.SchemaOverrideRegistry;
import com.jreinhal.compass.schema.TemplateType;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies optimization suggestions as namespace schema overrides and requests regeneration.
 * Every attempt is recorded as an {@link OptimizationAction} holding the overrides that were
 * in place before it, which is what {@link #rollback(String)} restores.
 */
@Service
public class SchemaOptimizer {
    private static final Logger log = LoggerFactory.getLogger(SchemaOptimizer.class);

    private static final Map<String, List<String>> KOREAN_ALIASES = Map.of(
            "commission", List.of("수수료", "커미션", "보수"),
            "fyc", List.of("FYC", "신계약수수료"),
            "income", List.of("수입", "급여", "소득"),
            "contract", List.of("계약", "체결", "신계약"),
            "employee", List.of("사원", "직원", "설계사"),
            "period", List.of("기간", "마감월", "월"));

    private final SchemaOverrideRegistry overrideRegistry;
    private final SchemaCacheCoordinator coordinator;
    private final OptimizationActionRepository actionRepository;
    private final Clock clock;

    public SchemaOptimizer(SchemaOverrideRegistry overrideRegistry, SchemaCacheCoordinator coordinator,
                           OptimizationActionRepository actionRepository, Clock clock) {
        this.overrideRegistry = overrideRegistry;
        this.coordinator = coordinator;
        this.actionRepository = actionRepository;
        this.clock = clock;
    }

    public ApplyOutcome apply(OptimizationSuggestion suggestion, OptimizationContext context) {
        String namespace = context.namespace();
        NamespaceOverrides before = this.overrideRegistry.get(namespace);
        OptimizationAction action = newAction(suggestion, context, before);

        if (context.dryRun()) {
            action.setSuccess(true);
            OptimizationAction saved = this.actionRepository.save(action);
            log.info("Dry run: recorded {} on {} for {} without applying", suggestion.actionType().id(),
                    suggestion.target(), namespace);
            return new ApplyOutcome(saved.getId(), true, false, null);
        }

        try {
            UnaryOperator<NamespaceOverrides> change = changeFor(suggestion);
            // validate against the snapshot first so a bad change never reaches the registry
            change.apply(before);
            this.overrideRegistry.update(namespace, change);
            action.setApplied(true);
            action.setSuccess(true);
            action.setCanRollback(true);
        } catch (RuntimeException e) {
            action.setSuccess(false);
            action.setError(e.getMessage());
            OptimizationAction saved = this.actionRepository.save(action);
            log.warn("Optimization {} on {} failed: {}", suggestion.actionType().id(), namespace, e.getMessage());
            return new ApplyOutcome(saved.getId(), false, false, e.getMessage());
        }

        OptimizationAction saved = this.actionRepository.save(action);
        this.coordinator.requestUpdate(namespace, UpdateReason.SCHEMA_OPTIMIZATION, null);
        log.info("Applied optimization {} ({}) to {}: {}", saved.getId(), suggestion.actionType().id(), namespace,
                suggestion.reason());
        return new ApplyOutcome(saved.getId(), true, true, null);
    }

    /**
     * Restores the overrides captured before the action and marks it rolled back.
     *
     * @throws IllegalArgumentException if the action does not exist or cannot be rolled back
     */
    public OptimizationAction rollback(String actionId) {
        OptimizationAction action = this.actionRepository.findById(actionId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown optimization action: " + actionId));
        if (!action.isApplied() || action.isRolledBack() || !action.isCanRollback()) {
            throw new IllegalArgumentException("Optimization action " + actionId + " cannot be rolled back");
        }
        this.overrideRegistry.restore(action.getSchemaId(), action.getPreviousState());
        action.markRolledBack(Instant.now(this.clock));
        OptimizationAction saved = this.actionRepository.save(action);
        this.coordinator.requestUpdate(action.getSchemaId(), UpdateReason.SCHEMA_OPTIMIZATION, null);
        log.info("Rolled back optimization {} on {}", actionId, action.getSchemaId());
        return saved;
    }

    public List<OptimizationAction> activeActions(String namespace) {
        return this.actionRepository.findBySchemaIdAndAppliedTrueAndRolledBackFalseOrderByCreatedAtDesc(namespace);
    }

    /**
     * Korean aliases for a field, by keyword in its name. Falls back to the catalog display
     * name when no keyword matches.
     */
    public static List<String> koreanAliases(String field) {
        String lower = field.toLowerCase(Locale.ROOT);
        Set<String> aliases = new LinkedHashSet<>();
        KOREAN_ALIASES.forEach((keyword, words) -> {
            if (lower.contains(keyword)) {
                aliases.addAll(words);
            }
        });
        if (aliases.isEmpty()) {
            String display = FieldCatalog.displayName(field);
            if (!display.equals(field)) {
                aliases.add(display);
            }
        }
        return new ArrayList<>(aliases);
    }

    private UnaryOperator<NamespaceOverrides> changeFor(OptimizationSuggestion suggestion) {
        Map<String, Object> change = suggestion.change();
        return switch (suggestion.actionType()) {
            case FIELD_ALIAS -> {
                String field = requireField(change);
                List<String> aliases = stringList(change.get("aliases")).orElseGet(() -> koreanAliases(field));
                if (aliases.isEmpty()) {
                    throw new IllegalArgumentException("No aliases known for field " + field);
                }
                yield overrides -> overrides.withAliases(field, aliases);
            }
            case METADATA_ADD -> {
                String field = requireField(change);
                yield overrides -> overrides.withPinnedField(field);
            }
            case EMBEDDING_UPDATE -> {
                List<String> anchors = stringList(change.get("semanticAnchors")).orElse(FailureAnalyzer.SEMANTIC_ANCHORS);
                yield overrides -> overrides.withSemanticAnchors(anchors);
            }
            case FILTER_FIX -> {
                Set<String> filters = enabledKeys(change.get("entityFilters"));
                if (filters.isEmpty()) {
                    throw new IllegalArgumentException("filter_fix needs at least one entity filter");
                }
                yield overrides -> overrides.withEntityFilters(filters);
            }
            case QUERY_PATTERN -> {
                List<String> patterns = stringList(change.get("patterns"))
                        .filter(list -> !list.isEmpty())
                        .orElseThrow(() -> new IllegalArgumentException("query_pattern needs at least one pattern"));
                yield overrides -> overrides.withQueryPatterns(patterns);
            }
            case SCHEMA_UPDATE -> {
                Object template = change.get("template");
                if (template != null) {
                    TemplateType type = TemplateType.fromId(String.valueOf(template));
                    yield overrides -> overrides.withTemplate(type);
                }
                String field = requireField(change);
                yield overrides -> overrides.withPinnedField(field);
            }
        };
    }

    private OptimizationAction newAction(OptimizationSuggestion suggestion, OptimizationContext context,
                                         NamespaceOverrides before) {
        OptimizationAction action = new OptimizationAction();
        action.setSchemaId(context.namespace());
        action.setPipelineRunId(context.pipelineRunId());
        action.setIteration(context.iteration());
        action.setActionType(suggestion.actionType());
        action.setTarget(suggestion.target());
        action.setChange(new LinkedHashMap<>(suggestion.change()));
        action.setReason(suggestion.reason());
        action.setConfidence(suggestion.confidence());
        action.setEstimatedImprovement(suggestion.estimatedImprovement());
        action.setAffectedTests(new ArrayList<>(suggestion.affectedTests()));
        action.setAccuracyBefore(context.accuracyBefore());
        action.setPreviousState(before);
        action.setCreatedAt(Instant.now(this.clock));
        return action;
    }

    private static String requireField(Map<String, Object> change) {
        Object field = change.get("field");
        if (field == null || String.valueOf(field).isBlank()) {
            throw new IllegalArgumentException("Change is missing the target field");
        }
        return String.valueOf(field);
    }

    private static Optional<List<String>> stringList(Object value) {
        if (value instanceof Collection<?> items) {
            return Optional.of(items.stream().map(String::valueOf).toList());
        }
        return Optional.empty();
    }

    private static Set<String> enabledKeys(Object value) {
        Set<String> keys = new LinkedHashSet<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, enabled) -> {
                if (Boolean.TRUE.equals(enabled) || "true".equalsIgnoreCase(String.valueOf(enabled))) {
                    keys.add(String.valueOf(key));
                }
            });
        } else if (value instanceof Collection<?> items) {
            items.forEach(item -> keys.add(String.valueOf(item)));
        }
        return keys;
    }
}
