package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of schema adjustments applied to one namespace by optimization actions
 * or explicit configuration. Snapshots of this type are what rollbacks restore.
 */
public record NamespaceOverrides(
        TemplateType templateOverride,
        Map<String, List<String>> fieldAliases,
        Set<String> pinnedFields,
        List<String> semanticAnchors,
        Set<String> entityFilters,
        List<String> queryPatterns) {

    public static final NamespaceOverrides EMPTY = new NamespaceOverrides(null, Map.of(), Set.of(), List.of(), Set.of(), List.of());

    public NamespaceOverrides {
        fieldAliases = fieldAliases == null ? Map.of() : copyAliases(fieldAliases);
        pinnedFields = pinnedFields == null ? Set.of() : Set.copyOf(pinnedFields);
        semanticAnchors = semanticAnchors == null ? List.of() : List.copyOf(semanticAnchors);
        entityFilters = entityFilters == null ? Set.of() : Set.copyOf(entityFilters);
        queryPatterns = queryPatterns == null ? List.of() : List.copyOf(queryPatterns);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return templateOverride == null && fieldAliases.isEmpty() && pinnedFields.isEmpty()
                && semanticAnchors.isEmpty() && entityFilters.isEmpty() && queryPatterns.isEmpty();
    }

    public List<String> aliasesFor(String field) {
        return fieldAliases.getOrDefault(field, List.of());
    }

    public NamespaceOverrides withTemplate(TemplateType template) {
        return new NamespaceOverrides(template, fieldAliases, pinnedFields, semanticAnchors, entityFilters, queryPatterns);
    }

    public NamespaceOverrides withAliases(String field, List<String> aliases) {
        Map<String, List<String>> updated = new LinkedHashMap<>(fieldAliases);
        LinkedHashSet<String> merged = new LinkedHashSet<>(updated.getOrDefault(field, List.of()));
        merged.addAll(aliases);
        updated.put(field, new ArrayList<>(merged));
        return new NamespaceOverrides(templateOverride, updated, pinnedFields, semanticAnchors, entityFilters, queryPatterns);
    }

    public NamespaceOverrides withPinnedField(String field) {
        Set<String> updated = new LinkedHashSet<>(pinnedFields);
        updated.add(field);
        return new NamespaceOverrides(templateOverride, fieldAliases, updated, semanticAnchors, entityFilters, queryPatterns);
    }

    public NamespaceOverrides withSemanticAnchors(List<String> anchors) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(semanticAnchors);
        merged.addAll(anchors);
        return new NamespaceOverrides(templateOverride, fieldAliases, pinnedFields, new ArrayList<>(merged), entityFilters, queryPatterns);
    }

    public NamespaceOverrides withEntityFilters(Set<String> filters) {
        Set<String> updated = new LinkedHashSet<>(entityFilters);
        updated.addAll(filters);
        return new NamespaceOverrides(templateOverride, fieldAliases, pinnedFields, semanticAnchors, updated, queryPatterns);
    }

    public NamespaceOverrides withQueryPatterns(List<String> patterns) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(queryPatterns);
        merged.addAll(patterns);
        return new NamespaceOverrides(templateOverride, fieldAliases, pinnedFields, semanticAnchors, entityFilters, new ArrayList<>(merged));
    }

    private static Map<String, List<String>> copyAliases(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((field, aliases) -> copy.put(field, aliases == null ? List.of() : List.copyOf(aliases)));
        return Map.copyOf(copy);
    }
}
