package com.jreinhal.compass.schema;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds per-namespace schema overrides. Discovery reads them on its next run; the optimizer
 * writes them and then requests regeneration through the coordinator.
 */
@Component
public class SchemaOverrideRegistry {
    private static final Logger log = LoggerFactory.getLogger(SchemaOverrideRegistry.class);

    private final Map<String, NamespaceOverrides> overrides = new ConcurrentHashMap<>();

    public NamespaceOverrides get(String namespace) {
        return overrides.getOrDefault(namespace, NamespaceOverrides.EMPTY);
    }

    public NamespaceOverrides update(String namespace, UnaryOperator<NamespaceOverrides> change) {
        NamespaceOverrides updated = overrides.compute(namespace,
                (ns, current) -> change.apply(current == null ? NamespaceOverrides.EMPTY : current));
        log.debug("Schema overrides updated for namespace {}", namespace);
        return updated;
    }

    public void restore(String namespace, NamespaceOverrides snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            overrides.remove(namespace);
        } else {
            overrides.put(namespace, snapshot);
        }
        log.info("Schema overrides restored for namespace {}", namespace);
    }

    public void setTemplateOverride(String namespace, TemplateType templateType) {
        update(namespace, current -> current.withTemplate(templateType));
    }

    public void clear(String namespace) {
        overrides.remove(namespace);
    }

    /**
     * Aliases per field across the given namespaces, merged in namespace order.
     */
    public Map<String, List<String>> aliasesAcross(Collection<String> namespaces) {
        Map<String, List<String>> merged = new LinkedHashMap<>();
        for (String namespace : namespaces) {
            get(namespace).fieldAliases().forEach((field, aliases) -> merged.merge(field, aliases,
                    (a, b) -> java.util.stream.Stream.concat(a.stream(), b.stream()).distinct().toList()));
        }
        return merged;
    }
}
