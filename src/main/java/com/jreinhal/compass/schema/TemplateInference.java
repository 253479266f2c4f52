package com.jreinhal.compass.schema;

/**
 * Best-effort template classification for a namespace. {@code explicit} is true when the
 * type came from a registered override rather than field-name heuristics.
 */
public record TemplateInference(TemplateType type, double confidence, String reasoning, boolean explicit) {

    public static TemplateInference heuristic(TemplateType type, double confidence, String reasoning) {
        return new TemplateInference(type, confidence, reasoning, false);
    }

    public static TemplateInference explicit(TemplateType type) {
        return new TemplateInference(type, 1.0, "Explicit template override registered for namespace", true);
    }
}
