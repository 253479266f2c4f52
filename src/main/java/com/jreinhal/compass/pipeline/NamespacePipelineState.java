package com.jreinhal.compass.pipeline;

import java.time.Instant;

/**
 * Snapshot of one namespace's regeneration state. Instances are immutable; the coordinator
 * replaces them on every transition.
 */
public record NamespacePipelineState(
        String namespace,
        boolean updating,
        Instant lastUpdatedAt,
        Instant updateStartedAt,
        UpdateReason updateReason,
        int progress,
        String error) {

    public static NamespacePipelineState idle(String namespace) {
        return new NamespacePipelineState(namespace, false, null, null, null, 0, null);
    }

    NamespacePipelineState started(UpdateReason reason, Instant now) {
        return new NamespacePipelineState(namespace, true, lastUpdatedAt, now, reason, 0, null);
    }

    NamespacePipelineState withProgress(int value) {
        return new NamespacePipelineState(namespace, updating, lastUpdatedAt, updateStartedAt, updateReason,
                Math.min(100, Math.max(0, value)), error);
    }

    NamespacePipelineState completed(boolean success, String failure, Instant now) {
        return new NamespacePipelineState(namespace, false, success ? now : lastUpdatedAt, updateStartedAt,
                updateReason, 100, failure);
    }

    NamespacePipelineState invalidated() {
        return new NamespacePipelineState(namespace, updating, null, updateStartedAt, updateReason, progress, error);
    }
}
