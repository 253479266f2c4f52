package com.jreinhal.compass.pipeline;

import java.time.Instant;
import java.util.List;

public record GlobalPipelineState(
        boolean anyUpdating,
        boolean globalLock,
        String globalLockReason,
        List<String> updatingNamespaces,
        Instant lastGlobalUpdate,
        List<QueuedUpdate> queuedUpdates) {

    public record QueuedUpdate(String namespace, UpdateReason reason, Instant queuedAt, List<String> documentIds) {
    }
}
