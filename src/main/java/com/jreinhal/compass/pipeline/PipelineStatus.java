package com.jreinhal.compass.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * Result of the query gate: either blocked with a user-facing message, or ready.
 */
public sealed interface PipelineStatus permits PipelineStatus.Blocked, PipelineStatus.Ready {

    @JsonProperty("blocked")
    boolean blocked();

    enum BlockReason {
        GLOBAL,
        NAMESPACE
    }

    record Blocked(BlockReason reason, String message, long estimatedWaitMs, List<String> updatingNamespaces)
            implements PipelineStatus {

        public Blocked {
            updatingNamespaces = updatingNamespaces == null ? List.of() : List.copyOf(updatingNamespaces);
        }

        @Override
        public boolean blocked() {
            return true;
        }

        public long estimatedWaitSeconds() {
            return (long) Math.ceil(estimatedWaitMs / 1000.0);
        }
    }

    record Ready(boolean schemasReady, Instant lastUpdated) implements PipelineStatus {

        @Override
        public boolean blocked() {
            return false;
        }
    }
}
