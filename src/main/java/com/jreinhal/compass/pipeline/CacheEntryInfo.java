package com.jreinhal.compass.pipeline;

import com.jreinhal.compass.schema.TemplateType;
import java.time.Instant;

public record CacheEntryInfo(
        String namespace,
        TemplateType templateType,
        int fieldCount,
        long vectorCount,
        Instant lastDiscoveredAt,
        boolean promptCached) {
}
