package com.jreinhal.compass.autonomous.accuracy;

import com.jreinhal.compass.model.DiscrepancyType;

public record Discrepancy(
        String field,
        Object expected,
        Object actual,
        DiscrepancyType type,
        Severity severity,
        String details) {
}
