package com.jreinhal.compass.dto;

import java.util.Map;

public record RetrievedRecord(String id, String namespace, double score, Map<String, Object> metadata) {
}
