package com.jreinhal.compass.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class DynamicSchemaJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void schemaSurvivesSerializationUnchanged() throws Exception {
        SchemaDiscoveryService discovery = new SchemaDiscoveryService(null, null, new SchemaOverrideRegistry(),
                Clock.fixed(Instant.parse("2025-11-01T00:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(discovery, "minFrequency", 0.10);
        DynamicSchema schema = discovery.buildSchema("commission", List.of(
                Map.of("employeeId", "E001", "period", "202511", "totalCommission", 1_500_000, "tags", List.of("a", "b")),
                Map.of("employeeId", "E002", "period", "202510", "totalCommission", 980_000.5, "active", true)), 2);

        String json = objectMapper.writeValueAsString(schema);
        DynamicSchema restored = objectMapper.readValue(json, DynamicSchema.class);

        assertEquals(schema.fields(), restored.fields());
        assertEquals(schema.calculations(), restored.calculations());
        assertEquals(schema.examples(), restored.examples());
        assertEquals(schema.templateInference(), restored.templateInference());
        assertEquals(schema.lastDiscoveredAt(), restored.lastDiscoveredAt());
        assertEquals(schema, restored);
    }
}
