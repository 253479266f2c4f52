package com.jreinhal.compass.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.jreinhal.compass.vector.VectorStoreException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void badRequestKeepsPlainMessages() {
        ResponseEntity<Map<String, Object>> res = handler.handleBadRequest(
                new IllegalArgumentException("At least one namespace is required"));

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertEquals("At least one namespace is required", res.getBody().get("error"));
    }

    @Test
    void calculationErrorsAreUnprocessable() {
        ResponseEntity<Map<String, Object>> res = handler.handleCalculation(
                new CalculationException("rate", "tax rate must be in [0, 1): 1.5"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, res.getStatusCode());
        assertEquals("tax rate must be in [0, 1): 1.5", res.getBody().get("error"));
    }

    @Test
    void vectorStoreFailuresHideDetails() {
        ResponseEntity<Map<String, Object>> res = handler.handleVectorStore(
                new VectorStoreException("Vector query failed: connection refused mongodb://db:27017"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, res.getStatusCode());
        assertEquals("Vector store unavailable", res.getBody().get("error"));
    }

    @Test
    void unhandledErrorsAreGeneric() {
        ResponseEntity<Map<String, Object>> res = handler.handleUnhandled(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, res.getStatusCode());
        assertEquals("Internal server error", res.getBody().get("error"));
    }

    @Test
    void sanitizerStripsInternalDetails() {
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(null));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("/var/data/sheet.xlsx not found"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("com.jreinhal.compass.schema failed"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("NullPointerException at line 3"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201)));
        assertEquals("namespace is required", GlobalExceptionHandler.sanitizeExceptionMessage("namespace is required"));
    }
}
