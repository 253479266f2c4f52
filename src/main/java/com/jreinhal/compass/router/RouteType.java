package com.jreinhal.compass.router;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum RouteType {
    INSTANT("즉시 응답 (RAG 불필요)"),
    RAG("RAG 파이프라인 실행"),
    CLARIFY("명확화 질문 필요"),
    FALLBACK("일반 응답 (의도 불명확)");

    private final String description;

    RouteType(String description) {
        this.description = description;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String description() {
        return description;
    }
}
