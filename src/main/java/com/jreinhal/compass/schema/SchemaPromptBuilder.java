package com.jreinhal.compass.schema;

import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders discovered schemas into the Korean prompt section used by intent refinement and
 * answer generation.
 */
@Component
public class SchemaPromptBuilder {
    static final String NO_DATA_MESSAGE = "현재 사용 가능한 데이터가 없습니다.";
    private static final int MAX_PROMPT_FIELDS = 10;

    public String buildPromptSection(List<DynamicSchema> schemas) {
        if (schemas == null || schemas.isEmpty()) {
            return NO_DATA_MESSAGE;
        }
        return schemas.stream().map(this::buildSection).collect(Collectors.joining("\n\n"));
    }

    public String buildSection(DynamicSchema schema) {
        String fieldList = schema.fields().stream()
                .limit(MAX_PROMPT_FIELDS)
                .map(f -> "  - " + f.displayName() + " (" + f.name() + "): " + f.description())
                .collect(Collectors.joining("\n"));
        String calcList = schema.availableCalculations().stream()
                .map(c -> "  - " + c.name() + ": " + c.description())
                .collect(Collectors.joining("\n"));
        String exampleList = schema.examples().stream()
                .map(e -> "  - \"" + e + "\"")
                .collect(Collectors.joining("\n"));
        return "## " + schema.templateType().displayName() + " 데이터 (" + schema.vectorCount() + "개 벡터)\n\n"
                + "사용 가능한 필드:\n" + fieldList + "\n\n"
                + "가능한 계산:\n" + (calcList.isEmpty() ? "  (없음)" : calcList) + "\n\n"
                + "질문 예시:\n" + exampleList;
    }
}
