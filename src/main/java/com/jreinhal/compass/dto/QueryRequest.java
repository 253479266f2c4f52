package com.jreinhal.compass.dto;

import com.jreinhal.compass.schema.TemplateType;
import com.jreinhal.compass.understanding.QueryContext;
import java.util.List;

public record QueryRequest(String query,
                           List<String> namespaces,
                           String employeeId,
                           String sessionId,
                           List<String> previousQueries,
                           boolean pendingClarification,
                           String confirmedPeriod,
                           String confirmedTemplate) {

    public QueryContext toContext() {
        TemplateType template = confirmedTemplate == null || confirmedTemplate.isBlank()
                ? null : TemplateType.fromId(confirmedTemplate);
        return new QueryContext(namespaces, employeeId, sessionId, previousQueries, pendingClarification,
                confirmedPeriod, template);
    }
}
