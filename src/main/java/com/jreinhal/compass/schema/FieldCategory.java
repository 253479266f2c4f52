package com.jreinhal.compass.schema;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Domain category of a metadata field, inferred from its name and sampled values.
 */
public enum FieldCategory {
    EMPLOYEE_ID,
    PERIOD,
    COMMISSION,
    FYC,
    AGI,
    MDRT,
    CONTRACT,
    INCOME,
    PAYMENT,
    TEXT,
    GENERAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
