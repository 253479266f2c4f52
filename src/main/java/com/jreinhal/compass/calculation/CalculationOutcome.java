package com.jreinhal.compass.calculation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationOutcome(boolean success, CalculationResult result, String error) {

    public static CalculationOutcome success(CalculationResult result) {
        return new CalculationOutcome(true, result, null);
    }

    public static CalculationOutcome failure(String error) {
        return new CalculationOutcome(false, null, error);
    }
}
