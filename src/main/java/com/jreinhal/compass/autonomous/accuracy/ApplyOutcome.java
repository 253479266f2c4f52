package com.jreinhal.compass.autonomous.accuracy;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code applied} is false for dry runs and failures; {@code error} is set only on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyOutcome(String actionId, boolean success, boolean applied, String error) {
}
