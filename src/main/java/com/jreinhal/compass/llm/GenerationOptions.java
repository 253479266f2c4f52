package com.jreinhal.compass.llm;

public record GenerationOptions(double temperature, int maxTokens) {

    public static final GenerationOptions DETERMINISTIC = new GenerationOptions(0.0, 1000);

    public GenerationOptions {
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be within [0, 2]");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }
}
