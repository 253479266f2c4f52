package com.jreinhal.compass.llm;

/**
 * Text generation backend used for intent refinement and answer phrasing.
 */
public interface LlmGenerator {

    String generate(String systemPrompt, String userPrompt, GenerationOptions options);
}
