package com.jreinhal.compass.llm;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ChatClientLlmGenerator implements LlmGenerator {
    private static final Logger log = LoggerFactory.getLogger(ChatClientLlmGenerator.class);
    private final ChatClient chatClient;
    @Value("${compass.llm.timeout-ms:15000}")
    private long timeoutMs;

    public ChatClientLlmGenerator(ChatClient.Builder chatClientBuilder) {
        this.chatClient = chatClientBuilder.build();
    }

    @Override
    public String generate(String systemPrompt, String userPrompt, GenerationOptions options) {
        GenerationOptions effective = options != null ? options : GenerationOptions.DETERMINISTIC;
        ChatOptions chatOptions = ChatOptions.builder()
                .temperature(effective.temperature())
                .maxTokens(effective.maxTokens())
                .build();
        long startTime = System.currentTimeMillis();
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> this.chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(chatOptions)
                .call()
                .content());
        try {
            String content = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("LLM generation completed in {}ms", System.currentTimeMillis() - startTime);
            return content != null ? content : "";
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("LLM generation timed out after {}ms", this.timeoutMs);
            throw new LlmGenerationException("LLM generation timed out after " + this.timeoutMs + "ms", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmGenerationException("LLM generation interrupted", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("LLM generation failed: {}", cause.getMessage());
            throw new LlmGenerationException("LLM generation failed: " + cause.getMessage(), cause);
        }
    }
}
