package com.example.smartbin.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Delegated insight backend selection. {@code provider} is one of {@code none}, {@code ollama},
 * {@code openxai}.
 */
@ConfigurationProperties(prefix = "app.ai")
public record AiProperties(
        @DefaultValue("none") String provider,
        @DefaultValue("20s") Duration callTimeout,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("60s") Duration readTimeout,
        @DefaultValue Ollama ollama,
        @DefaultValue OpenXai openxai
) {

    public record Ollama(
            @DefaultValue("http://localhost:11434") String baseUrl,
            @DefaultValue("llama2:7b") String model,
            String apiKey
    ) {
    }

    public record OpenXai(
            @DefaultValue("https://api.openxai.com") String baseUrl,
            String apiKey
    ) {
    }
}
