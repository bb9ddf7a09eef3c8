package com.mailmind.config;

import com.mailmind.backend.GenerateOptions;

/**
 * Inference backend configuration.
 *
 * @param baseUrl               Ollama base URL
 * @param primaryModel          Preferred model
 * @param fallbackModel         Model used when the primary is not installed
 * @param temperature           Sampling temperature
 * @param contextWindow         Context window in tokens
 * @param connectTimeoutSeconds HTTP connect timeout
 * @param requestTimeoutSeconds HTTP request timeout
 */
public record BackendConfig(
        String baseUrl,
        String primaryModel,
        String fallbackModel,
        double temperature,
        int contextWindow,
        int connectTimeoutSeconds,
        int requestTimeoutSeconds
) {
    public static BackendConfig defaults() {
        return new BackendConfig(
                "http://localhost:11434",
                "llama3.1:8b-instruct-q4_K_M",
                "mistral:7b-instruct-q4_K_M",
                0.3,
                8192,
                5,
                120
        );
    }

    public GenerateOptions generateOptions() {
        return new GenerateOptions(temperature, contextWindow);
    }
}
