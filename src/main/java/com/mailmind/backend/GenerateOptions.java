package com.mailmind.backend;

/**
 * Sampling options passed to {@link InferenceClient#generate}.
 *
 * @param temperature   Sampling temperature
 * @param contextWindow Context window size in tokens
 */
public record GenerateOptions(
        double temperature,
        int contextWindow
) {
    /**
     * Default options used for triage prompts.
     */
    public static GenerateOptions defaults() {
        return new GenerateOptions(0.3, 8192);
    }
}
