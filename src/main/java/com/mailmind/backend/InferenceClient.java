package com.mailmind.backend;

import java.util.List;

/**
 * A connected backend client. Not required to be thread-safe;
 * the pool guarantees a client is used by one caller at a time.
 */
public interface InferenceClient extends AutoCloseable {

    /**
     * List the model identifiers installed on the backend.
     */
    List<String> listModels();

    /**
     * Generate a completion.
     *
     * @param model   Model identifier
     * @param prompt  Prompt text
     * @param options Sampling options
     * @return Generated text
     * @throws com.mailmind.exception.BackendUnavailableException if the call fails at transport level
     */
    String generate(String model, String prompt, GenerateOptions options);

    /**
     * Release resources held by this client. Default is a no-op.
     */
    @Override
    default void close() {
    }
}
