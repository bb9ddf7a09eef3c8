package com.mailmind.backend;

/**
 * Opaque capability of a local inference service.
 * Each call to {@link #connect()} yields an independent, reusable client.
 */
public interface InferenceBackend {

    /**
     * Open a new client connected to the backend.
     *
     * @return Connected client, reusable across many calls
     * @throws com.mailmind.exception.BackendUnavailableException if the backend cannot be reached
     */
    InferenceClient connect();

    /**
     * Short name used in logs (e.g. "ollama").
     */
    String name();
}
