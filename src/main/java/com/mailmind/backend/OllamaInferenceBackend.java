package com.mailmind.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mailmind.exception.BackendUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link InferenceBackend} talking to a local Ollama service over its REST API.
 *
 * <p>Each connected client owns its own {@link HttpClient}. Connecting issues a
 * {@code GET /api/tags} so that an unreachable service fails at pool startup
 * rather than on the first batch.
 */
public class OllamaInferenceBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaInferenceBackend.class);

    private final URI baseUri;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public OllamaInferenceBackend(String baseUrl, Duration connectTimeout, Duration requestTimeout) {
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public InferenceClient connect() {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        OllamaClient client = new OllamaClient(httpClient);

        long start = System.nanoTime();
        List<String> models = client.listModels();
        log.info("Connected to Ollama at {} in {}ms ({} models installed)",
                baseUri, Duration.ofNanos(System.nanoTime() - start).toMillis(), models.size());
        return client;
    }

    @Override
    public String name() {
        return "ollama";
    }

    private class OllamaClient implements InferenceClient {

        private final HttpClient httpClient;

        OllamaClient(HttpClient httpClient) {
            this.httpClient = httpClient;
        }

        @Override
        public List<String> listModels() {
            JsonNode response = get("/api/tags");
            List<String> models = new ArrayList<>();
            JsonNode list = response.get("models");
            if (list != null) {
                for (JsonNode model : list) {
                    JsonNode name = model.has("name") ? model.get("name") : model.get("model");
                    if (name != null) {
                        models.add(name.asText());
                    }
                }
            }
            return models;
        }

        @Override
        public String generate(String model, String prompt, GenerateOptions options) {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("model", model);
            body.put("prompt", prompt);
            body.put("stream", false);
            ObjectNode opts = body.putObject("options");
            opts.put("temperature", options.temperature());
            opts.put("num_ctx", options.contextWindow());

            JsonNode response = post("/api/generate", body.toString());
            JsonNode text = response.get("response");
            if (text == null) {
                throw new BackendUnavailableException("Ollama generate returned no response field");
            }
            return text.asText();
        }

        private JsonNode get(String path) {
            HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(path))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            return send(request, path);
        }

        private JsonNode post(String path, String json) {
            HttpRequest request = HttpRequest.newBuilder(baseUri.resolve(path))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
            return send(request, path);
        }

        private JsonNode send(HttpRequest request, String path) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                if (response.statusCode() >= 400) {
                    throw new BackendUnavailableException("Ollama " + path + " failed (HTTP "
                            + response.statusCode() + "): " + response.body());
                }
                return objectMapper.readTree(response.body());
            } catch (IOException e) {
                throw new BackendUnavailableException("Failed to reach Ollama at " + baseUri + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendUnavailableException("Interrupted while calling Ollama " + path, e);
            }
        }
    }
}
