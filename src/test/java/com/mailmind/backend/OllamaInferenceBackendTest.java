package com.mailmind.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailmind.exception.BackendUnavailableException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OllamaInferenceBackend against a local HTTP server speaking the Ollama API.
 */
class OllamaInferenceBackendTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> lastGenerateBody = new AtomicReference<>();
    private volatile int generateStatus = 200;

    private HttpServer server;
    private boolean stopped;
    private OllamaInferenceBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/tags", exchange -> respond(exchange, 200,
                "{\"models\":[{\"name\":\"llama3.1:8b-instruct-q4_K_M\"},{\"name\":\"mistral:7b-instruct-q4_K_M\"}]}"));
        server.createContext("/api/generate", exchange -> {
            lastGenerateBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (generateStatus != 200) {
                respond(exchange, generateStatus, "{\"error\":\"model not found\"}");
            } else {
                respond(exchange, 200, "{\"model\":\"llama3.1\",\"response\":\"{\\\"priority\\\":\\\"High\\\"}\",\"done\":true}");
            }
        });
        server.start();

        backend = new OllamaInferenceBackend("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (!stopped) {
            server.stop(0);
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("Should list installed models")
    void shouldListModels() {
        InferenceClient client = backend.connect();

        assertEquals(List.of("llama3.1:8b-instruct-q4_K_M", "mistral:7b-instruct-q4_K_M"), client.listModels());
        assertEquals("ollama", backend.name());
    }

    @Test
    @DisplayName("Should send a non-streaming generate request with options")
    void shouldGenerate() throws Exception {
        InferenceClient client = backend.connect();

        String text = client.generate("llama3.1", "Classify this", new GenerateOptions(0.2, 4096));

        assertEquals("{\"priority\":\"High\"}", text);
        JsonNode request = mapper.readTree(lastGenerateBody.get());
        assertEquals("llama3.1", request.get("model").asText());
        assertEquals("Classify this", request.get("prompt").asText());
        assertFalse(request.get("stream").asBoolean());
        assertEquals(0.2, request.get("options").get("temperature").asDouble(), 1e-9);
        assertEquals(4096, request.get("options").get("num_ctx").asInt());
    }

    @Test
    @DisplayName("Should report HTTP errors as backend unavailable")
    void shouldFailOnHttpError() {
        InferenceClient client = backend.connect();
        generateStatus = 404;

        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                () -> client.generate("missing", "prompt", GenerateOptions.defaults()));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    @DisplayName("Should fail to connect when the service is down")
    void shouldFailWhenServiceDown() {
        server.stop(0);
        stopped = true;

        assertThrows(BackendUnavailableException.class, () -> backend.connect());
    }
}
