package com.memelet.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memelet.util.PipelineConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the HTTP exchange against a local stand-in for the predictions API.
 */
class ReplicateVisionClientTest {

    private static final String MODEL = "openai/gpt-4.1-mini";

    @TempDir
    Path tempDir;

    private HttpServer server;
    private String baseUrl;
    private PipelineConfig config;
    private Path mediaRoot;

    // Responses served in order: status code and body
    private final Deque<Object[]> responses = new ArrayDeque<>();
    private final AtomicReference<String> createBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> prefer = new AtomicReference<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/", this::handle);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";

        mediaRoot = Files.createDirectories(tempDir.resolve("memes")).toAbsolutePath().normalize();
        config = new PipelineConfig();
        config.setMediaRoot(mediaRoot.toString());
        config.setAiApiUrl(baseUrl + "/");
        config.setAiApiToken("r8_test");
        config.setAiModel(MODEL);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestCount.incrementAndGet();
        if ("POST".equals(exchange.getRequestMethod())) {
            createBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            prefer.set(exchange.getRequestHeaders().getFirst("Prefer"));
        }
        Object[] next;
        synchronized (responses) {
            next = responses.size() > 1 ? responses.poll() : responses.peek();
        }
        byte[] body = ((String) next[1]).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders((Integer) next[0], body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private void respond(int status, String body) {
        responses.add(new Object[]{status, body});
    }

    private Path sample(String relativePath, String content) throws IOException {
        Path file = mediaRoot.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    @Test
    void testAnalyze_ImmediateSuccess_SendsPromptsAndInlineImages() throws Exception {
        respond(201, "{\"status\": \"succeeded\", \"output\": [\"{\\\"description\\\": \", \"\\\"a cat\\\"}\"]}");
        Path image = sample("cat.png", "png bytes");

        String answer = new ReplicateVisionClient(config)
                .analyze("system text", "user text", List.of(image), Duration.ofSeconds(10));

        assertEquals("{\"description\": \"a cat\"}", answer);
        assertEquals("Bearer r8_test", authorization.get());
        assertEquals("wait", prefer.get());

        JsonNode input = new ObjectMapper().readTree(createBody.get()).get("input");
        assertEquals("user text", input.get("prompt").asText());
        assertEquals("system text", input.get("system_prompt").asText());
        assertEquals(1.0, input.get("temperature").asDouble(), 0.0001);
        assertEquals(2048, input.get("max_completion_tokens").asInt());
        String expectedUri = "data:image/png;base64," + Base64.getEncoder().encodeToString("png bytes".getBytes(StandardCharsets.UTF_8));
        assertEquals(expectedUri, input.get("image_input").get(0).asText());
    }

    @Test
    void testAnalyze_PollsUntilSucceeded() throws Exception {
        String pollUrl = baseUrl + "/predictions/abc123";
        respond(201, "{\"status\": \"starting\", \"urls\": {\"get\": \"" + pollUrl + "\"}}");
        respond(200, "{\"status\": \"succeeded\", \"output\": \"{}\"}");

        String answer = new ReplicateVisionClient(config)
                .analyze("s", "u", List.of(sample("a.jpg", "x")), Duration.ofSeconds(10));

        assertEquals("{}", answer);
        assertEquals(2, requestCount.get());
    }

    @Test
    void testAnalyze_FailedPrediction() throws IOException {
        respond(201, "{\"status\": \"failed\", \"error\": \"NSFW content detected\"}");
        ReplicateVisionClient client = new ReplicateVisionClient(config);
        Path image = sample("a.jpg", "x");

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> client.analyze("s", "u", List.of(image), Duration.ofSeconds(10)));
        assertEquals("Prediction failed: NSFW content detected", e.getMessage());
    }

    @Test
    void testAnalyze_HttpErrorStatus() throws IOException {
        respond(401, "{\"detail\": \"Invalid token\"}");
        ReplicateVisionClient client = new ReplicateVisionClient(config);
        Path image = sample("a.jpg", "x");

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> client.analyze("s", "u", List.of(image), Duration.ofSeconds(10)));
        assertTrue(e.getMessage().startsWith("HTTP 401"), e.getMessage());
        assertTrue(e.getMessage().contains("Invalid token"));
    }

    @Test
    void testAnalyze_GivesUpAtDeadline() throws IOException {
        respond(201, "{\"status\": \"processing\", \"urls\": {\"get\": \"" + baseUrl + "/predictions/slow\"}}");
        ReplicateVisionClient client = new ReplicateVisionClient(config);
        Path image = sample("a.jpg", "x");

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> client.analyze("s", "u", List.of(image), Duration.ofMillis(1500)));
        assertTrue(e.getMessage().contains("did not finish"), e.getMessage());
    }

    @Test
    void testAnalyze_WithoutToken_SendsNothing() {
        config.setAiApiToken(null);
        ReplicateVisionClient client = new ReplicateVisionClient(config);

        AnalysisException e = assertThrows(AnalysisException.class,
                () -> client.analyze("s", "u", List.of(), Duration.ofSeconds(10)));
        assertTrue(e.getMessage().contains(PipelineConfig.ENV_API_TOKEN));
        assertEquals(0, requestCount.get());
    }

    @Test
    void testToReference_PublicUrlForLibraryFiles() throws Exception {
        config.setPublicUrlBase("https://memes.example.org/files/");
        Path libraryFile = sample("my folder/cat 1.jpg", "x");
        Path frame = sample(".memelet/temp/5/frame.jpg", "frame");

        ReplicateVisionClient client = new ReplicateVisionClient(config);

        assertEquals("https://memes.example.org/files/my%20folder/cat%201.jpg", client.toReference(libraryFile));
        assertTrue(client.toReference(frame).startsWith("data:image/jpeg;base64,"), "temporary frames are never public");
    }

    @Test
    void testToReference_OutsideMediaRootIsInlined() throws Exception {
        config.setPublicUrlBase("https://memes.example.org/files");
        Path outside = Files.writeString(tempDir.resolve("elsewhere.gif"), "gif");

        String reference = new ReplicateVisionClient(config).toReference(outside);

        assertTrue(reference.startsWith("data:image/gif;base64,"));
    }
}
