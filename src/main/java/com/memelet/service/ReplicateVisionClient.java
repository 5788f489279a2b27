package com.memelet.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memelet.util.FileUtils;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Set;

/**
 * {@link VisionClient} over the Replicate predictions API.
 * <p>
 * Creates a prediction with {@code Prefer: wait} and polls its {@code urls.get} link until it
 * reaches a terminal status. Samples inside the media root are referenced by public URL when a
 * public base URL is configured; everything else is sent inline as a base64 data URI.
 */
public class ReplicateVisionClient implements VisionClient {

    private static final String CONTEXT = "ReplicateVisionClient";
    private static final Set<String> FAILED_STATUSES = Set.of("failed", "canceled");
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String apiUrl;
    private final String apiToken;
    private final String model;
    private final double temperature;
    private final double topP;
    private final int maxCompletionTokens;
    private final String publicUrlBase;
    private final Path mediaRoot;
    private final Path systemRoot;
    private final Path logDir;

    public ReplicateVisionClient(PipelineConfig config) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.apiUrl = stripTrailingSlash(config.getAiApiUrl());
        this.apiToken = config.getAiApiToken();
        this.model = config.getAiModel();
        this.temperature = config.getTemperature();
        this.topP = config.getTopP();
        this.maxCompletionTokens = config.getMaxCompletionTokens();
        this.publicUrlBase = config.getPublicUrlBase();
        this.mediaRoot = config.getMediaRootPath();
        this.systemRoot = config.getSystemRoot();
        this.logDir = config.getLogDir();
    }

    @Override
    public String analyze(String systemPrompt, String userPrompt, List<Path> samples, Duration timeout) throws AnalysisException {
        if (apiToken == null || apiToken.isBlank()) {
            throw new AnalysisException("No API token configured (set " + PipelineConfig.ENV_API_TOKEN + ")");
        }
        Instant deadline = Instant.now().plus(timeout);

        String body = buildRequestBody(systemPrompt, userPrompt, samples);
        HttpRequest create = authorized(URI.create(apiUrl + "/models/" + model + "/predictions"), remaining(deadline))
                .header("Content-Type", "application/json")
                .header("Prefer", "wait")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        PipelineLogger.logInfo(logDir, CONTEXT, "Sending " + samples.size() + " sample(s) to " + model);
        JsonNode prediction = send(create);

        while (true) {
            String status = prediction.path("status").asText("");
            if ("succeeded".equals(status)) {
                return joinOutput(prediction.get("output"));
            }
            if (FAILED_STATUSES.contains(status)) {
                throw new AnalysisException("Prediction " + status + ": " + prediction.path("error").asText("no error message"));
            }

            String pollUrl = prediction.path("urls").path("get").asText("");
            if (pollUrl.isEmpty()) {
                throw new AnalysisException("Prediction in status '" + status + "' has no polling URL");
            }
            if (Instant.now().plus(POLL_INTERVAL).isAfter(deadline)) {
                throw new AnalysisException("Prediction did not finish within " + timeout.toSeconds() + "s");
            }
            sleep(POLL_INTERVAL);
            prediction = send(authorized(URI.create(pollUrl), remaining(deadline)).GET().build());
        }
    }

    String buildRequestBody(String systemPrompt, String userPrompt, List<Path> samples) throws AnalysisException {
        ObjectNode input = mapper.createObjectNode();
        input.put("prompt", userPrompt);
        input.put("system_prompt", systemPrompt);
        ArrayNode images = input.putArray("image_input");
        for (Path sample : samples) {
            images.add(toReference(sample));
        }
        input.put("temperature", temperature);
        input.put("top_p", topP);
        input.put("max_completion_tokens", maxCompletionTokens);

        ObjectNode root = mapper.createObjectNode();
        root.set("input", input);
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Could not encode request", e);
        }
    }

    /**
     * Public URL for library files when a base URL is configured, data URI otherwise.
     * Temporary frames live in the reserved system folder and are always sent inline.
     */
    String toReference(Path sample) throws AnalysisException {
        Path absolute = sample.toAbsolutePath().normalize();
        if (publicUrlBase != null && !publicUrlBase.isBlank()
                && absolute.startsWith(mediaRoot) && !absolute.startsWith(systemRoot)) {
            String relative = mediaRoot.relativize(absolute).toString().replace('\\', '/');
            try {
                String encoded = new URI(null, null, relative, null).getRawPath();
                return stripTrailingSlash(publicUrlBase) + "/" + encoded;
            } catch (URISyntaxException e) {
                throw new AnalysisException("Cannot build public URL for " + sample, e);
            }
        }

        try {
            byte[] bytes = Files.readAllBytes(absolute);
            return "data:" + mimeType(absolute) + ";base64," + Base64.getEncoder().encodeToString(bytes);
        } catch (IOException e) {
            throw new AnalysisException("Cannot read sample " + sample, e);
        }
    }

    private HttpRequest.Builder authorized(URI uri, Duration timeout) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiToken);
    }

    private JsonNode send(HttpRequest request) throws AnalysisException {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new AnalysisException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted while waiting for the model", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new AnalysisException("HTTP " + response.statusCode() + " from " + request.uri() + ": " + abbreviate(response.body()));
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Unreadable prediction response: " + abbreviate(response.body()), e);
        }
    }

    // Language models on Replicate stream their output as a list of tokens
    private String joinOutput(JsonNode output) throws AnalysisException {
        if (output == null || output.isNull()) {
            throw new AnalysisException("Prediction succeeded without output");
        }
        if (output.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : output) {
                sb.append(part.asText());
            }
            return sb.toString();
        }
        return output.asText();
    }

    private Duration remaining(Instant deadline) throws AnalysisException {
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new AnalysisException("Timed out waiting for the model");
        }
        return remaining;
    }

    private void sleep(Duration duration) throws AnalysisException {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisException("Interrupted while polling prediction", e);
        }
    }

    private static String mimeType(Path file) {
        String extension = FileUtils.getExtension(file.getFileName().toString());
        switch (extension) {
            case "png":
                return "image/png";
            case "gif":
                return "image/gif";
            case "webp":
                return "image/webp";
            case "bmp":
                return "image/bmp";
            default:
                return "image/jpeg";
        }
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }
}
