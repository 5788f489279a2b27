package com.memelet.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Static pipeline configuration.
 * Loaded from an optional JSON file; every key falls back to a default.
 * Environment variables take precedence over the file.
 */
public class PipelineConfig {

    public static final String ENV_MEDIA_ROOT = "MEMES_DIR";
    public static final String ENV_DATABASE_PATH = "DB_PATH";
    public static final String ENV_LOG_DIR = "LOG_DIR";
    public static final String ENV_PUBLIC_URL_BASE = "MEMES_URL_BASE";
    public static final String ENV_API_TOKEN = "REPLICATE_API_TOKEN";
    public static final String ENV_AI_MODEL = "MEMELET_AI_MODEL";

    private String mediaRoot = "files";
    private String databasePath = "memelet.db";
    private String systemDir = ".memelet";
    private String albumsDir = "albums";
    private String thumbnailsDir = "thumbnails";
    private String tempDir = "temp";
    private String logsDir = "logs";
    private String thumbnailSuffix = "_thumb";
    private String previewSuffix = "_preview";

    private int maxGifFrames = 10;
    private int videoSampleFps = 2;
    private int maxVideoFrames = 20;
    private int previewFps = 10;
    private int previewSeconds = 5;
    private int thumbnailMaxWidth = 400;

    private String aiApiUrl = "https://api.replicate.com/v1";
    private String aiApiToken;
    private String aiModel = "openai/gpt-4.1-mini";
    private double temperature = 1.0;
    private double topP = 1.0;
    private int maxCompletionTokens = 2048;
    private String publicUrlBase;
    private int aiTimeoutSeconds = 120;
    private int decodeTimeoutSeconds = 60;

    /**
     * Reads the given JSON file. Unknown keys are ignored.
     *
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public static PipelineConfig load(Path configFile) throws IOException {
        PipelineConfig config = new PipelineConfig();
        if (configFile == null || !Files.exists(configFile)) {
            return config;
        }

        JsonNode root = new ObjectMapper().readTree(configFile.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Configuration must be a JSON object: " + configFile);
        }

        config.mediaRoot = text(root, "mediaRoot", config.mediaRoot);
        config.databasePath = text(root, "databasePath", config.databasePath);
        config.systemDir = text(root, "systemDir", config.systemDir);
        config.albumsDir = text(root, "albumsDir", config.albumsDir);
        config.thumbnailsDir = text(root, "thumbnailsDir", config.thumbnailsDir);
        config.tempDir = text(root, "tempDir", config.tempDir);
        config.logsDir = text(root, "logsDir", config.logsDir);
        config.thumbnailSuffix = text(root, "thumbnailSuffix", config.thumbnailSuffix);
        config.previewSuffix = text(root, "previewSuffix", config.previewSuffix);

        config.maxGifFrames = root.path("maxGifFrames").asInt(config.maxGifFrames);
        config.videoSampleFps = root.path("videoSampleFps").asInt(config.videoSampleFps);
        config.maxVideoFrames = root.path("maxVideoFrames").asInt(config.maxVideoFrames);
        config.previewFps = root.path("previewFps").asInt(config.previewFps);
        config.previewSeconds = root.path("previewSeconds").asInt(config.previewSeconds);
        config.thumbnailMaxWidth = root.path("thumbnailMaxWidth").asInt(config.thumbnailMaxWidth);

        config.aiApiUrl = text(root, "aiApiUrl", config.aiApiUrl);
        config.aiApiToken = text(root, "aiApiToken", config.aiApiToken);
        config.aiModel = text(root, "aiModel", config.aiModel);
        config.temperature = root.path("temperature").asDouble(config.temperature);
        config.topP = root.path("topP").asDouble(config.topP);
        config.maxCompletionTokens = root.path("maxCompletionTokens").asInt(config.maxCompletionTokens);
        config.publicUrlBase = text(root, "publicUrlBase", config.publicUrlBase);
        config.aiTimeoutSeconds = root.path("aiTimeoutSeconds").asInt(config.aiTimeoutSeconds);
        config.decodeTimeoutSeconds = root.path("decodeTimeoutSeconds").asInt(config.decodeTimeoutSeconds);
        return config;
    }

    private static String text(JsonNode root, String key, String defaultValue) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        return node.asText();
    }

    /**
     * Overrides values with the ones present (and non-blank) in the given environment.
     */
    public PipelineConfig applyEnvironment(Map<String, String> environment) {
        mediaRoot = env(environment, ENV_MEDIA_ROOT, mediaRoot);
        databasePath = env(environment, ENV_DATABASE_PATH, databasePath);
        logsDir = env(environment, ENV_LOG_DIR, logsDir);
        publicUrlBase = env(environment, ENV_PUBLIC_URL_BASE, publicUrlBase);
        aiApiToken = env(environment, ENV_API_TOKEN, aiApiToken);
        aiModel = env(environment, ENV_AI_MODEL, aiModel);
        return this;
    }

    private static String env(Map<String, String> environment, String key, String current) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? current : value.trim();
    }

    // --- Derived locations ---

    public Path getMediaRootPath() {
        return Paths.get(mediaRoot).toAbsolutePath().normalize();
    }

    public Path getDatabaseFile() {
        return Paths.get(databasePath).toAbsolutePath().normalize();
    }

    /** Reserved subtree under the media root; never scanned. */
    public Path getSystemRoot() {
        return getMediaRootPath().resolve(systemDir);
    }

    public Path getAlbumsRoot() {
        return getMediaRootPath().resolve(albumsDir);
    }

    public Path getThumbnailsRoot() {
        return getSystemRoot().resolve(thumbnailsDir);
    }

    public Path getTempRoot() {
        return getSystemRoot().resolve(tempDir);
    }

    // An absolute logsDir (e.g. from LOG_DIR) is used as-is
    public Path getLogDir() {
        return getSystemRoot().resolve(logsDir);
    }

    // --- Accessors ---

    public String getMediaRoot() { return mediaRoot; }
    public void setMediaRoot(String mediaRoot) { this.mediaRoot = mediaRoot; }

    public String getDatabasePath() { return databasePath; }
    public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }

    public String getSystemDir() { return systemDir; }
    public String getAlbumsDir() { return albumsDir; }
    public String getThumbnailsDir() { return thumbnailsDir; }
    public String getTempDir() { return tempDir; }
    public String getLogsDir() { return logsDir; }

    public String getThumbnailSuffix() { return thumbnailSuffix; }
    public String getPreviewSuffix() { return previewSuffix; }

    public int getMaxGifFrames() { return maxGifFrames; }
    public void setMaxGifFrames(int maxGifFrames) { this.maxGifFrames = maxGifFrames; }

    public int getVideoSampleFps() { return videoSampleFps; }
    public int getMaxVideoFrames() { return maxVideoFrames; }
    public int getPreviewFps() { return previewFps; }
    public int getPreviewSeconds() { return previewSeconds; }
    public int getThumbnailMaxWidth() { return thumbnailMaxWidth; }

    public String getAiApiUrl() { return aiApiUrl; }
    public void setAiApiUrl(String aiApiUrl) { this.aiApiUrl = aiApiUrl; }

    public String getAiApiToken() { return aiApiToken; }
    public void setAiApiToken(String aiApiToken) { this.aiApiToken = aiApiToken; }

    public String getAiModel() { return aiModel; }
    public void setAiModel(String aiModel) { this.aiModel = aiModel; }

    public double getTemperature() { return temperature; }
    public double getTopP() { return topP; }
    public int getMaxCompletionTokens() { return maxCompletionTokens; }

    public String getPublicUrlBase() { return publicUrlBase; }
    public void setPublicUrlBase(String publicUrlBase) { this.publicUrlBase = publicUrlBase; }

    public int getAiTimeoutSeconds() { return aiTimeoutSeconds; }
    public void setAiTimeoutSeconds(int aiTimeoutSeconds) { this.aiTimeoutSeconds = aiTimeoutSeconds; }

    public int getDecodeTimeoutSeconds() { return decodeTimeoutSeconds; }
    public void setDecodeTimeoutSeconds(int decodeTimeoutSeconds) { this.decodeTimeoutSeconds = decodeTimeoutSeconds; }
}
