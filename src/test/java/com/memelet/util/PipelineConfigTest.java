package com.memelet.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PipelineConfig}: defaults, JSON loading and environment overrides.
 */
class PipelineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        PipelineConfig config = new PipelineConfig();

        assertEquals(10, config.getMaxGifFrames());
        assertEquals(2, config.getVideoSampleFps());
        assertEquals(20, config.getMaxVideoFrames());
        assertEquals(400, config.getThumbnailMaxWidth());
        assertEquals("openai/gpt-4.1-mini", config.getAiModel());
        assertEquals(2048, config.getMaxCompletionTokens());
        assertEquals(1.0, config.getTemperature());
        assertEquals(1.0, config.getTopP());
        assertNull(config.getAiApiToken());
        assertNull(config.getPublicUrlBase());
    }

    @Test
    void testDerivedLocations_AreUnderMediaRoot() {
        PipelineConfig config = new PipelineConfig();
        config.setMediaRoot(tempDir.toString());

        assertEquals(tempDir.resolve(".memelet"), config.getSystemRoot());
        assertEquals(tempDir.resolve("albums"), config.getAlbumsRoot());
        assertEquals(tempDir.resolve(".memelet/thumbnails"), config.getThumbnailsRoot());
        assertEquals(tempDir.resolve(".memelet/temp"), config.getTempRoot());
        assertEquals(tempDir.resolve(".memelet/logs"), config.getLogDir());
    }

    @Test
    void testLoad_ReadsKnownKeysAndKeepsDefaultsForOthers() throws IOException, URISyntaxException {
        Path file = Paths.get(getClass().getResource("/memelet-test.json").toURI());

        PipelineConfig config = PipelineConfig.load(file);

        assertEquals("/srv/memes", config.getMediaRoot());
        assertEquals("/srv/memelet/catalog.db", config.getDatabasePath());
        assertEquals("collections", config.getAlbumsDir());
        assertEquals(6, config.getMaxGifFrames());
        assertEquals("openai/gpt-4.1", config.getAiModel());
        assertEquals(0.7, config.getTemperature());
        assertEquals("https://memes.example.org/files", config.getPublicUrlBase());
        assertEquals(90, config.getAiTimeoutSeconds());
        // Not in the file
        assertEquals(20, config.getMaxVideoFrames());
        assertEquals(".memelet", config.getSystemDir());
    }

    @Test
    void testLoad_MissingFileGivesDefaults() throws IOException {
        PipelineConfig config = PipelineConfig.load(tempDir.resolve("absent.json"));

        assertEquals("files", config.getMediaRoot());
        assertEquals("memelet.db", config.getDatabasePath());
    }

    @Test
    void testLoad_NonObjectIsRejected() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThrows(IOException.class, () -> PipelineConfig.load(file));
    }

    @Test
    void testApplyEnvironment_OverridesFileValues() throws IOException, URISyntaxException {
        Path file = Paths.get(getClass().getResource("/memelet-test.json").toURI());
        Map<String, String> env = Map.of(
                "MEMES_DIR", "/data/memes",
                "DB_PATH", "/data/memelet.db",
                "MEMES_URL_BASE", "https://cdn.example.org/m",
                "REPLICATE_API_TOKEN", "r8_secret",
                "MEMELET_AI_MODEL", " ");

        PipelineConfig config = PipelineConfig.load(file).applyEnvironment(env);

        assertEquals("/data/memes", config.getMediaRoot());
        assertEquals("/data/memelet.db", config.getDatabasePath());
        assertEquals("https://cdn.example.org/m", config.getPublicUrlBase());
        assertEquals("r8_secret", config.getAiApiToken());
        // Blank values do not override
        assertEquals("openai/gpt-4.1", config.getAiModel());
    }
}
