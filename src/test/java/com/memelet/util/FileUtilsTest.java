package com.memelet.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testGetExtensionNormalFile() {
        assertEquals("jpg", FileUtils.getExtension("image.jpg"));
        assertEquals("mp4", FileUtils.getExtension("clip.MP4"));
    }

    @Test
    void testGetExtensionHiddenFile() {
        // ".gitignore" is a hidden file without extension
        assertEquals("", FileUtils.getExtension(".gitignore"));
        assertEquals("", FileUtils.getExtension("README"));
        assertEquals("", FileUtils.getExtension(null));
    }

    @Test
    void testGetBaseName() {
        assertEquals("cat_thumb", FileUtils.getBaseName("cat_thumb.jpg"));
        assertEquals("archive.tar", FileUtils.getBaseName("archive.tar.gz"));
        assertEquals("README", FileUtils.getBaseName("README"));
    }

    @Test
    void testHasBaseNameSuffix() {
        assertTrue(FileUtils.hasBaseNameSuffix("12_thumb.jpg", "_thumb", "_preview"));
        assertTrue(FileUtils.hasBaseNameSuffix("12_PREVIEW.mp4", "_thumb", "_preview"));
        assertFalse(FileUtils.hasBaseNameSuffix("thumbs_up.jpg", "_thumb", "_preview"));
        assertFalse(FileUtils.hasBaseNameSuffix("meme.jpg", "", null));
    }

    @Test
    void testIsHidden() {
        assertTrue(FileUtils.isHidden(Paths.get("/media/.memelet")));
        assertFalse(FileUtils.isHidden(Paths.get("/media/memes")));
    }

    @Test
    void testDeleteRecursively_RemovesNestedContent() throws IOException {
        Path root = tempDir.resolve("workspace");
        Files.createDirectories(root.resolve("a/b"));
        Files.writeString(root.resolve("a/b/frame.jpg"), "x");
        Files.writeString(root.resolve("top.jpg"), "y");

        FileUtils.deleteRecursively(root);

        assertFalse(Files.exists(root));
    }

    @Test
    void testDeleteRecursively_MissingDirectoryIsIgnored() {
        assertDoesNotThrow(() -> FileUtils.deleteRecursively(tempDir.resolve("missing")));
    }
}
