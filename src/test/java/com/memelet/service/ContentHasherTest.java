package com.memelet.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    // sha256("abc")
    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    private final ContentHasher hasher = new ContentHasher();

    @TempDir
    Path tempDir;

    @Test
    void testHash_KnownVector() throws IOException {
        Path file = tempDir.resolve("abc.txt");
        Files.writeString(file, "abc");

        assertEquals(Optional.of(ABC_SHA256), hasher.hash(file));
        assertEquals(ABC_SHA256, hasher.hashBytes("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testHash_DependsOnContentOnly() throws IOException {
        byte[] content = new byte[200_000]; // spans several read buffers
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        Path first = Files.write(tempDir.resolve("meme.jpg"), content);
        Path copy = Files.write(tempDir.resolve("renamed_copy.png"), content);

        assertEquals(hasher.hash(first), hasher.hash(copy));
        assertEquals(hasher.hashBytes(content), hasher.hash(first).orElseThrow());
    }

    @Test
    void testHash_MissingFile_ReturnsEmpty() {
        assertTrue(hasher.hash(tempDir.resolve("nope.jpg")).isEmpty());
    }
}
