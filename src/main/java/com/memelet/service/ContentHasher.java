package com.memelet.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * Computes the SHA-256 content identity of files and in-memory frames.
 */
public class ContentHasher {

    private static final int HASH_BUFFER_SIZE = 64 * 1024; // 64KB

    /**
     * Streams the file through SHA-256.
     *
     * @return the lowercase hex digest, or empty if the file could not be read
     */
    public Optional<String> hash(Path file) {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[HASH_BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            return Optional.empty();
        }
        return Optional.of(toHex(digest.digest()));
    }

    public String hashBytes(byte[] data) {
        return toHex(newDigest().digest(data));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
