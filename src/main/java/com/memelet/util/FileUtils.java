package com.memelet.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Utility class for file manipulation.
 */
public class FileUtils {

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" has no extension, "image.JPG" -> "jpg"
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * File name without its extension ("cat_thumb.jpg" -> "cat_thumb").
     */
    public static String getBaseName(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        return i > 0 ? fileName.substring(0, i) : fileName;
    }

    /**
     * True if the base name ends with one of the given suffixes, ignoring case.
     */
    public static boolean hasBaseNameSuffix(String fileName, String... suffixes) {
        String baseName = getBaseName(fileName).toLowerCase();
        for (String suffix : suffixes) {
            if (suffix != null && !suffix.isEmpty() && baseName.endsWith(suffix.toLowerCase())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isHidden(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().startsWith(".");
    }

    /**
     * Deletes a directory and everything below it. Missing directories are ignored.
     */
    public static void deleteRecursively(Path directory) throws IOException {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
