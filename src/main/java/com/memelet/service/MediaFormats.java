package com.memelet.service;

import com.memelet.model.MediaType;
import com.memelet.util.FileUtils;

import java.util.Optional;
import java.util.Set;

/**
 * Extension-based classification of the files the pipeline ingests.
 */
public final class MediaFormats {

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "webp", "bmp");
    private static final Set<String> GIF_EXTENSIONS = Set.of("gif");
    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "webm", "mkv", "avi", "m4v");

    private MediaFormats() {
    }

    /**
     * @return IMAGE, GIF or VIDEO for supported files, empty otherwise (never ALBUM)
     */
    public static Optional<MediaType> classify(String fileName) {
        String extension = FileUtils.getExtension(fileName);
        if (IMAGE_EXTENSIONS.contains(extension)) {
            return Optional.of(MediaType.IMAGE);
        }
        if (GIF_EXTENSIONS.contains(extension)) {
            return Optional.of(MediaType.GIF);
        }
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return Optional.of(MediaType.VIDEO);
        }
        return Optional.empty();
    }

    public static boolean isSupported(String fileName) {
        return classify(fileName).isPresent();
    }

    /** Albums hold still images and GIFs only. */
    public static boolean isAlbumItem(String fileName) {
        Optional<MediaType> type = classify(fileName);
        return type.isPresent() && type.get() != MediaType.VIDEO;
    }
}
