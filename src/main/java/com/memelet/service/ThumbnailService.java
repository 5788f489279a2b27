package com.memelet.service;

import com.memelet.model.MediaRecord;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Long-lived display artifacts of video records: a JPEG thumbnail and a short silent preview loop.
 * Artifacts are written once, regenerated only when missing, and never deleted here.
 */
public class ThumbnailService {

    private static final String CONTEXT = "ThumbnailService";

    private final MediaConverterService converter;
    private final Path thumbnailsRoot;
    private final Path logDir;
    private final String thumbnailSuffix;
    private final String previewSuffix;
    private final int maxWidth;
    private final int previewFps;

    public ThumbnailService(MediaConverterService converter, PipelineConfig config) {
        this.converter = converter;
        this.thumbnailsRoot = config.getThumbnailsRoot();
        this.logDir = config.getLogDir();
        this.thumbnailSuffix = config.getThumbnailSuffix();
        this.previewSuffix = config.getPreviewSuffix();
        this.maxWidth = config.getThumbnailMaxWidth();
        this.previewFps = config.getPreviewFps();
    }

    public Path getThumbnailPath(MediaRecord record) {
        return thumbnailsRoot.resolve(record.getId() + thumbnailSuffix + ".jpg");
    }

    public Path getPreviewPath(MediaRecord record) {
        return thumbnailsRoot.resolve(record.getId() + previewSuffix + ".mp4");
    }

    public boolean hasVideoArtifacts(MediaRecord record) {
        return Files.exists(getThumbnailPath(record)) && Files.exists(getPreviewPath(record));
    }

    /**
     * Writes whichever of the two artifacts is missing.
     *
     * @param thumbnailFrame first sampled frame of the video
     * @param previewFrames  frames of the preview loop
     */
    public void ensureVideoArtifacts(MediaRecord record, BufferedImage thumbnailFrame, List<BufferedImage> previewFrames) throws IOException {
        Files.createDirectories(thumbnailsRoot);

        Path thumbnail = getThumbnailPath(record);
        if (!Files.exists(thumbnail) && thumbnailFrame != null) {
            byte[] jpeg = converter.toJpeg(thumbnailFrame, maxWidth);
            Path partial = thumbnail.resolveSibling(thumbnail.getFileName() + ".part");
            Files.write(partial, jpeg);
            Files.move(partial, thumbnail, StandardCopyOption.REPLACE_EXISTING);
            PipelineLogger.logInfo(logDir, CONTEXT, "Wrote thumbnail for record #" + record.getId());
        }

        Path preview = getPreviewPath(record);
        if (!Files.exists(preview) && !previewFrames.isEmpty()) {
            converter.writePreviewClip(previewFrames, preview, previewFps, maxWidth);
            PipelineLogger.logInfo(logDir, CONTEXT, "Wrote preview loop for record #" + record.getId()
                    + " (" + previewFrames.size() + " frames)");
        }
    }
}
