package com.memelet.service;

import com.memelet.model.AlbumItem;
import com.memelet.model.MediaRecord;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces the sample images the vision model sees for a record.
 * <ul>
 *   <li>image: the file itself</li>
 *   <li>gif: up to {@code maxGifFrames} evenly spaced frames</li>
 *   <li>video: frames at a fixed rate, plus the thumbnail and preview loop when missing</li>
 *   <li>album: the item files in display order</li>
 * </ul>
 * Decoding runs on a worker thread and is abandoned when the caller's timeout expires.
 */
public class FrameExtractor implements AutoCloseable {

    private static final String CONTEXT = "FrameExtractor";

    private final MediaConverterService converter;
    private final ThumbnailService thumbnailService;
    private final ContentHasher hasher;
    private final Path logDir;
    private final int maxGifFrames;
    private final int videoSampleFps;
    private final int maxVideoFrames;
    private final int previewFps;
    private final int previewSeconds;

    private final ExecutorService decodeExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "frame-decoder");
        thread.setDaemon(true);
        return thread;
    });

    public FrameExtractor(MediaConverterService converter, ThumbnailService thumbnailService,
                          ContentHasher hasher, PipelineConfig config) {
        this.converter = converter;
        this.thumbnailService = thumbnailService;
        this.hasher = hasher;
        this.logDir = config.getLogDir();
        this.maxGifFrames = config.getMaxGifFrames();
        this.videoSampleFps = config.getVideoSampleFps();
        this.maxVideoFrames = config.getMaxVideoFrames();
        this.previewFps = config.getPreviewFps();
        this.previewSeconds = config.getPreviewSeconds();
    }

    /**
     * @param workspace directory reserved for this record's temporary frames
     * @param timeout   upper bound for decoding
     */
    public ExtractedSamples extract(MediaRecord record, Path workspace, Duration timeout) throws ExtractionException {
        switch (record.getMediaType()) {
            case IMAGE:
                return extractImage(record);
            case ALBUM:
                return extractAlbum(record);
            case GIF:
                return runBounded(record, timeout, () -> extractGif(record, workspace));
            case VIDEO:
                return runBounded(record, timeout, () -> extractVideo(record, workspace));
            default:
                throw new ExtractionException("Unsupported media type " + record.getMediaType());
        }
    }

    public boolean hasVideoArtifacts(MediaRecord record) {
        return thumbnailService.hasVideoArtifacts(record);
    }

    /**
     * Decodes the start of a video again to rewrite whichever display artifact is missing.
     * No analysis frames are kept.
     */
    public void regenerateVideoArtifacts(MediaRecord record, Duration timeout) throws ExtractionException {
        runBounded(record, timeout, () -> {
            MediaConverterService.VideoSamples video = converter.sampleVideo(
                    record.toPath(), videoSampleFps, 1, previewFps, previewSeconds);
            if (video.getAnalysisFrames().isEmpty()) {
                throw new IOException("No decodable frames in " + record.getPath());
            }
            thumbnailService.ensureVideoArtifacts(record, video.getAnalysisFrames().get(0), video.getPreviewFrames());
            return null;
        });
    }

    /**
     * Indices of {@code max} evenly spaced frames out of {@code total}: {@code floor(i * total / max)}.
     * Every frame when there are no more than {@code max}.
     */
    public static List<Integer> evenlySpacedIndices(int total, int max) {
        List<Integer> indices = new ArrayList<>();
        if (total <= max) {
            for (int i = 0; i < total; i++) {
                indices.add(i);
            }
            return indices;
        }
        for (int i = 0; i < max; i++) {
            indices.add((int) ((long) i * total / max));
        }
        return indices;
    }

    private ExtractedSamples extractImage(MediaRecord record) throws ExtractionException {
        Path file = record.toPath();
        if (!Files.isRegularFile(file)) {
            throw new ExtractionException("File not found: " + file);
        }
        return new ExtractedSamples(List.of(file));
    }

    private ExtractedSamples extractAlbum(MediaRecord record) throws ExtractionException {
        List<AlbumItem> items = new ArrayList<>(record.getAlbumItems());
        if (items.isEmpty()) {
            throw new ExtractionException("Album has no items: " + record.getPath());
        }
        items.sort((a, b) -> Integer.compare(a.getDisplayOrder(), b.getDisplayOrder()));

        List<Path> samples = new ArrayList<>();
        for (AlbumItem item : items) {
            if (!Files.isRegularFile(item.toPath())) {
                throw new ExtractionException("Album item " + item.getDisplayOrder() + " not found: " + item.getPath());
            }
            samples.add(item.toPath());
        }
        return new ExtractedSamples(samples);
    }

    private ExtractedSamples extractGif(MediaRecord record, Path workspace) throws IOException {
        Path file = record.toPath();
        int frameCount = converter.countFrames(file);
        if (frameCount == 0) {
            throw new IOException("No decodable frames in " + file);
        }

        List<Integer> indices = evenlySpacedIndices(frameCount, maxGifFrames);
        List<BufferedImage> frames = converter.grabFrames(file, new TreeSet<>(indices));
        List<Path> samples = writeFrames(frames, workspace);
        PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + record.getId() + ": sampled " + samples.size()
                + " of " + frameCount + " GIF frames");
        return new ExtractedSamples(samples);
    }

    private ExtractedSamples extractVideo(MediaRecord record, Path workspace) throws IOException {
        MediaConverterService.VideoSamples video = converter.sampleVideo(
                record.toPath(), videoSampleFps, maxVideoFrames, previewFps, previewSeconds);
        if (video.getAnalysisFrames().isEmpty()) {
            throw new IOException("No decodable frames in " + record.getPath());
        }

        List<Path> samples = writeFrames(video.getAnalysisFrames(), workspace);

        try {
            thumbnailService.ensureVideoArtifacts(record, video.getAnalysisFrames().get(0), video.getPreviewFrames());
        } catch (IOException e) {
            // Display artifacts are regenerated on the next run; analysis does not depend on them
            PipelineLogger.logError(logDir, CONTEXT, "Failed to write video artifacts for record #" + record.getId(), e);
        }

        PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + record.getId() + ": sampled " + samples.size()
                + " video frames at " + video.getFrameRate() + " fps");
        return new ExtractedSamples(samples);
    }

    // Frames are stored under the hash of their JPEG bytes, so identical frames collapse into one sample
    private List<Path> writeFrames(List<BufferedImage> frames, Path workspace) throws IOException {
        Files.createDirectories(workspace);
        Set<Path> samples = new LinkedHashSet<>();
        for (BufferedImage frame : frames) {
            byte[] jpeg = converter.toJpeg(frame, 0);
            Path target = workspace.resolve(hasher.hashBytes(jpeg) + ".jpg");
            if (!Files.exists(target)) {
                Files.write(target, jpeg);
            }
            samples.add(target);
        }
        return new ArrayList<>(samples);
    }

    private <T> T runBounded(MediaRecord record, Duration timeout, Callable<T> task) throws ExtractionException {
        Future<T> future = decodeExecutor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionException("Decoding " + record.getPath() + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while decoding " + record.getPath(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExtractionException("Failed to decode " + record.getPath() + ": " + cause.getMessage(), cause);
        }
    }

    @Override
    public void close() {
        decodeExecutor.shutdownNow();
    }
}
