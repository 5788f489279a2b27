package com.memelet.service;

import net.coobird.thumbnailator.Thumbnails;
import org.bytedeco.ffmpeg.global.avcodec;
import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegFrameGrabber;
import org.bytedeco.javacv.FFmpegFrameRecorder;
import org.bytedeco.javacv.Frame;
import org.bytedeco.javacv.Java2DFrameConverter;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decoding and encoding helpers over FFmpeg (JavaCV) and Thumbnailator.
 * All decode loops stop with an {@link InterruptedIOException} when the calling thread is interrupted.
 */
public class MediaConverterService {

    static final double DEFAULT_FRAME_RATE = 25.0;
    private static final double JPEG_QUALITY = 0.85;

    /**
     * Frames sampled from a video in a single decode pass.
     */
    public static class VideoSamples {
        private final double frameRate;
        private final List<BufferedImage> analysisFrames;
        private final List<BufferedImage> previewFrames;

        public VideoSamples(double frameRate, List<BufferedImage> analysisFrames, List<BufferedImage> previewFrames) {
            this.frameRate = frameRate;
            this.analysisFrames = analysisFrames;
            this.previewFrames = previewFrames;
        }

        public double getFrameRate() { return frameRate; }
        public List<BufferedImage> getAnalysisFrames() { return analysisFrames; }
        public List<BufferedImage> getPreviewFrames() { return previewFrames; }
    }

    /**
     * Counts decodable frames by decoding the whole stream. Container frame counts are not
     * reliable for GIFs.
     */
    public int countFrames(Path file) throws IOException {
        int count = 0;
        try (FFmpegFrameGrabber grabber = openGrabber(file)) {
            grabber.start();
            while (grabber.grabImage() != null) {
                checkInterrupted();
                count++;
            }
        }
        return count;
    }

    /**
     * Decodes the frames at the given 0-based indices, in stream order.
     */
    public List<BufferedImage> grabFrames(Path file, Set<Integer> indices) throws IOException {
        List<BufferedImage> frames = new ArrayList<>();
        if (indices.isEmpty()) {
            return frames;
        }
        int last = indices.stream().mapToInt(Integer::intValue).max().getAsInt();

        try (FFmpegFrameGrabber grabber = openGrabber(file);
             Java2DFrameConverter converter = new Java2DFrameConverter()) {
            grabber.start();
            Frame frame;
            int index = 0;
            while (index <= last && (frame = grabber.grabImage()) != null) {
                checkInterrupted();
                if (indices.contains(index)) {
                    frames.add(copyOf(converter, frame));
                }
                index++;
            }
        }
        return frames;
    }

    /**
     * Samples a video at a fixed rate for analysis and, independently, collects the frames of the
     * preview loop from its first seconds.
     *
     * @param sampleFps      analysis frames per second of video
     * @param maxFrames      cap on analysis frames
     * @param previewFps     preview loop frame rate
     * @param previewSeconds length of the preview loop
     */
    public VideoSamples sampleVideo(Path file, int sampleFps, int maxFrames, int previewFps, int previewSeconds) throws IOException {
        List<BufferedImage> analysisFrames = new ArrayList<>();
        List<BufferedImage> previewFrames = new ArrayList<>();

        try (FFmpegFrameGrabber grabber = openGrabber(file);
             Java2DFrameConverter converter = new Java2DFrameConverter()) {
            grabber.start();
            double fps = effectiveFrameRate(grabber.getFrameRate());
            int analysisStep = frameStep(fps, sampleFps);
            int previewStep = frameStep(fps, previewFps);
            long previewEnd = Math.round(fps * previewSeconds);

            Frame frame;
            int index = 0;
            while ((frame = grabber.grabImage()) != null) {
                checkInterrupted();
                boolean wantAnalysis = analysisFrames.size() < maxFrames && index % analysisStep == 0;
                boolean wantPreview = index < previewEnd && index % previewStep == 0;
                if (wantAnalysis || wantPreview) {
                    BufferedImage image = copyOf(converter, frame);
                    if (wantAnalysis) analysisFrames.add(image);
                    if (wantPreview) previewFrames.add(image);
                }
                index++;
                if (analysisFrames.size() >= maxFrames && index >= previewEnd) {
                    break;
                }
            }
            return new VideoSamples(fps, analysisFrames, previewFrames);
        }
    }

    /**
     * Encodes the image as JPEG, scaled down to at most {@code maxWidth} pixels wide.
     */
    public byte[] toJpeg(BufferedImage image, int maxWidth) throws IOException {
        BufferedImage rgbImage = toRgb(image);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(rgbImage);
        if (maxWidth > 0 && rgbImage.getWidth() > maxWidth) {
            builder.width(maxWidth);
        } else {
            builder.scale(1.0);
        }
        builder.outputQuality(JPEG_QUALITY)
                .outputFormat("jpg")
                .toOutputStream(baos);
        return baos.toByteArray();
    }

    /**
     * Encodes the frames as a silent H.264 MP4 loop, scaled to at most {@code maxWidth} pixels wide.
     */
    public void writePreviewClip(List<BufferedImage> frames, Path target, double fps, int maxWidth) throws IOException {
        if (frames.isEmpty()) {
            throw new IOException("No frames for preview clip " + target);
        }

        BufferedImage first = frames.get(0);
        double scale = maxWidth > 0 && first.getWidth() > maxWidth ? (double) maxWidth / first.getWidth() : 1.0;
        // yuv420p needs even dimensions
        int width = Math.max(2, ((int) Math.round(first.getWidth() * scale)) & ~1);
        int height = Math.max(2, ((int) Math.round(first.getHeight() * scale)) & ~1);

        boolean written = false;
        try (FFmpegFrameRecorder recorder = new FFmpegFrameRecorder(target.toFile(), width, height, 0);
             Java2DFrameConverter converter = new Java2DFrameConverter()) {
            recorder.setFormat("mp4");
            recorder.setVideoCodec(avcodec.AV_CODEC_ID_H264);
            recorder.setPixelFormat(avutil.AV_PIX_FMT_YUV420P);
            recorder.setFrameRate(fps);
            recorder.start();
            for (BufferedImage image : frames) {
                checkInterrupted();
                BufferedImage scaled = Thumbnails.of(toRgb(image)).forceSize(width, height).asBufferedImage();
                recorder.record(converter.convert(scaled));
            }
            recorder.stop();
            written = true;
        } finally {
            if (!written) {
                Files.deleteIfExists(target);
            }
        }
    }

    /**
     * Unknown or invalid container frame rates fall back to 25 fps.
     */
    public static double effectiveFrameRate(double reported) {
        if (Double.isNaN(reported) || Double.isInfinite(reported) || reported <= 0) {
            return DEFAULT_FRAME_RATE;
        }
        return reported;
    }

    /**
     * Number of source frames between two samples taken at {@code targetFps}; at least 1.
     */
    public static int frameStep(double fps, int targetFps) {
        if (targetFps <= 0) {
            return 1;
        }
        return Math.max(1, (int) Math.round(fps / targetFps));
    }

    // Protected to allow tests to substitute the grabber
    protected FFmpegFrameGrabber openGrabber(Path file) {
        return new FFmpegFrameGrabber(file.toFile());
    }

    // The converter reuses its buffer between frames
    private BufferedImage copyOf(Java2DFrameConverter converter, Frame frame) {
        return Java2DFrameConverter.cloneBufferedImage(converter.convert(frame));
    }

    private BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgbImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgbImage.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgbImage;
    }

    private static void checkInterrupted() throws InterruptedIOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Decoding interrupted");
        }
    }
}
