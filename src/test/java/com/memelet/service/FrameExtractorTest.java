package com.memelet.service;

import com.memelet.model.AlbumItem;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.MediaType;
import com.memelet.util.PipelineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Sampling rules per media type. Decoding is mocked; only the selection, deduplication and
 * workspace handling are exercised here.
 */
@ExtendWith(MockitoExtension.class)
class FrameExtractorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    @Mock
    private MediaConverterService converter;

    @Mock
    private ThumbnailService thumbnailService;

    private Path workspace;
    private FrameExtractor extractor;

    @BeforeEach
    void setUp() {
        PipelineConfig config = new PipelineConfig();
        config.setMediaRoot(tempDir.toString());
        workspace = tempDir.resolve(".memelet/temp/1");
        extractor = new FrameExtractor(converter, thumbnailService, new ContentHasher(), config);
    }

    @AfterEach
    void tearDown() {
        extractor.close();
    }

    private MediaRecord record(Path file, MediaType type) {
        MediaRecord record = new MediaRecord(file.toString(), type, MediaStatus.PROCESSING, "hash", 1);
        record.setId(1);
        return record;
    }

    private static BufferedImage solid(int rgb) {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, rgb);
        return image;
    }

    // Stand-in encoder: the bytes only need to differ between differently colored frames
    private void stubJpegEncoding() throws IOException {
        when(converter.toJpeg(any(BufferedImage.class), eq(0)))
                .thenAnswer(invocation -> {
                    BufferedImage image = invocation.getArgument(0);
                    return ("frame-" + image.getRGB(0, 0)).getBytes();
                });
    }

    @Test
    void testEvenlySpacedIndices_SamplesAcrossTheWholeRange() {
        assertEquals(List.of(0, 3, 7, 11, 14, 18, 22, 25, 29, 33), FrameExtractor.evenlySpacedIndices(37, 10));
    }

    @Test
    void testEvenlySpacedIndices_ShortInputKeepsEveryFrame() {
        assertEquals(List.of(0, 1, 2), FrameExtractor.evenlySpacedIndices(3, 10));
        assertEquals(List.of(), FrameExtractor.evenlySpacedIndices(0, 10));
        assertEquals(10, FrameExtractor.evenlySpacedIndices(10, 10).size());
    }

    @Test
    void testExtract_Image_UsesFileItself() throws Exception {
        Path file = Files.writeString(tempDir.resolve("cat.jpg"), "pixels");

        ExtractedSamples samples = extractor.extract(record(file, MediaType.IMAGE), workspace, TIMEOUT);

        assertEquals(List.of(file), samples.getSamples());
        assertFalse(Files.exists(workspace), "still images need no workspace");
    }

    @Test
    void testExtract_MissingImage_Fails() {
        Path file = tempDir.resolve("gone.jpg");

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(record(file, MediaType.IMAGE), workspace, TIMEOUT));
        assertTrue(e.getMessage().contains("gone.jpg"));
    }

    @Test
    void testExtract_Album_ReturnsItemsInDisplayOrder() throws Exception {
        Path first = Files.writeString(tempDir.resolve("z.jpg"), "1");
        Path second = Files.writeString(tempDir.resolve("a.png"), "2");
        MediaRecord album = record(tempDir, MediaType.ALBUM);
        album.setAlbumItems(List.of(
                new AlbumItem(second.toString(), 2, "h2", 1),
                new AlbumItem(first.toString(), 1, "h1", 1)));

        ExtractedSamples samples = extractor.extract(album, workspace, TIMEOUT);

        assertEquals(List.of(first, second), samples.getSamples());
    }

    @Test
    void testExtract_AlbumWithMissingItem_FailsWithoutPartialSamples() throws IOException {
        Path first = Files.writeString(tempDir.resolve("1.jpg"), "1");
        MediaRecord album = record(tempDir, MediaType.ALBUM);
        album.setAlbumItems(List.of(
                new AlbumItem(first.toString(), 1, "h1", 1),
                new AlbumItem(tempDir.resolve("2.jpg").toString(), 2, "h2", 1)));

        ExtractionException e = assertThrows(ExtractionException.class, () -> extractor.extract(album, workspace, TIMEOUT));
        assertTrue(e.getMessage().startsWith("Album item 2 not found"));
    }

    @Test
    void testExtract_EmptyAlbum_Fails() {
        MediaRecord album = record(tempDir, MediaType.ALBUM);

        assertThrows(ExtractionException.class, () -> extractor.extract(album, workspace, TIMEOUT));
    }

    @Test
    void testExtract_Gif_WritesEvenlySpacedFrames() throws Exception {
        Path gif = tempDir.resolve("dance.gif");
        List<BufferedImage> frames = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            frames.add(solid(i * 1000));
        }
        when(converter.countFrames(gif)).thenReturn(37);
        when(converter.grabFrames(eq(gif), any())).thenReturn(frames);
        stubJpegEncoding();

        ExtractedSamples samples = extractor.extract(record(gif, MediaType.GIF), workspace, TIMEOUT);

        assertEquals(10, samples.size());
        for (Path sample : samples.getSamples()) {
            assertTrue(sample.startsWith(workspace));
            assertTrue(sample.getFileName().toString().endsWith(".jpg"));
            assertTrue(Files.exists(sample));
        }
        verify(converter).grabFrames(gif, Set.of(0, 3, 7, 11, 14, 18, 22, 25, 29, 33));
    }

    @Test
    void testExtract_Gif_IdenticalFramesCollapse() throws Exception {
        Path gif = tempDir.resolve("static.gif");
        when(converter.countFrames(gif)).thenReturn(3);
        when(converter.grabFrames(eq(gif), any())).thenReturn(List.of(solid(5), solid(5), solid(7)));
        stubJpegEncoding();

        ExtractedSamples samples = extractor.extract(record(gif, MediaType.GIF), workspace, TIMEOUT);

        assertEquals(2, samples.size());
    }

    @Test
    void testExtract_GifWithoutFrames_Fails() throws Exception {
        Path gif = tempDir.resolve("broken.gif");
        when(converter.countFrames(gif)).thenReturn(0);

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(record(gif, MediaType.GIF), workspace, TIMEOUT));
        assertTrue(e.getMessage().contains("No decodable frames"));
    }

    @Test
    void testExtract_SlowDecode_TimesOut() throws Exception {
        Path gif = tempDir.resolve("huge.gif");
        when(converter.countFrames(gif)).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return 1;
        });

        ExtractionException e = assertThrows(ExtractionException.class,
                () -> extractor.extract(record(gif, MediaType.GIF), workspace, Duration.ofMillis(200)));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void testExtract_Video_SamplesFramesAndWritesArtifacts() throws Exception {
        Path video = tempDir.resolve("clip.mp4");
        List<BufferedImage> analysis = List.of(solid(1), solid(2), solid(3));
        List<BufferedImage> preview = List.of(solid(1), solid(2));
        when(converter.sampleVideo(eq(video), anyInt(), anyInt(), anyInt(), anyInt()))
                .thenReturn(new MediaConverterService.VideoSamples(30.0, analysis, preview));
        stubJpegEncoding();
        MediaRecord record = record(video, MediaType.VIDEO);

        ExtractedSamples samples = extractor.extract(record, workspace, TIMEOUT);

        assertEquals(3, samples.size());
        verify(thumbnailService).ensureVideoArtifacts(record, analysis.get(0), preview);
    }

    @Test
    void testExtract_Video_ArtifactFailureDoesNotFailAnalysis() throws Exception {
        Path video = tempDir.resolve("clip.mp4");
        List<BufferedImage> analysis = List.of(solid(1));
        when(converter.sampleVideo(eq(video), anyInt(), anyInt(), anyInt(), anyInt()))
                .thenReturn(new MediaConverterService.VideoSamples(25.0, analysis, List.of()));
        stubJpegEncoding();
        MediaRecord record = record(video, MediaType.VIDEO);
        doThrow(new IOException("disk full")).when(thumbnailService).ensureVideoArtifacts(any(), any(), any());

        ExtractedSamples samples = extractor.extract(record, workspace, TIMEOUT);

        assertEquals(1, samples.size());
    }

    @Test
    void testExtract_VideoWithoutFrames_FailsBeforeArtifacts() throws Exception {
        Path video = tempDir.resolve("empty.mp4");
        when(converter.sampleVideo(eq(video), anyInt(), anyInt(), anyInt(), anyInt()))
                .thenReturn(new MediaConverterService.VideoSamples(25.0, List.of(), List.of()));

        assertThrows(ExtractionException.class, () -> extractor.extract(record(video, MediaType.VIDEO), workspace, TIMEOUT));
        verify(thumbnailService, never()).ensureVideoArtifacts(any(), any(), any());
    }
}
