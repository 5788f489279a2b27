package com.memelet.service;

import com.memelet.model.AlbumItem;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.MediaType;
import com.memelet.repository.SqliteCatalogStore;
import com.memelet.util.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relocation and hash backfill against a real catalog and media tree.
 */
class IdentityVerifierTest {

    @TempDir
    Path tempDir;

    private Path mediaRoot;
    private SqliteCatalogStore store;
    private ContentHasher hasher;
    private IdentityVerifier verifier;

    @BeforeEach
    void setUp() throws IOException {
        mediaRoot = Files.createDirectories(tempDir.resolve("memes")).toAbsolutePath().normalize();
        PipelineConfig config = new PipelineConfig();
        config.setMediaRoot(mediaRoot.toString());

        store = new SqliteCatalogStore(tempDir.resolve("memelet.db"));
        hasher = new ContentHasher();
        verifier = new IdentityVerifier(store, hasher, config);
    }

    private Path write(String relativePath, String content) throws IOException {
        Path file = mediaRoot.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    private MediaRecord register(Path file, boolean withHash) {
        String hash = withHash ? hasher.hash(file).orElseThrow() : null;
        return store.insertMedia(new MediaRecord(file.toString(), MediaType.IMAGE, MediaStatus.NEW, hash, 10));
    }

    private MediaRecord reload(MediaRecord record) {
        return store.findById(record.getId()).orElseThrow();
    }

    @Test
    void testVerify_PresentFileWithoutHash_GetsHashed() throws IOException {
        Path file = write("cat.jpg", "cat pixels");
        MediaRecord record = register(file, false);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getHashed());
        assertEquals(hasher.hash(file).orElseThrow(), reload(record).getContentHash());
        assertEquals(MediaStatus.NEW, reload(record).getStatus());
    }

    @Test
    void testVerify_PresentFileWithHash_IsOk() throws IOException {
        register(write("cat.jpg", "cat pixels"), true);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getOk());
        assertEquals(0, summary.getErrored());
    }

    @Test
    void testVerify_FileMovedToOtherFolder_IsRelocatedByName() throws IOException {
        Path original = write("cat.jpg", "cat pixels");
        MediaRecord record = register(original, true);
        Path moved = write("animals/cat.jpg", "cat pixels");
        Files.delete(original);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getRelocated());
        MediaRecord loaded = reload(record);
        assertEquals(moved.toString(), loaded.getPath());
        assertEquals(record.getContentHash(), loaded.getContentHash(), "identity survives the move");
        assertEquals(MediaStatus.NEW, loaded.getStatus());
    }

    @Test
    void testVerify_FileMovedAndRenamed_IsFoundByContent() throws IOException {
        Path original = write("cat.jpg", "cat pixels");
        MediaRecord record = register(original, true);
        write("other/unrelated.png", "something else");
        Path renamed = write("other/best_cat.webp", "cat pixels");
        Files.delete(original);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getRelocated());
        assertEquals(renamed.toString(), reload(record).getPath());
    }

    @Test
    void testVerify_MissingFileWithoutHash_BecomesError() throws IOException {
        Path original = write("cat.jpg", "cat pixels");
        MediaRecord record = register(original, false);
        Files.delete(original);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getErrored());
        MediaRecord loaded = reload(record);
        assertEquals(MediaStatus.ERROR, loaded.getStatus());
        assertTrue(loaded.getErrorMessage().contains("no content hash recorded"));
    }

    @Test
    void testVerify_MissingFileWithNoMatch_BecomesError() throws IOException {
        Path original = write("cat.jpg", "cat pixels");
        MediaRecord record = register(original, true);
        Files.delete(original);
        write("dog.jpg", "dog pixels");

        verifier.verifyAll();

        MediaRecord loaded = reload(record);
        assertEquals(MediaStatus.ERROR, loaded.getStatus());
        assertTrue(loaded.getErrorMessage().contains("no file with the same content was found"));
        assertEquals(original.toString(), loaded.getPath(), "path is kept for a later retry");
    }

    @Test
    void testVerify_FileOwnedByAnotherRecord_IsNotTaken() throws IOException {
        Path original = write("cat.jpg", "cat pixels");
        MediaRecord record = register(original, true);
        register(write("cat_copy.jpg", "cat pixels"), true);
        Files.delete(original);

        verifier.verifyAll();

        MediaRecord loaded = reload(record);
        assertEquals(MediaStatus.ERROR, loaded.getStatus());
        assertEquals(original.toString(), loaded.getPath());
    }

    @Test
    void testVerify_AlbumItemMoved_OnlyThatItemIsRelocated() throws IOException {
        Path a = write("albums/story/A.jpg", "panel a");
        Path b = write("albums/story/B.jpg", "panel b");
        Path c = write("albums/story/C.jpg", "panel c");
        List<AlbumItem> items = new ArrayList<>();
        int order = 1;
        for (Path item : List.of(a, b, c)) {
            items.add(new AlbumItem(item.toString(), order++, hasher.hash(item).orElseThrow(), 7));
        }
        MediaRecord album = store.insertAlbum(
                new MediaRecord(mediaRoot.resolve("albums/story").toString(), MediaType.ALBUM, MediaStatus.NEW, null, 21), items);

        Path b2 = write("albums/story/B2.jpg", "panel b");
        Files.delete(b);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getRelocated());
        MediaRecord loaded = reload(album);
        assertEquals(MediaStatus.NEW, loaded.getStatus());
        List<AlbumItem> stored = loaded.getAlbumItems();
        assertEquals(a.toString(), stored.get(0).getPath());
        assertEquals(b2.toString(), stored.get(1).getPath());
        assertEquals(2, stored.get(1).getDisplayOrder());
        assertEquals(c.toString(), stored.get(2).getPath());
    }

    @Test
    void testVerify_AlbumItemGone_MarksAlbumError() throws IOException {
        Path a = write("albums/story/A.jpg", "panel a");
        Path b = write("albums/story/B.jpg", "panel b");
        MediaRecord album = store.insertAlbum(
                new MediaRecord(mediaRoot.resolve("albums/story").toString(), MediaType.ALBUM, MediaStatus.NEW, null, 14),
                List.of(new AlbumItem(a.toString(), 1, hasher.hash(a).orElseThrow(), 7),
                        new AlbumItem(b.toString(), 2, hasher.hash(b).orElseThrow(), 7)));
        Files.delete(b);

        VerificationSummary summary = verifier.verifyAll();

        assertEquals(1, summary.getErrored());
        MediaRecord loaded = reload(album);
        assertEquals(MediaStatus.ERROR, loaded.getStatus());
        assertTrue(loaded.getErrorMessage().contains(b.toString()));
        assertFalse(verifier.isReachable(loaded));
    }

    @Test
    void testIsReachable() throws IOException {
        Path file = write("cat.jpg", "cat pixels");
        MediaRecord record = register(file, true);

        assertTrue(verifier.isReachable(record));
        Files.delete(file);
        assertFalse(verifier.isReachable(record));
    }
}
