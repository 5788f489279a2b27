package com.memelet.service;

import com.memelet.model.AlbumItem;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.MediaType;
import com.memelet.repository.CatalogStore;
import com.memelet.repository.DatabaseException;
import com.memelet.util.FileUtils;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registers files that are not in the catalog yet.
 * <p>
 * Each top-level folder of the albums location becomes one album record whose items are the
 * folder's direct image children in file-name order. Everything else is registered one file per
 * record. A file whose content already belongs to a record is registered as an error record
 * pointing at the original. Must run after {@link IdentityVerifier} so that moved files are
 * relocated instead of being registered twice.
 */
public class DirectoryScanner {

    public static final String DUPLICATE_MESSAGE_PREFIX = "Duplicate of record #";
    private static final String CONTEXT = "DirectoryScanner";

    private final CatalogStore store;
    private final ContentHasher hasher;
    private final Path systemRoot;
    private final Path albumsRoot;
    private final Path logDir;
    private final String thumbnailSuffix;
    private final String previewSuffix;

    public DirectoryScanner(CatalogStore store, ContentHasher hasher, PipelineConfig config) {
        this.store = store;
        this.hasher = hasher;
        this.systemRoot = config.getSystemRoot();
        this.albumsRoot = config.getAlbumsRoot();
        this.logDir = config.getLogDir();
        this.thumbnailSuffix = config.getThumbnailSuffix();
        this.previewSuffix = config.getPreviewSuffix();
    }

    /**
     * Walks the root and registers every unseen media unit.
     *
     * @return number of records added, duplicates included
     */
    public int scan(Path root) {
        PipelineLogger.logInfo(logDir, CONTEXT, "Scanning for new files in: " + root);

        Set<String> knownPaths = store.getAllKnownPaths();
        int[] added = new int[1];
        int[] duplicates = new int[1];

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(root)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (dir.startsWith(systemRoot) || FileUtils.isHidden(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (albumsRoot.equals(dir.getParent())) {
                        if (registerAlbum(dir, knownPaths)) {
                            added[0]++;
                        }
                        // Nested folders inside an album are not part of it
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || !isCandidate(file) || knownPaths.contains(file.toString())) {
                        return FileVisitResult.CONTINUE;
                    }
                    Optional<MediaRecord> registered = registerFile(file, attrs.size());
                    if (registered.isPresent()) {
                        knownPaths.add(file.toString());
                        added[0]++;
                        if (registered.get().getStatus() == MediaStatus.ERROR) {
                            duplicates[0]++;
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    PipelineLogger.logRecurringError(logDir, CONTEXT, "Failed to visit file", exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Error walking file tree", e);
        }

        PipelineLogger.logInfo(logDir, CONTEXT, "Scan complete. Added " + added[0] + " records (" + duplicates[0] + " duplicates)");
        PipelineLogger.flush(logDir);
        return added[0];
    }

    private boolean isCandidate(Path file) {
        String fileName = file.getFileName().toString();
        return !FileUtils.isHidden(file)
                && !FileUtils.hasBaseNameSuffix(fileName, thumbnailSuffix, previewSuffix)
                && MediaFormats.isSupported(fileName);
    }

    private Optional<MediaRecord> registerFile(Path file, long size) {
        MediaType type = MediaFormats.classify(file.getFileName().toString()).orElseThrow();
        String hash = hasher.hash(file).orElse(null);
        if (hash == null) {
            PipelineLogger.logWarning(logDir, CONTEXT, "Could not hash " + file + ", registering without content hash");
        }

        MediaRecord record = new MediaRecord(file.toString(), type, MediaStatus.NEW, hash, size);
        Optional<MediaRecord> original = hash != null ? store.findFirstByHash(hash) : Optional.empty();
        if (original.isPresent()) {
            record.setStatus(MediaStatus.ERROR);
            record.setErrorMessage(DUPLICATE_MESSAGE_PREFIX + original.get().getId() + " (" + original.get().getPath() + ")");
            PipelineLogger.logWarning(logDir, CONTEXT, file + ": " + record.getErrorMessage());
        }

        try {
            return Optional.of(store.insertMedia(record));
        } catch (DatabaseException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Failed to register " + file, e);
            return Optional.empty();
        }
    }

    private boolean registerAlbum(Path albumDir, Set<String> knownPaths) {
        if (knownPaths.contains(albumDir.toString())) {
            return false;
        }

        List<Path> files;
        try (Stream<Path> children = Files.list(albumDir)) {
            files = children
                    .filter(Files::isRegularFile)
                    .filter(this::isCandidate)
                    .filter(p -> MediaFormats.isAlbumItem(p.getFileName().toString()))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString(), String.CASE_INSENSITIVE_ORDER))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Failed to list album folder " + albumDir, e);
            return false;
        }

        if (files.isEmpty()) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Skipping album folder without images: " + albumDir);
            return false;
        }

        List<AlbumItem> items = new ArrayList<>();
        long totalSize = 0;
        int order = 1;
        for (Path file : files) {
            long size = sizeOf(file);
            totalSize += size;
            items.add(new AlbumItem(file.toString(), order++, hasher.hash(file).orElse(null), size));
        }

        MediaRecord album = new MediaRecord(albumDir.toString(), MediaType.ALBUM, MediaStatus.NEW, null, totalSize);
        album.setTitle(albumDir.getFileName().toString());

        try {
            store.insertAlbum(album, items);
        } catch (DatabaseException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Failed to register album " + albumDir, e);
            return false;
        }

        knownPaths.add(albumDir.toString());
        items.forEach(item -> knownPaths.add(item.getPath()));
        PipelineLogger.logInfo(logDir, CONTEXT, "Registered album '" + album.getTitle() + "' with " + items.size() + " items");
        return true;
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            PipelineLogger.logRecurringError(logDir, CONTEXT, "Could not read file size", e);
            return 0;
        }
    }
}
