package com.memelet.service;

import com.memelet.model.AlbumItem;
import com.memelet.model.MediaRecord;
import com.memelet.repository.CatalogStore;
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
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Keeps catalog records attached to their files.
 * <p>
 * Present files get their missing hashes computed. Missing files are looked up again by content:
 * first among files carrying the same name (cheap, covers folder moves), then by hashing every
 * media file under the root until one matches. The second phase costs one hash per file in the
 * library and is only reached when a file was both moved and renamed; it reports progress in the
 * pipeline log instead of running in parallel.
 * <p>
 * Files already owned by another record or album item are never taken as relocation targets.
 */
public class IdentityVerifier {

    private static final String CONTEXT = "IdentityVerifier";
    private static final int PROGRESS_INTERVAL = 250;

    private final CatalogStore store;
    private final ContentHasher hasher;
    private final Path mediaRoot;
    private final Path systemRoot;
    private final Path logDir;

    public IdentityVerifier(CatalogStore store, ContentHasher hasher, PipelineConfig config) {
        this.store = store;
        this.hasher = hasher;
        this.mediaRoot = config.getMediaRootPath();
        this.systemRoot = config.getSystemRoot();
        this.logDir = config.getLogDir();
    }

    public VerificationSummary verifyAll() {
        return verify(store.findAll());
    }

    /**
     * Verifies the given records. Outcomes are persisted; nothing is thrown for unrecoverable records.
     */
    public VerificationSummary verify(List<MediaRecord> records) {
        VerificationSummary summary = new VerificationSummary();
        Set<String> knownPaths = store.getAllKnownPaths();

        for (MediaRecord record : records) {
            if (record.isAlbum()) {
                verifyAlbum(record, knownPaths, summary);
            } else {
                verifySingle(record, knownPaths, summary);
            }
        }

        PipelineLogger.logInfo(logDir, CONTEXT, "Verification complete: " + summary);
        PipelineLogger.flush(logDir);
        return summary;
    }

    /**
     * True when the record's file exists, or, for albums, when every item exists.
     */
    public boolean isReachable(MediaRecord record) {
        if (record.isAlbum()) {
            for (AlbumItem item : record.getAlbumItems()) {
                if (!Files.isRegularFile(item.toPath())) {
                    return false;
                }
            }
            return true;
        }
        return Files.isRegularFile(record.toPath());
    }

    private void verifySingle(MediaRecord record, Set<String> knownPaths, VerificationSummary summary) {
        Path path = record.toPath();

        if (Files.isRegularFile(path)) {
            if (record.getContentHash() == null) {
                Optional<String> hash = hasher.hash(path);
                if (hash.isPresent()) {
                    store.updateContentHash(record.getId(), hash.get());
                    record.setContentHash(hash.get());
                    summary.incrementHashed();
                    return;
                }
                PipelineLogger.logWarning(logDir, CONTEXT, "Could not read " + path + " to compute its hash, will retry on next pass");
            }
            summary.incrementOk();
            return;
        }

        if (record.getContentHash() == null) {
            fail(record, "File missing at " + path + " and no content hash recorded, cannot relocate", summary);
            return;
        }

        Optional<Path> match = relocate(path, record.getContentHash(), knownPaths);
        if (match.isPresent()) {
            String newPath = match.get().toString();
            store.updatePath(record.getId(), newPath);
            knownPaths.remove(record.getPath());
            knownPaths.add(newPath);
            PipelineLogger.logInfo(logDir, CONTEXT, "Relocated record #" + record.getId() + ": " + record.getPath() + " -> " + newPath);
            record.setPath(newPath);
            summary.incrementRelocated();
        } else {
            fail(record, "File missing at " + path + " and no file with the same content was found", summary);
        }
    }

    private void verifyAlbum(MediaRecord album, Set<String> knownPaths, VerificationSummary summary) {
        List<String> unrecoverable = new ArrayList<>();
        boolean hashed = false;
        boolean relocated = false;

        for (AlbumItem item : album.getAlbumItems()) {
            Path path = item.toPath();

            if (Files.isRegularFile(path)) {
                if (item.getContentHash() == null) {
                    Optional<String> hash = hasher.hash(path);
                    if (hash.isPresent()) {
                        item.setContentHash(hash.get());
                        store.updateAlbumItem(item);
                        hashed = true;
                    }
                }
                continue;
            }

            if (item.getContentHash() == null) {
                unrecoverable.add(path.toString());
                continue;
            }

            Optional<Path> match = relocate(path, item.getContentHash(), knownPaths);
            if (match.isPresent()) {
                String newPath = match.get().toString();
                knownPaths.remove(item.getPath());
                knownPaths.add(newPath);
                PipelineLogger.logInfo(logDir, CONTEXT, "Relocated item " + item.getDisplayOrder() + " of album #"
                        + album.getId() + ": " + item.getPath() + " -> " + newPath);
                item.setPath(newPath);
                store.updateAlbumItem(item);
                relocated = true;
            } else {
                unrecoverable.add(path.toString());
            }
        }

        if (!unrecoverable.isEmpty()) {
            fail(album, "Album items missing and not recoverable: " + String.join(", ", unrecoverable), summary);
        } else if (relocated) {
            summary.incrementRelocated();
        } else if (hashed) {
            summary.incrementHashed();
        } else {
            summary.incrementOk();
        }
    }

    private void fail(MediaRecord record, String message, VerificationSummary summary) {
        store.markError(record.getId(), message);
        record.setErrorMessage(message);
        PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + record.getId() + ": " + message);
        summary.incrementErrored();
    }

    /**
     * Two-phase search for a file with the given content.
     */
    private Optional<Path> relocate(Path missing, String contentHash, Set<String> knownPaths) {
        Path missingName = missing.getFileName();
        if (missingName != null) {
            String fileName = missingName.toString();
            Optional<Path> byName = search(contentHash, knownPaths,
                    file -> fileName.equals(file.getFileName().toString()), false);
            if (byName.isPresent()) {
                return byName;
            }
        }

        PipelineLogger.logInfo(logDir, CONTEXT, "No same-name match for " + missing + ", hashing the whole media root");
        return search(contentHash, knownPaths, file -> MediaFormats.isSupported(file.getFileName().toString()), true);
    }

    private Optional<Path> search(String contentHash, Set<String> knownPaths, Predicate<Path> candidate, boolean reportProgress) {
        Path[] found = new Path[1];
        int[] hashedCount = new int[1];

        try {
            Files.walkFileTree(mediaRoot, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.startsWith(systemRoot) || (!dir.equals(mediaRoot) && FileUtils.isHidden(dir))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || FileUtils.isHidden(file) || knownPaths.contains(file.toString())) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (!candidate.test(file)) {
                        return FileVisitResult.CONTINUE;
                    }

                    Optional<String> hash = hasher.hash(file);
                    hashedCount[0]++;
                    if (reportProgress && hashedCount[0] % PROGRESS_INTERVAL == 0) {
                        PipelineLogger.logInfo(logDir, CONTEXT, "Full-tree relocation search: " + hashedCount[0] + " files hashed");
                    }

                    if (hash.isPresent() && hash.get().equals(contentHash)) {
                        found[0] = file;
                        return FileVisitResult.TERMINATE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    PipelineLogger.logRecurringError(logDir, CONTEXT, "Failed to visit file during relocation search", exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Relocation search aborted under " + mediaRoot, e);
        }

        return Optional.ofNullable(found[0]);
    }
}
