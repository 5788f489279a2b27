package com.memelet.service;

import com.memelet.model.CatalogStats;
import com.memelet.model.MediaAnalysis;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.MediaType;
import com.memelet.repository.CatalogStore;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives records through {@code new -> processing -> done | error}, with {@code error -> processing}
 * for retries.
 * <p>
 * Batch operations (ingest, process pending, retry errors) run one at a time and process records
 * sequentially; a batch requested while another runs is not started. Single-record operations may
 * run alongside a batch. Status changes are conditional on the current status, so a record picked
 * up twice is analyzed once. A failing record never stops a batch; interrupting the calling thread
 * stops it between records.
 */
public class PipelineOrchestrator {

    private static final String CONTEXT = "PipelineOrchestrator";

    private final CatalogStore store;
    private final IdentityVerifier verifier;
    private final DirectoryScanner scanner;
    private final AnalysisDispatcher dispatcher;
    private final FrameExtractor frameExtractor;
    private final TagReconciler tagReconciler;
    private final Path mediaRoot;
    private final Path logDir;
    private final Duration aiTimeout;
    private final Duration decodeTimeout;

    private final ReentrantLock batchLock = new ReentrantLock();
    // Records being processed by this instance; anything else in 'processing' is left over from a dead run
    private final Set<Long> activeRecords = ConcurrentHashMap.newKeySet();

    public PipelineOrchestrator(CatalogStore store, IdentityVerifier verifier, DirectoryScanner scanner,
                                AnalysisDispatcher dispatcher, FrameExtractor frameExtractor,
                                TagReconciler tagReconciler, PipelineConfig config) {
        this.store = store;
        this.verifier = verifier;
        this.scanner = scanner;
        this.dispatcher = dispatcher;
        this.frameExtractor = frameExtractor;
        this.tagReconciler = tagReconciler;
        this.mediaRoot = config.getMediaRootPath();
        this.logDir = config.getLogDir();
        this.aiTimeout = Duration.ofSeconds(config.getAiTimeoutSeconds());
        this.decodeTimeout = Duration.ofSeconds(config.getDecodeTimeoutSeconds());
    }

    /**
     * Verifies known records, registers new files, applies path tags to everything and rewrites
     * missing thumbnails and previews of analyzed videos. Verification always runs first so that
     * moved files are relocated, not re-registered.
     */
    public IngestResult ingest() {
        if (!Files.isDirectory(mediaRoot)) {
            // An unmounted library must not turn every record into an error
            PipelineLogger.logError(logDir, CONTEXT, "Media root not found: " + mediaRoot, null);
            return IngestResult.notStarted();
        }
        if (!batchLock.tryLock()) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Ingest skipped: another batch is running");
            return IngestResult.notStarted();
        }
        try {
            PipelineLogger.logInfo(logDir, CONTEXT, "Starting ingest of " + mediaRoot);
            VerificationSummary verification = verifier.verifyAll();
            int added = scanner.scan(mediaRoot);
            int tagsApplied = tagReconciler.applyPathTagsToAll();
            int repaired = repairVideoArtifacts();

            IngestResult result = new IngestResult(verification, added, tagsApplied, repaired);
            PipelineLogger.logInfo(logDir, CONTEXT, "Ingest complete. " + result);
            return result;
        } finally {
            batchLock.unlock();
        }
    }

    /**
     * Analyzes one record if it is new or errored.
     *
     * @return true if the record ended in done
     */
    public boolean processOne(long recordId) {
        Optional<MediaRecord> record = store.findById(recordId);
        if (record.isEmpty()) {
            PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + recordId + " not found");
            return false;
        }
        return process(record.get()) == ProcessOutcome.DONE;
    }

    /**
     * Analyzes every new record, oldest first, and errored ones too when asked.
     * Registered duplicates are left alone.
     */
    public BatchResult processPending(boolean includeErrors) {
        if (!batchLock.tryLock()) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Processing skipped: another batch is running");
            return BatchResult.notStarted();
        }
        try {
            recoverStaleRecords();

            List<MediaRecord> targets = includeErrors
                    ? store.findByStatus(MediaStatus.NEW, MediaStatus.ERROR)
                    : store.findByStatus(MediaStatus.NEW);
            targets.removeIf(PipelineOrchestrator::isDuplicate);

            PipelineLogger.logInfo(logDir, CONTEXT, "Processing " + targets.size() + " pending record(s)");
            BatchResult result = runBatch(targets);
            PipelineLogger.logInfo(logDir, CONTEXT, "Processing complete: " + result);
            return result;
        } finally {
            PipelineLogger.flush(logDir);
            batchLock.unlock();
        }
    }

    /**
     * Re-verifies errored records and retries the ones whose files are reachable again.
     */
    public BatchResult retryErrors() {
        if (!batchLock.tryLock()) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Retry skipped: another batch is running");
            return BatchResult.notStarted();
        }
        try {
            recoverStaleRecords();

            List<MediaRecord> errored = store.findByStatus(MediaStatus.ERROR);
            errored.removeIf(PipelineOrchestrator::isDuplicate);
            verifier.verify(errored);

            List<MediaRecord> reachable = new ArrayList<>();
            int unreachable = 0;
            for (MediaRecord record : errored) {
                if (verifier.isReachable(record)) {
                    reachable.add(record);
                } else {
                    unreachable++;
                }
            }

            PipelineLogger.logInfo(logDir, CONTEXT, "Retrying " + reachable.size() + " errored record(s), "
                    + unreachable + " still unreachable");
            BatchResult result = runBatch(reachable);
            for (int i = 0; i < unreachable; i++) {
                result.record(ProcessOutcome.SKIPPED);
            }
            PipelineLogger.logInfo(logDir, CONTEXT, "Retry complete: " + result);
            return result;
        } finally {
            PipelineLogger.flush(logDir);
            batchLock.unlock();
        }
    }

    /**
     * Re-applies path tags and the tags stored from each record's last analysis.
     * Status and descriptive fields are not touched.
     *
     * @return number of associations created
     */
    public int tagScan(List<Long> recordIds) {
        int applied = 0;
        for (Long id : recordIds) {
            Optional<MediaRecord> record = store.findById(id);
            if (record.isEmpty()) {
                PipelineLogger.logWarning(logDir, CONTEXT, "Tag scan: record #" + id + " not found");
                continue;
            }
            applied += applyTags(record.get(), storedSuggestions(record.get()));
        }
        PipelineLogger.logInfo(logDir, CONTEXT, "Tag scan of " + recordIds.size() + " record(s): " + applied + " new associations");
        return applied;
    }

    public int tagScanAll() {
        int applied = 0;
        List<MediaRecord> records = store.findAll();
        for (MediaRecord record : records) {
            applied += applyTags(record, storedSuggestions(record));
        }
        PipelineLogger.logInfo(logDir, CONTEXT, "Tag scan of all " + records.size() + " record(s): " + applied + " new associations");
        return applied;
    }

    public CatalogStats stats() {
        return store.countByStatus();
    }

    // Videos that are not done get their artifacts when they are analyzed
    private int repairVideoArtifacts() {
        int repaired = 0;
        for (MediaRecord record : store.findByStatus(MediaStatus.DONE)) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (record.getMediaType() != MediaType.VIDEO || frameExtractor.hasVideoArtifacts(record)
                    || !verifier.isReachable(record)) {
                continue;
            }
            try {
                frameExtractor.regenerateVideoArtifacts(record, decodeTimeout);
                repaired++;
            } catch (ExtractionException e) {
                PipelineLogger.logError(logDir, CONTEXT, "Could not regenerate artifacts of record #" + record.getId(), e);
            }
        }
        if (repaired > 0) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Regenerated display artifacts of " + repaired + " video(s)");
        }
        return repaired;
    }

    private BatchResult runBatch(List<MediaRecord> records) {
        BatchResult result = new BatchResult();
        for (MediaRecord record : records) {
            if (Thread.currentThread().isInterrupted()) {
                PipelineLogger.logInfo(logDir, CONTEXT, "Batch interrupted after " + result.getTotal() + " record(s)");
                break;
            }
            result.record(process(record));
        }
        return result;
    }

    private ProcessOutcome process(MediaRecord candidate) {
        MediaRecord record = candidate;
        long id = record.getId();

        if (!record.getStatus().canStartProcessing()) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + id + " is " + record.getStatus().getDbValue() + ", skipping");
            return ProcessOutcome.SKIPPED;
        }

        if (!verifier.isReachable(record)) {
            verifier.verify(List.of(record));
            Optional<MediaRecord> refreshed = store.findById(id);
            if (refreshed.isEmpty() || !verifier.isReachable(refreshed.get())) {
                PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + id + " is not reachable, skipping");
                return ProcessOutcome.SKIPPED;
            }
            record = refreshed.get();
        }

        // Claimed before the status change so that stale recovery never sees a live record unclaimed
        if (!activeRecords.add(id)) {
            PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + id + " is already being processed, skipping");
            return ProcessOutcome.SKIPPED;
        }
        if (!store.transitionStatus(id, record.getStatus(), MediaStatus.PROCESSING)) {
            activeRecords.remove(id);
            PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + id + " changed status concurrently, skipping");
            return ProcessOutcome.SKIPPED;
        }

        try {
            PipelineLogger.logInfo(logDir, CONTEXT, "Processing record #" + id + ": " + record.getDisplayName());
            MediaAnalysis analysis = dispatcher.analyze(record, aiTimeout);

            if (!store.completeAnalysis(id, analysis)) {
                PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + id + " left processing during analysis, result discarded");
                return ProcessOutcome.SKIPPED;
            }
            applyTags(record, analysis.getTags());
            PipelineLogger.logInfo(logDir, CONTEXT, "Record #" + id + " done");
            return ProcessOutcome.DONE;
        } catch (PipelineException e) {
            fail(id, e.getMessage(), e);
            return ProcessOutcome.FAILED;
        } catch (RuntimeException e) {
            fail(id, "Unexpected error: " + e, e);
            return ProcessOutcome.FAILED;
        } finally {
            activeRecords.remove(id);
        }
    }

    private void fail(long id, String message, Throwable cause) {
        PipelineLogger.logError(logDir, CONTEXT, "Record #" + id + " failed: " + message, cause);
        if (!store.failProcessing(id, message)) {
            PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + id + " was no longer processing, error not stored");
        }
    }

    // Tag failures are logged; they never change the record's status
    private int applyTags(MediaRecord record, List<String> suggestedNames) {
        try {
            int applied = tagReconciler.applyPathTags(record);
            if (!suggestedNames.isEmpty()) {
                applied += tagReconciler.applySuggestedTags(record, suggestedNames).getApplied();
            }
            return applied;
        } catch (RuntimeException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Tagging failed for record #" + record.getId(), e);
            return 0;
        }
    }

    private void recoverStaleRecords() {
        List<MediaRecord> stale = new ArrayList<>(store.findByStatus(MediaStatus.PROCESSING));
        stale.removeIf(record -> activeRecords.contains(record.getId()));
        for (MediaRecord record : stale) {
            if (store.failProcessing(record.getId(), "Processing was interrupted before completion")) {
                store.releaseWorkspace(AnalysisDispatcher.workspaceName(record));
                PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + record.getId() + " was left in processing, moved to error");
            }
        }
    }

    private static List<String> storedSuggestions(MediaRecord record) {
        String stored = record.getSuggestedTags();
        if (stored == null || stored.isBlank()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(Arrays.asList(stored.split("\n")));
        names.removeIf(String::isBlank);
        return names;
    }

    private static boolean isDuplicate(MediaRecord record) {
        return record.getErrorMessage() != null && record.getErrorMessage().startsWith(DirectoryScanner.DUPLICATE_MESSAGE_PREFIX);
    }
}
