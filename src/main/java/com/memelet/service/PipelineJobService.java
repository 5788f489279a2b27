package com.memelet.service;

import com.memelet.model.JobStatus;
import com.memelet.model.JobStatus.JobState;
import com.memelet.model.JobStatus.JobType;
import com.memelet.repository.CatalogStore;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for externally triggered operations.
 * <p>
 * Every trigger returns a job id at once and runs the operation on a background thread. Job state
 * is persisted in the catalog for polling, and {@code JOB <id> START} / {@code JOB <id> COMPLETE}
 * markers are written to the pipeline log.
 */
public class PipelineJobService {

    private static final String CONTEXT = "PipelineJobService";

    private final PipelineOrchestrator orchestrator;
    private final CatalogStore store;
    private final Path logDir;
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "pipeline-job");
        thread.setDaemon(true);
        return thread;
    });

    public PipelineJobService(PipelineOrchestrator orchestrator, CatalogStore store, PipelineConfig config) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.logDir = config.getLogDir();
    }

    public String triggerIngest() {
        return submit(JobType.INGEST, "all", () -> {
            IngestResult result = orchestrator.ingest();
            return new Outcome(result.isStarted() && result.getAdded() > 0, result.toString());
        });
    }

    public String triggerProcessOne(long recordId) {
        return submit(JobType.PROCESS_ONE, String.valueOf(recordId), () -> {
            boolean done = orchestrator.processOne(recordId);
            return new Outcome(done, done ? "Record analyzed" : "Record not analyzed, see pipeline log");
        });
    }

    public String triggerProcessPending(boolean includeErrors) {
        return submit(JobType.PROCESS_PENDING, includeErrors ? "errors" : "pending", () -> {
            BatchResult result = orchestrator.processPending(includeErrors);
            return new Outcome(result.getSucceeded() > 0, result.toString());
        });
    }

    public String triggerTagScan(List<Long> recordIds) {
        String target = recordIds.stream().map(String::valueOf).collect(Collectors.joining(","));
        return submit(JobType.TAG_SCAN, target, () -> {
            int applied = orchestrator.tagScan(recordIds);
            return new Outcome(applied > 0, applied + " new tag associations");
        });
    }

    public String triggerTagScanAll() {
        return submit(JobType.TAG_SCAN, "all", () -> {
            int applied = orchestrator.tagScanAll();
            return new Outcome(applied > 0, applied + " new tag associations");
        });
    }

    public Optional<JobStatus> getJobStatus(String jobId) {
        return store.findJob(jobId);
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private String submit(JobType type, String target, Supplier<Outcome> operation) {
        JobStatus job = new JobStatus(UUID.randomUUID().toString(), type, target);
        store.saveJob(job);
        executor.submit(() -> run(job, operation));
        return job.getJobId();
    }

    private void run(JobStatus job, Supplier<Outcome> operation) {
        PipelineLogger.logJobMarker(logDir, CONTEXT, "JOB " + job.getJobId() + " START id=" + job.getTarget());

        try {
            job.setState(JobState.RUNNING);
            store.saveJob(job);

            Outcome outcome = operation.get();
            job.setApplied(outcome.applied);
            job.setMessage(outcome.message);
            job.setState(JobState.COMPLETED);
        } catch (RuntimeException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Job " + job.getJobId() + " (" + job.getType() + ") failed", e);
            job.setApplied(false);
            job.setMessage(e.toString());
            job.setState(JobState.FAILED);
        }

        job.setFinishedAt(LocalDateTime.now());
        try {
            store.saveJob(job);
        } catch (RuntimeException e) {
            PipelineLogger.logError(logDir, CONTEXT, "Could not store final state of job " + job.getJobId(), e);
        }
        PipelineLogger.logJobMarker(logDir, CONTEXT, "JOB " + job.getJobId() + " COMPLETE id=" + job.getTarget()
                + " applied=" + job.isApplied());
    }

    private static class Outcome {
        private final boolean applied;
        private final String message;

        Outcome(boolean applied, String message) {
            this.applied = applied;
            this.message = message;
        }
    }
}
