package com.memelet.model;

import java.time.LocalDateTime;

/**
 * State of an asynchronously triggered pipeline operation, pollable by job id.
 */
public class JobStatus {

    public enum JobType {
        INGEST, PROCESS_ONE, PROCESS_PENDING, TAG_SCAN
    }

    public enum JobState {
        PENDING, RUNNING, COMPLETED, FAILED;

        public boolean isFinished() {
            return this == COMPLETED || this == FAILED;
        }
    }

    private final String jobId;
    private final JobType type;
    private final String target;
    private JobState state;
    private boolean applied;
    private String message;
    private final LocalDateTime createdAt;
    private LocalDateTime finishedAt;

    public JobStatus(String jobId, JobType type, String target, JobState state, boolean applied,
                     String message, LocalDateTime createdAt, LocalDateTime finishedAt) {
        this.jobId = jobId;
        this.type = type;
        this.target = target;
        this.state = state;
        this.applied = applied;
        this.message = message;
        this.createdAt = createdAt;
        this.finishedAt = finishedAt;
    }

    public JobStatus(String jobId, JobType type, String target) {
        this(jobId, type, target, JobState.PENDING, false, null, LocalDateTime.now(), null);
    }

    public String getJobId() { return jobId; }
    public JobType getType() { return type; }
    public String getTarget() { return target; }
    public JobState getState() { return state; }
    public boolean isApplied() { return applied; }
    public String getMessage() { return message; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getFinishedAt() { return finishedAt; }

    public void setState(JobState state) { this.state = state; }
    public void setApplied(boolean applied) { this.applied = applied; }
    public void setMessage(String message) { this.message = message; }
    public void setFinishedAt(LocalDateTime finishedAt) { this.finishedAt = finishedAt; }
}
