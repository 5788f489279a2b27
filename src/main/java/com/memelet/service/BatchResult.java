package com.memelet.service;

/**
 * Per-record outcome counts of a processing batch.
 */
public class BatchResult {
    private final boolean started;
    private int succeeded;
    private int failed;
    private int skipped;

    public BatchResult() {
        this(true);
    }

    private BatchResult(boolean started) {
        this.started = started;
    }

    /** Result of a batch refused because another batch was running. */
    public static BatchResult notStarted() {
        return new BatchResult(false);
    }

    void record(ProcessOutcome outcome) {
        switch (outcome) {
            case DONE:
                succeeded++;
                break;
            case FAILED:
                failed++;
                break;
            default:
                skipped++;
        }
    }

    public boolean isStarted() { return started; }
    public int getSucceeded() { return succeeded; }
    public int getFailed() { return failed; }
    public int getSkipped() { return skipped; }

    public int getTotal() {
        return succeeded + failed + skipped;
    }

    @Override
    public String toString() {
        if (!started) {
            return "Batch not started";
        }
        return "succeeded=" + succeeded + ", failed=" + failed + ", skipped=" + skipped;
    }
}
