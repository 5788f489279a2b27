package com.memelet.service;

/**
 * Outcome of one ingest pass: verification, scan, path tagging and video artifact repair.
 */
public class IngestResult {
    private final boolean started;
    private final VerificationSummary verification;
    private final int added;
    private final int tagsApplied;
    private final int artifactsRepaired;

    public IngestResult(VerificationSummary verification, int added, int tagsApplied) {
        this(verification, added, tagsApplied, 0);
    }

    public IngestResult(VerificationSummary verification, int added, int tagsApplied, int artifactsRepaired) {
        this(true, verification, added, tagsApplied, artifactsRepaired);
    }

    private IngestResult(boolean started, VerificationSummary verification, int added, int tagsApplied, int artifactsRepaired) {
        this.started = started;
        this.verification = verification;
        this.added = added;
        this.tagsApplied = tagsApplied;
        this.artifactsRepaired = artifactsRepaired;
    }

    /** Result of an ingest that did not run (another batch was active, or the media root is missing). */
    public static IngestResult notStarted() {
        return new IngestResult(false, new VerificationSummary(), 0, 0, 0);
    }

    public boolean isStarted() { return started; }
    public VerificationSummary getVerification() { return verification; }
    public int getAdded() { return added; }
    public int getTagsApplied() { return tagsApplied; }
    public int getArtifactsRepaired() { return artifactsRepaired; }

    @Override
    public String toString() {
        if (!started) {
            return "Ingest not started";
        }
        return "Verification: " + verification + "; added: " + added + "; path tags applied: " + tagsApplied
                + "; video artifacts repaired: " + artifactsRepaired;
    }
}
