package com.memelet.service;

/**
 * Outcome counts of one identity-verification pass.
 */
public class VerificationSummary {
    private int ok;
    private int hashed;
    private int relocated;
    private int errored;

    void incrementOk() { ok++; }
    void incrementHashed() { hashed++; }
    void incrementRelocated() { relocated++; }
    void incrementErrored() { errored++; }

    public int getOk() { return ok; }
    public int getHashed() { return hashed; }
    public int getRelocated() { return relocated; }
    public int getErrored() { return errored; }

    @Override
    public String toString() {
        return "ok=" + ok + ", hashed=" + hashed + ", relocated=" + relocated + ", errored=" + errored;
    }
}
