package com.memelet.model;

/**
 * Processing state of a record.
 * Allowed transitions: NEW -> PROCESSING -> DONE | ERROR, and ERROR -> PROCESSING for retries.
 */
public enum MediaStatus {
    NEW("new"),
    PROCESSING("processing"),
    DONE("done"),
    ERROR("error");

    private final String dbValue;

    MediaStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    /**
     * Whether a record in this state may be moved to PROCESSING.
     */
    public boolean canStartProcessing() {
        return this == NEW || this == ERROR;
    }

    public static MediaStatus fromDbValue(String value) {
        for (MediaStatus status : values()) {
            if (status.dbValue.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status: " + value);
    }
}
