package com.memelet.model;

/**
 * Kind of media unit held by a {@link MediaRecord}.
 * Frame extraction and prompt construction switch over this exhaustively.
 */
public enum MediaType {
    IMAGE("image"),
    GIF("gif"),
    VIDEO("video"),
    ALBUM("album");

    private final String dbValue;

    MediaType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public static MediaType fromDbValue(String value) {
        for (MediaType type : values()) {
            if (type.dbValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown media type: " + value);
    }
}
