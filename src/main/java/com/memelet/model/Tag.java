package com.memelet.model;

/**
 * A vocabulary entry. The pipeline only reads tags; creating them is an operator concern.
 */
public class Tag {
    private long id;
    private String name;        // Matched case-insensitively
    private String description; // Shown to the model next to the name
    private String color;
    private boolean parseFromFilename; // Eligible for path substring matching
    private boolean aiCanSuggest;      // Eligible for mapping AI suggestions

    public Tag(long id, String name, String description, String color, boolean parseFromFilename, boolean aiCanSuggest) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.color = color;
        this.parseFromFilename = parseFromFilename;
        this.aiCanSuggest = aiCanSuggest;
    }

    public Tag(String name, String description, boolean parseFromFilename, boolean aiCanSuggest) {
        this(0, name, description, null, parseFromFilename, aiCanSuggest);
    }

    public long getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getColor() { return color; }
    public boolean isParseFromFilename() { return parseFromFilename; }
    public boolean isAiCanSuggest() { return aiCanSuggest; }

    public void setId(long id) { this.id = id; }

    public void setColor(String color) {
        this.color = color;
    }

    @Override
    public String toString() {
        return "Tag{" + "id=" + id + ", name='" + name + '\'' + '}';
    }
}
