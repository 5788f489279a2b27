package com.memelet.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized result of one AI analysis. Descriptive fields are null when the model omitted them.
 */
public class MediaAnalysis {
    private final String references;
    private final String template;
    private final String caption;
    private final String description;
    private final String meaning;
    private final List<String> tags;

    public MediaAnalysis(String references, String template, String caption,
                         String description, String meaning, List<String> tags) {
        this.references = references;
        this.template = template;
        this.caption = caption;
        this.description = description;
        this.meaning = meaning;
        this.tags = tags != null ? Collections.unmodifiableList(new ArrayList<>(tags)) : List.of();
    }

    public String getReferences() { return references; }
    public String getTemplate() { return template; }
    public String getCaption() { return caption; }
    public String getDescription() { return description; }
    public String getMeaning() { return meaning; }
    public List<String> getTags() { return tags; }

    /**
     * Tag names in storable form, one per line, or null when there are none.
     */
    public String getTagsAsText() {
        return tags.isEmpty() ? null : String.join("\n", tags);
    }
}
