package com.memelet.service;

import java.util.List;

/**
 * Outcome of mapping AI-suggested names onto the tag vocabulary.
 */
public class TagSuggestionResult {
    private final int applied;
    private final List<String> unknown;

    public TagSuggestionResult(int applied, List<String> unknown) {
        this.applied = applied;
        this.unknown = List.copyOf(unknown);
    }

    /** Associations newly created by this call. */
    public int getApplied() { return applied; }

    /** Suggested names with no matching suggestible tag. */
    public List<String> getUnknown() { return unknown; }
}
