package com.memelet.service;

import com.memelet.model.MediaRecord;
import com.memelet.model.Tag;
import com.memelet.repository.CatalogStore;
import com.memelet.util.PipelineConfig;
import com.memelet.util.PipelineLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links records to vocabulary tags. Never creates tags and never removes associations;
 * applying the same tags twice is a no-op.
 */
public class TagReconciler {

    private static final String CONTEXT = "TagReconciler";

    private final CatalogStore store;
    private final Path mediaRoot;
    private final Path logDir;

    public TagReconciler(CatalogStore store, PipelineConfig config) {
        this.store = store;
        this.mediaRoot = config.getMediaRootPath();
        this.logDir = config.getLogDir();
    }

    /**
     * Applies every filename-matchable tag whose name occurs in the record's name or folder path.
     *
     * @return number of associations created
     */
    public int applyPathTags(MediaRecord record) {
        return applyPathTags(record, store.findFilenameTags());
    }

    public int applyPathTagsToAll() {
        List<Tag> tags = store.findFilenameTags();
        if (tags.isEmpty()) {
            return 0;
        }
        int applied = 0;
        for (MediaRecord record : store.findAll()) {
            applied += applyPathTags(record, tags);
        }
        PipelineLogger.logInfo(logDir, CONTEXT, "Path tags applied to all records: " + applied + " new associations");
        return applied;
    }

    private int applyPathTags(MediaRecord record, List<Tag> tags) {
        String haystack = pathHaystack(record);
        int applied = 0;
        for (Tag tag : tags) {
            if (haystack.contains(tag.getName().toLowerCase())) {
                if (store.addMemeTagIfAbsent(record.getId(), tag.getId())) {
                    applied++;
                }
            }
        }
        return applied;
    }

    /**
     * Applies the suggested names that match an AI-suggestible tag, case-insensitively.
     * Unknown names are logged and reported, never created.
     */
    public TagSuggestionResult applySuggestedTags(MediaRecord record, List<String> suggestedNames) {
        Map<String, Tag> suggestible = new HashMap<>();
        for (Tag tag : store.findSuggestibleTags()) {
            suggestible.put(tag.getName().toLowerCase(), tag);
        }

        int applied = 0;
        List<String> unknown = new ArrayList<>();
        for (String name : suggestedNames) {
            Tag tag = suggestible.get(name.trim().toLowerCase());
            if (tag == null) {
                unknown.add(name);
                PipelineLogger.logWarning(logDir, CONTEXT, "Record #" + record.getId() + ": model suggested unknown tag '" + name + "'");
                continue;
            }
            if (store.addMemeTagIfAbsent(record.getId(), tag.getId())) {
                applied++;
            }
        }
        return new TagSuggestionResult(applied, unknown);
    }

    // Display name plus the containing folder relative to the media root, lowercased
    String pathHaystack(MediaRecord record) {
        StringBuilder haystack = new StringBuilder(record.getDisplayName());
        Path parent = record.toPath().getParent();
        if (parent != null) {
            Path normalized = parent.toAbsolutePath().normalize();
            String folder = normalized.startsWith(mediaRoot) ? mediaRoot.relativize(normalized).toString() : normalized.toString();
            haystack.append(' ').append(folder);
        }
        return haystack.toString().toLowerCase();
    }
}
