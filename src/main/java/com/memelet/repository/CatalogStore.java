package com.memelet.repository;

import com.memelet.model.AlbumItem;
import com.memelet.model.CatalogStats;
import com.memelet.model.JobStatus;
import com.memelet.model.MediaAnalysis;
import com.memelet.model.MediaRecord;
import com.memelet.model.MediaStatus;
import com.memelet.model.Tag;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent catalog shared by every pipeline component.
 * Implementations must be safe for concurrent use; all methods throw {@link DatabaseException} on storage failure.
 */
public interface CatalogStore {

    // --- Media records ---

    /**
     * Inserts a single-file record and assigns its id.
     */
    MediaRecord insertMedia(MediaRecord record);

    /**
     * Inserts an album record together with all its items in one transaction.
     * Item display orders are taken as given.
     */
    MediaRecord insertAlbum(MediaRecord album, List<AlbumItem> items);

    Optional<MediaRecord> findById(long id);

    Optional<MediaRecord> findByPath(String path);

    /**
     * Oldest record carrying the given content hash, if any.
     */
    Optional<MediaRecord> findFirstByHash(String contentHash);

    List<MediaRecord> findAll();

    /**
     * Records in any of the given states, oldest first.
     */
    List<MediaRecord> findByStatus(MediaStatus... statuses);

    /**
     * Every path owned by a record or an album item.
     */
    Set<String> getAllKnownPaths();

    List<AlbumItem> getAlbumItems(long albumId);

    void updateContentHash(long id, String contentHash);

    /**
     * Moves a record to a new path after relocation. The content hash is kept.
     */
    void updatePath(long id, String newPath);

    void updateAlbumItem(AlbumItem item);

    /**
     * Unconditionally sets status to ERROR with the given message. Descriptive fields are left untouched.
     */
    void markError(long id, String errorMessage);

    /**
     * Optimistic status change: applies only if the record is still in {@code expected}.
     *
     * @return true if the row was updated
     */
    boolean transitionStatus(long id, MediaStatus expected, MediaStatus target);

    /**
     * Stores a successful analysis and moves PROCESSING to DONE, clearing the error message.
     *
     * @return false if the record was no longer PROCESSING (nothing written)
     */
    boolean completeAnalysis(long id, MediaAnalysis analysis);

    /**
     * Moves PROCESSING to ERROR with a message. Descriptive fields are left untouched.
     *
     * @return false if the record was no longer PROCESSING
     */
    boolean failProcessing(long id, String errorMessage);

    CatalogStats countByStatus();

    // --- Tags ---

    Tag insertTag(Tag tag);

    List<Tag> findAllTags();

    List<Tag> findFilenameTags();

    List<Tag> findSuggestibleTags();

    List<Tag> getTagsForMedia(long mediaId);

    /**
     * Inserts the association if absent.
     *
     * @return true if a new association was created, false if it already existed
     */
    boolean addMemeTagIfAbsent(long mediaId, long tagId);

    // --- Frame workspaces ---

    /**
     * Reserves a workspace name exclusively.
     *
     * @return false if the name is already reserved
     */
    boolean reserveWorkspace(String name);

    void releaseWorkspace(String name);

    /**
     * Drops every reservation. Only valid before any analysis has started in this process.
     *
     * @return number of reservations dropped
     */
    int releaseAllWorkspaces();

    // --- Jobs ---

    void saveJob(JobStatus job);

    Optional<JobStatus> findJob(String jobId);
}
