package com.memelet.model;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A catalog entry for one media unit: a single file, or an album folder.
 * This is a lightweight POJO used to transfer data between layers.
 */
public class MediaRecord {
    private long id;
    private String path; // Absolute path; a directory for albums
    private MediaType mediaType;
    private MediaStatus status;
    private String contentHash; // SHA-256, null until computed (always null for albums)
    private long size;
    private String title;
    private String references;
    private String template;
    private String caption;
    private String description;
    private String meaning;
    private String suggestedTags;
    private String errorMessage;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private List<AlbumItem> albumItems = new ArrayList<>();

    public MediaRecord(String path, MediaType mediaType, MediaStatus status, String contentHash, long size) {
        this.path = path;
        this.mediaType = mediaType;
        this.status = status;
        this.contentHash = contentHash;
        this.size = size;
    }

    public long getId() { return id; }
    public String getPath() { return path; }
    public MediaType getMediaType() { return mediaType; }
    public MediaStatus getStatus() { return status; }
    public String getContentHash() { return contentHash; }
    public long getSize() { return size; }
    public String getTitle() { return title; }
    public String getReferences() { return references; }
    public String getTemplate() { return template; }
    public String getCaption() { return caption; }
    public String getDescription() { return description; }
    public String getMeaning() { return meaning; }
    public String getSuggestedTags() { return suggestedTags; }
    public String getErrorMessage() { return errorMessage; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public void setId(long id) { this.id = id; }
    public void setPath(String path) { this.path = path; }
    public void setStatus(MediaStatus status) { this.status = status; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }
    public void setSize(long size) { this.size = size; }
    public void setTitle(String title) { this.title = title; }
    public void setReferences(String references) { this.references = references; }
    public void setTemplate(String template) { this.template = template; }
    public void setCaption(String caption) { this.caption = caption; }
    public void setDescription(String description) { this.description = description; }
    public void setMeaning(String meaning) { this.meaning = meaning; }
    public void setSuggestedTags(String suggestedTags) { this.suggestedTags = suggestedTags; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public List<AlbumItem> getAlbumItems() {
        return albumItems;
    }

    public void setAlbumItems(List<AlbumItem> albumItems) {
        this.albumItems = albumItems;
    }

    public boolean isAlbum() {
        return mediaType == MediaType.ALBUM;
    }

    public Path toPath() {
        return Paths.get(path);
    }

    /**
     * File name for single items, folder name for albums.
     */
    public String getDisplayName() {
        if (isAlbum() && title != null) {
            return title;
        }
        Path fileName = toPath().getFileName();
        return fileName != null ? fileName.toString() : path;
    }

    @Override
    public String toString() {
        return "MediaRecord{" +
                "id=" + id +
                ", path='" + path + '\'' +
                ", type=" + mediaType +
                ", status=" + status +
                '}';
    }
}
