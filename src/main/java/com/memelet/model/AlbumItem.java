package com.memelet.model;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * One ordered image inside an album. Display order is 1-based and dense within its album.
 */
public class AlbumItem {
    private long id;
    private long albumId;
    private String path;
    private int displayOrder;
    private String contentHash;
    private long size;

    public AlbumItem(long id, long albumId, String path, int displayOrder, String contentHash, long size) {
        this.id = id;
        this.albumId = albumId;
        this.path = path;
        this.displayOrder = displayOrder;
        this.contentHash = contentHash;
        this.size = size;
    }

    public AlbumItem(String path, int displayOrder, String contentHash, long size) {
        this(0, 0, path, displayOrder, contentHash, size);
    }

    public long getId() { return id; }
    public long getAlbumId() { return albumId; }
    public String getPath() { return path; }
    public int getDisplayOrder() { return displayOrder; }
    public String getContentHash() { return contentHash; }
    public long getSize() { return size; }

    public void setId(long id) { this.id = id; }
    public void setAlbumId(long albumId) { this.albumId = albumId; }
    public void setPath(String path) { this.path = path; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }
    public void setSize(long size) { this.size = size; }

    public Path toPath() {
        return Paths.get(path);
    }
}
