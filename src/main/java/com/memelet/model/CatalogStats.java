package com.memelet.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Record counts per status.
 */
public class CatalogStats {
    private final Map<MediaStatus, Integer> countsByStatus;

    public CatalogStats(Map<MediaStatus, Integer> countsByStatus) {
        this.countsByStatus = new EnumMap<>(MediaStatus.class);
        for (MediaStatus status : MediaStatus.values()) {
            this.countsByStatus.put(status, countsByStatus.getOrDefault(status, 0));
        }
    }

    public int getCount(MediaStatus status) {
        return countsByStatus.get(status);
    }

    public int getTotal() {
        return countsByStatus.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<MediaStatus, Integer> asMap() {
        return Collections.unmodifiableMap(countsByStatus);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Total: ").append(getTotal());
        countsByStatus.forEach((status, count) -> sb.append(", ").append(status.getDbValue()).append(": ").append(count));
        return sb.toString();
    }
}
