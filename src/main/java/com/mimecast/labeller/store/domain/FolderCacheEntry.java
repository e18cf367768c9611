package com.mimecast.labeller.store.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Cached remote folder metadata, stored in {@code folder_cache}.
 */
public class FolderCacheEntry {

    private final String principal;
    private final String folderName;
    private final int messageCount;
    private final OffsetDateTime cachedAt;

    public FolderCacheEntry(String principal, String folderName, int messageCount, OffsetDateTime cachedAt) {
        this.principal = principal;
        this.folderName = folderName;
        this.messageCount = messageCount;
        this.cachedAt = cachedAt;
    }

    public String getPrincipal() {
        return principal;
    }

    public String getFolderName() {
        return folderName;
    }

    public int getMessageCount() {
        return messageCount;
    }

    public OffsetDateTime getCachedAt() {
        return cachedAt;
    }

    /**
     * Checks staleness against a TTL.
     *
     * @param now Current time.
     * @param ttl Time to live.
     * @return True when older than the TTL.
     */
    public boolean isExpired(OffsetDateTime now, Duration ttl) {
        return !cachedAt.plus(ttl).isAfter(now);
    }
}
