package com.mimecast.labeller.store;

import com.mimecast.labeller.session.MailFolder;
import com.mimecast.labeller.session.MailboxConnection;
import com.mimecast.labeller.store.domain.FolderCacheEntry;
import com.mimecast.labeller.util.Principals;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote folder list cached in the local store.
 *
 * <p>Every read checks the age of the cached rows; a stale or empty cache is refreshed from
 * the remote and replaced in one transaction.
 */
public class FolderCache {
    private static final Logger log = LogManager.getLogger(FolderCache.class);

    private final StateStore store;
    private final Duration ttl;

    public FolderCache(StateStore store, Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    /**
     * Gets folders, from cache when fresh.
     *
     * @param principal  Principal owning the mailbox.
     * @param connection Connection used on a miss.
     * @return List of MailFolder.
     */
    public List<MailFolder> getFolders(String principal, MailboxConnection connection) {
        OffsetDateTime now = OffsetDateTime.now(store.getClock());
        List<FolderCacheEntry> cached = store.findFolders(principal);
        if (!cached.isEmpty() && cached.stream().noneMatch(e -> e.isExpired(now, ttl))) {
            log.debug("Folder cache hit for {}", Principals.hash(principal));
            return toFolders(cached);
        }

        List<MailFolder> remote = connection.listFolders();
        List<FolderCacheEntry> entries = new ArrayList<>();
        for (MailFolder folder : remote) {
            entries.add(new FolderCacheEntry(principal, folder.getName(), folder.getMessageCount(), now));
        }
        store.cacheFolders(principal, entries);
        log.debug("Folder cache refreshed for {} with {} folders", Principals.hash(principal), entries.size());
        return remote;
    }

    /**
     * Drops the cached list so the next read goes remote.
     *
     * @param principal Principal.
     */
    public void invalidate(String principal) {
        store.cacheFolders(principal, List.of());
    }

    private static List<MailFolder> toFolders(List<FolderCacheEntry> entries) {
        List<MailFolder> folders = new ArrayList<>();
        for (FolderCacheEntry entry : entries) {
            folders.add(new MailFolder(entry.getFolderName(), entry.getMessageCount()));
        }
        return folders;
    }
}
