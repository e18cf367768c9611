package com.mimecast.labeller.batch;

import com.mimecast.labeller.session.LabelAction;
import com.mimecast.labeller.session.MailFolder;
import com.mimecast.labeller.session.MailItem;
import com.mimecast.labeller.session.MailPage;
import com.mimecast.labeller.session.MailboxConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntConsumer;

/**
 * In-memory folder of numbered items, paged by offset cursors.
 */
class FakeMailbox implements MailboxConnection {

    private final int size;
    private final List<String> fetchCursors = new CopyOnWriteArrayList<>();
    private final Set<String> labelled = Collections.synchronizedSet(new HashSet<>());
    private IntConsumer onFetch = n -> { };
    private String selected;

    FakeMailbox(int size) {
        this.size = size;
    }

    /**
     * Runs before each fetch with the one based fetch number.
     */
    FakeMailbox onFetch(IntConsumer hook) {
        this.onFetch = hook;
        return this;
    }

    List<String> getFetchCursors() {
        return fetchCursors;
    }

    Set<String> getLabelled() {
        return labelled;
    }

    String getSelected() {
        return selected;
    }

    @Override
    public List<MailFolder> listFolders() {
        return List.of(new MailFolder("INBOX", size));
    }

    @Override
    public void selectFolder(String name) {
        selected = name;
    }

    @Override
    public MailPage fetchPage(String cursor, int pageSize) {
        fetchCursors.add(String.valueOf(cursor));
        onFetch.accept(fetchCursors.size());

        int start = cursor == null ? 0 : Integer.parseInt(cursor);
        int end = Math.min(start + pageSize, size);
        if (start >= end) {
            return MailPage.empty(cursor);
        }
        List<MailItem> items = new ArrayList<>();
        for (int i = start + 1; i <= end; i++) {
            items.add(new MailItem(String.valueOf(i), "Message " + i, "sender@example.com", "Body " + i, null));
        }
        return new MailPage(items, String.valueOf(end));
    }

    @Override
    public void mutateLabel(String itemId, String label, LabelAction action) {
        if (action == LabelAction.ADD) {
            labelled.add(itemId + ":" + label);
        } else {
            labelled.remove(itemId + ":" + label);
        }
    }

    @Override
    public boolean hasLabel(String itemId, String label) {
        return labelled.contains(itemId + ":" + label);
    }

    @Override
    public void probe() {
        // Always answers.
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void logout() {
        // Nothing to close.
    }
}
