package com.mimecast.labeller.session;

import java.util.Collections;
import java.util.List;

/**
 * One page of fetched items and the cursor that follows it.
 */
public final class MailPage {

    private final List<MailItem> items;
    private final String nextCursor;

    public MailPage(List<MailItem> items, String nextCursor) {
        this.items = Collections.unmodifiableList(items);
        this.nextCursor = nextCursor;
    }

    public static MailPage empty(String cursor) {
        return new MailPage(Collections.emptyList(), cursor);
    }

    public List<MailItem> getItems() {
        return items;
    }

    /**
     * Gets the cursor to resume after this page.
     *
     * @return Cursor, unchanged from the request when the page is empty.
     */
    public String getNextCursor() {
        return nextCursor;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }
}
