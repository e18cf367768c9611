package com.mimecast.labeller.session;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One fetched remote message, reduced to what classification needs.
 */
public final class MailItem {

    private final String id;
    private final String subject;
    private final String from;
    private final String text;
    private final OffsetDateTime receivedAt;

    public MailItem(String id, String subject, String from, String text, OffsetDateTime receivedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.subject = subject != null ? subject : "";
        this.from = from != null ? from : "";
        this.text = text != null ? text : "";
        this.receivedAt = receivedAt;
    }

    /**
     * Gets the stable remote item id (the IMAP UID).
     *
     * @return Item id.
     */
    public String getId() {
        return id;
    }

    public String getSubject() {
        return subject;
    }

    public String getFrom() {
        return from;
    }

    public String getText() {
        return text;
    }

    public OffsetDateTime getReceivedAt() {
        return receivedAt;
    }

    @Override
    public String toString() {
        return "MailItem{id=" + id + "}";
    }
}
