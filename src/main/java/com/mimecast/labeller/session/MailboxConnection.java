package com.mimecast.labeller.session;

import java.util.List;

/**
 * Remote mailbox operations over one authenticated connection.
 *
 * <p>Not thread safe: one logical stream of operations at a time. Every call blocks with a
 * timeout; protocol and timeout failures surface as
 * {@link com.mimecast.labeller.error.TransientConnectionException}.
 */
public interface MailboxConnection {

    List<MailFolder> listFolders();

    /**
     * Selects the folder later calls operate on.
     *
     * @param name Folder name.
     */
    void selectFolder(String name);

    /**
     * Fetches up to {@code size} items after the cursor, oldest first.
     *
     * @param cursor Cursor from the previous page, or null to start at the beginning.
     * @param size   Maximum items.
     * @return MailPage instance.
     */
    MailPage fetchPage(String cursor, int size);

    /**
     * Adds or removes a label on one item.
     *
     * @param itemId Remote item id.
     * @param label  Label.
     * @param action Add or remove.
     */
    void mutateLabel(String itemId, String label, LabelAction action);

    /**
     * Read-only check of a label on one item.
     *
     * @param itemId Remote item id.
     * @param label  Label.
     * @return True if the item carries the label.
     */
    boolean hasLabel(String itemId, String label);

    /**
     * Cheap round trip proving the connection still works.
     */
    void probe();

    boolean isOpen();

    /**
     * Logs out and closes. Safe to call more than once.
     */
    void logout();
}
