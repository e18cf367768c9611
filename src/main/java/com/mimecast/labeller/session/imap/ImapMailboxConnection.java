package com.mimecast.labeller.session.imap;

import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.session.LabelAction;
import com.mimecast.labeller.session.MailFolder;
import com.mimecast.labeller.session.MailItem;
import com.mimecast.labeller.session.MailPage;
import com.mimecast.labeller.session.MailboxConnection;
import jakarta.mail.Address;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * IMAP mailbox connection.
 *
 * <p>Items are keyed by UID and pages are UID ranges: the cursor is the last UID of the
 * previous page. A page is read in bounded UID windows up to the highest UID in the folder. Labels are IMAP keywords (user flags).
 */
public class ImapMailboxConnection implements MailboxConnection {
    private static final Logger log = LogManager.getLogger(ImapMailboxConnection.class);

    private static final long MAX_UID_WINDOW = 10_000;

    private final Store store;
    private Folder folder;

    public ImapMailboxConnection(Store store) {
        this.store = store;
    }

    @Override
    public List<MailFolder> listFolders() {
        try {
            List<MailFolder> folders = new ArrayList<>();
            for (Folder f : store.getDefaultFolder().list("*")) {
                if ((f.getType() & Folder.HOLDS_MESSAGES) != 0) {
                    folders.add(new MailFolder(f.getFullName(), f.getMessageCount()));
                }
            }
            return folders;
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP LIST failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void selectFolder(String name) {
        try {
            if (folder != null && folder.isOpen()) {
                if (folder.getFullName().equals(name)) {
                    return;
                }
                folder.close(false);
            }
            Folder candidate = store.getFolder(name);
            if (!candidate.exists()) {
                throw new ValidationException("Folder '" + name + "' does not exist");
            }
            candidate.open(Folder.READ_WRITE);
            folder = candidate;
            log.debug("Selected folder {} ({} messages)", name, folder.getMessageCount());
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP SELECT " + name + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public MailPage fetchPage(String cursor, int size) {
        UIDFolder uidFolder = uidFolder();
        long from = cursor == null ? 1 : parseUid(cursor) + 1;
        try {
            long last = highestUid(uidFolder);
            List<Message> page = new ArrayList<>();
            long low = from;
            long window = Math.max(size, 1);
            while (low <= last && page.size() < size) {
                long high = Math.min(last, low + window - 1);
                List<Message> found = new ArrayList<>();
                for (Message message : uidFolder.getMessagesByUID(low, high)) {
                    if (message != null) {
                        found.add(message);
                    }
                }
                found.sort(Comparator.comparingLong(m -> uid(uidFolder, m)));
                page.addAll(found.subList(0, Math.min(size - page.size(), found.size())));

                low = high + 1;
                // Expunged ranges widen the next window.
                window = Math.min(window * 2, MAX_UID_WINDOW);
            }
            if (page.isEmpty()) {
                return MailPage.empty(cursor);
            }

            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(page.toArray(new Message[0]), profile);

            List<MailItem> items = new ArrayList<>();
            for (Message message : page) {
                items.add(toItem(uidFolder.getUID(message), message));
            }
            String next = String.valueOf(uidFolder.getUID(page.get(page.size() - 1)));
            log.debug("Fetched {} items after UID {}", items.size(), from - 1);
            return new MailPage(items, next);
        } catch (MessagingException | IOException e) {
            throw new TransientConnectionException("IMAP fetch failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void mutateLabel(String itemId, String label, LabelAction action) {
        try {
            Message message = message(itemId);
            message.setFlags(new Flags(label), action == LabelAction.ADD);
            log.debug("{} keyword {} on UID {}", action, label, itemId);
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP STORE on UID " + itemId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasLabel(String itemId, String label) {
        try {
            return message(itemId).getFlags().contains(label);
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP FETCH FLAGS on UID " + itemId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void probe() {
        if (!store.isConnected()) {
            throw new TransientConnectionException("IMAP store is not connected");
        }
        try {
            if (folder != null && folder.isOpen()) {
                // Open folder message count issues a NOOP.
                folder.getMessageCount();
            } else {
                store.getFolder("INBOX").exists();
            }
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP probe failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return store.isConnected();
    }

    @Override
    public void logout() {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
            if (store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP LOGOUT failed: " + e.getMessage(), e);
        }
    }

    private UIDFolder uidFolder() {
        if (folder == null || !folder.isOpen()) {
            throw new ValidationException("No folder selected");
        }
        return (UIDFolder) folder;
    }

    private long highestUid(UIDFolder uidFolder) throws MessagingException {
        int count = folder.getMessageCount();
        return count > 0 ? uidFolder.getUID(folder.getMessage(count)) : 0;
    }

    private Message message(String itemId) throws MessagingException {
        Message message = uidFolder().getMessageByUID(parseUid(itemId));
        if (message == null) {
            throw new ValidationException("No item with UID " + itemId + " in " + folder.getFullName());
        }
        return message;
    }

    private static long parseUid(String itemId) {
        try {
            return Long.parseLong(itemId);
        } catch (NumberFormatException e) {
            throw new ValidationException("Malformed item id: " + itemId, e);
        }
    }

    private static long uid(UIDFolder uidFolder, Message message) {
        try {
            return uidFolder.getUID(message);
        } catch (MessagingException e) {
            throw new TransientConnectionException("IMAP UID lookup failed: " + e.getMessage(), e);
        }
    }

    private static MailItem toItem(long uid, Message message) throws MessagingException, IOException {
        Address[] from = message.getFrom();
        String sender = from != null && from.length > 0 ? from[0].toString() : "";
        return new MailItem(
                String.valueOf(uid),
                message.getSubject(),
                sender,
                textOf(message),
                message.getReceivedDate() != null
                        ? message.getReceivedDate().toInstant().atOffset(ZoneOffset.UTC)
                        : null);
    }

    private static String textOf(Part part) throws MessagingException, IOException {
        if (part.isMimeType("text/plain")) {
            Object content = part.getContent();
            return content instanceof String ? (String) content : "";
        }
        if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                String text = textOf(multipart.getBodyPart(i));
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return "";
    }

    @Override
    public String toString() {
        return "ImapMailboxConnection{folder=" + (folder != null ? folder.getFullName() : "none") + "}";
    }
}
