package com.mimecast.labeller.session;

/**
 * Receives session state changes. Called outside the session lock.
 */
@FunctionalInterface
public interface SessionListener {

    void onStateChange(MailboxSession session, SessionState previous, SessionState current);
}
