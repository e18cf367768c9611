/**
 * Connection session manager.
 *
 * <p>Owns every live mailbox session: authentication with retry, per-principal session caps
 * <br>with least recently used eviction, keepalive probes, reconnection and stale sweeps.
 *
 * <p>Session states:
 * <pre>
 *      CONNECTING -&gt; CONNECTED | ERROR | DISCONNECTED
 *      CONNECTED  -&gt; DISCONNECTED | ERROR
 *      ERROR      -&gt; CONNECTING | DISCONNECTED
 *      DISCONNECTED -&gt; CONNECTING
 * </pre>
 *
 * <p>Transports are pluggable through {@link com.mimecast.labeller.session.MailboxTransport};
 * <br>the IMAP ones live in the imap sub package.
 */
package com.mimecast.labeller.session;
