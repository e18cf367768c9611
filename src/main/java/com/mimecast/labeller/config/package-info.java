/**
 * Configuration.
 *
 * <p>A single JSON5 file parsed into an immutable map.
 * <br>{@link com.mimecast.labeller.config.LabellerConfig} hands out one typed view per concern.
 *
 * <pre>
 *      {
 *        mailbox: { host: "imap.gmail.com", port: 993, authMode: "password", folder: "INBOX" },
 *        session: { maxSessions: 5, maxConnectRetries: 5 },
 *        quota: { scopes: { mailbox: { permits: 60, windowSeconds: 60 } } },
 *        store: { jdbcUrl: "jdbc:h2:file:./data/labeller;MODE=PostgreSQL" },
 *        batch: { pageSize: 100, minConfidence: 0.5 },
 *        classifier: { endpoint: "http://localhost:8088/classify", labels: ["Finance", "Travel"] },
 *        vault: { enabled: false }
 *      }
 * </pre>
 */
package com.mimecast.labeller.config;
