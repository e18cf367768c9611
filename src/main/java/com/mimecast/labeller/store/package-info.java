/**
 * Local state store.
 *
 * <p>JDBC repositories behind the {@link com.mimecast.labeller.store.StateStore} facade.
 * <br>Multi-table writes (page commits, apply bookkeeping, reconciliation) run in one transaction.
 */
package com.mimecast.labeller.store;
