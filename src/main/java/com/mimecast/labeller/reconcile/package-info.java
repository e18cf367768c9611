/**
 * Suggestion lifecycle, apply protocol and reconciliation.
 *
 * <p>Apply writes an unsynced audit entry, performs the remote mutation, then marks the
 * <br>suggestion applied and the entry synced together. Entries left unsynced are resolved by
 * <br>reading the remote state only.
 */
package com.mimecast.labeller.reconcile;
