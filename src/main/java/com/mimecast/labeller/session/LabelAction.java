package com.mimecast.labeller.session;

/**
 * Label mutation direction.
 */
public enum LabelAction {
    ADD,
    REMOVE
}
