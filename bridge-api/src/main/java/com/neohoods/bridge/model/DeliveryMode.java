package com.neohoods.bridge.model;

/**
 * How an outbound message ended up on the Matrix side.
 */
public enum DeliveryMode {
    TEXT,
    MEDIA,
    /** Media was requested but could not be transferred; the text body was sent instead. */
    TEXT_FALLBACK
}
