package com.neohoods.bridge.model.push;

public enum PushDeliveryStatus {
    DELIVERED,
    /** The push service no longer knows the device token. */
    TOKEN_INVALID,
    FAILED
}
