package com.neohoods.bridge.model;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class FetchResult {
    private final List<AcrobitsMessage> sent;
    private final List<AcrobitsMessage> received;
    /** Token presented to the homeserver, empty for a full sync. */
    private final String previousPosition;
    private final String nextPosition;
    /** When the previous position was stored, null on a user's first sync. */
    private final Instant previousObservedAt;
}
