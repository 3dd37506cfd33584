package com.chainindexer.domain;

import java.time.Instant;

/**
 * Finalized business event derived from one or more signals.
 * {@link #logIndex()} is the originating log (first log for events aggregated over several logs).
 */
public interface DomainEvent extends ContentAddressable {

    EventType eventType();

    Instant timestamp();

    String txHash();

    int logIndex();
}
