package com.chainindexer.query;

import com.chainindexer.domain.EventType;

import java.time.Instant;
import java.util.Map;

public record EventView(
        String eventId,
        EventType eventType,
        String txHash,
        long blockNumber,
        int logIndex,
        Instant timestamp,
        Map<String, Object> payload
) {
}
