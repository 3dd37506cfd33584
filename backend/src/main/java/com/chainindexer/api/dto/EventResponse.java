package com.chainindexer.api.dto;

import java.time.Instant;
import java.util.Map;

public record EventResponse(
        String eventId,
        String eventType,
        String txHash,
        long blockNumber,
        int logIndex,
        Instant timestamp,
        Map<String, Object> payload
) {
}
