package com.chainindexer.api.dto;

import java.util.List;

public record TransactionEventsResponse(String txHash, List<EventResponse> events) {
}
