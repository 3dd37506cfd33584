package com.chainindexer.api.dto;

import java.util.Map;

/**
 * One persisted processing error. {@code errorType} is the snake_case code, e.g. invalid_swap.
 */
public record ErrorResponse(
        String errorId,
        String errorType,
        String message,
        Integer logIndex,
        String contract,
        String transformerName,
        Map<String, String> context
) {
}
