package com.chainindexer.query;

import com.chainindexer.domain.ErrorType;

import java.util.Map;

public record ErrorView(
        String errorId,
        ErrorType errorType,
        String message,
        String txHash,
        Integer logIndex,
        String contract,
        String transformerName,
        Map<String, String> context
) {
}
