package com.chainindexer.api.dto;

import java.util.List;

public record TransactionErrorsResponse(String txHash, List<ErrorResponse> errors) {
}
