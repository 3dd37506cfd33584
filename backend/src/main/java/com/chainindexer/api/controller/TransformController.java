package com.chainindexer.api.controller;

import com.chainindexer.api.dto.BlockSummaryResponse;
import com.chainindexer.api.dto.ErrorBody;
import com.chainindexer.api.dto.ErrorResponse;
import com.chainindexer.api.dto.EventResponse;
import com.chainindexer.api.dto.TransactionErrorsResponse;
import com.chainindexer.api.dto.TransactionEventsResponse;
import com.chainindexer.api.validation.TxHash;
import com.chainindexer.query.TransformQueryService;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only lookup of transform output by transaction hash and block number.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TransformController {

    public static final String BLOCK_NOT_FOUND = "BLOCK_NOT_FOUND";

    private final TransformQueryService transformQueryService;

    @GetMapping("/transactions/{txHash}/events")
    public ResponseEntity<TransactionEventsResponse> getEvents(@PathVariable @TxHash String txHash) {
        return ResponseEntity.ok(new TransactionEventsResponse(
                txHash.toLowerCase(),
                transformQueryService.findEvents(txHash).stream()
                        .map(e -> new EventResponse(
                                e.eventId(),
                                e.eventType().name().toLowerCase(),
                                e.txHash(),
                                e.blockNumber(),
                                e.logIndex(),
                                e.timestamp(),
                                e.payload()
                        ))
                        .toList()
        ));
    }

    @GetMapping("/transactions/{txHash}/errors")
    public ResponseEntity<TransactionErrorsResponse> getErrors(@PathVariable @TxHash String txHash) {
        return ResponseEntity.ok(new TransactionErrorsResponse(
                txHash.toLowerCase(),
                transformQueryService.findErrors(txHash).stream()
                        .map(e -> new ErrorResponse(
                                e.errorId(),
                                e.errorType().code(),
                                e.message(),
                                e.logIndex(),
                                e.contract(),
                                e.transformerName(),
                                e.context()
                        ))
                        .toList()
        ));
    }

    @GetMapping("/blocks/{blockNumber}/summary")
    public ResponseEntity<?> getBlockSummary(@PathVariable @PositiveOrZero long blockNumber) {
        return transformQueryService.findBlockSummary(blockNumber)
                .<ResponseEntity<?>>map(s -> ResponseEntity.ok(new BlockSummaryResponse(
                        s.blockNumber(),
                        s.transactions(),
                        s.processedTransactions(),
                        s.skippedTransactions(),
                        s.erroredTransactions(),
                        s.events(),
                        s.positions(),
                        s.errors(),
                        s.completedAt()
                )))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorBody.of(BLOCK_NOT_FOUND, "No transform summary for block " + blockNumber)));
    }
}
