package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One row per transformed block: how many transactions were reconciled and how many events and errors came out.
 * Rewritten on every replay of the block.
 */
@Document(collection = "block_summaries")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BlockTransformSummaryRecord {

    @Id
    @EqualsAndHashCode.Include
    private Long blockNumber;
    private int transactions;
    private int processedTransactions;
    private int skippedTransactions;
    private int erroredTransactions;
    private int events;
    private int positions;
    private int errors;
    private Instant completedAt;
}
