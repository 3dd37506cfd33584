package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Persisted ProcessingError, keyed by its content-addressed error id. Queryable by tx hash for triage.
 */
@Document(collection = "processing_errors")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProcessingErrorRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String txHash;
    private long blockNumber;
    private String stage;
    private ErrorType errorType;
    private String message;
    private Integer logIndex;
    private String contract;
    private String transformerName;
    private Map<String, String> context = new HashMap<>();
    private Instant storedAt;
}
