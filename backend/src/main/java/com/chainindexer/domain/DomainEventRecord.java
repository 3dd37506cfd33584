package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted domain event or position. {@code id} is the content id, so writing the same event twice
 * (replay, backfill) hits the same document. Event fields live in {@code payload} with amounts as decimal strings.
 */
@Document(collection = "domain_events")
@CompoundIndexes({
    @CompoundIndex(name = "txHash_logIndex", def = "{'txHash': 1, 'logIndex': 1}"),
    @CompoundIndex(name = "block_eventType", def = "{'blockNumber': 1, 'eventType': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DomainEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String txHash;
    private long blockNumber;
    private int logIndex;
    private EventType eventType;
    private Instant timestamp;
    private Map<String, Object> payload = new LinkedHashMap<>();
    private Instant storedAt;
}
