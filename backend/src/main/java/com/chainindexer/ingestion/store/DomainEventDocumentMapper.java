package com.chainindexer.ingestion.store;

import com.chainindexer.domain.DomainEvent;
import com.chainindexer.domain.DomainEventRecord;
import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.ProcessingErrorRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Converts engine records into Mongo documents. Amounts are stored as decimal strings (uint256 does not fit any
 * BSON number) and timestamps as ISO-8601 inside the payload.
 */
@Component
public class DomainEventDocumentMapper {

    private static final TypeReference<Map<String, Object>> PAYLOAD = new TypeReference<>() {
    };

    private final ObjectMapper payloadMapper;

    public DomainEventDocumentMapper(ObjectMapper objectMapper) {
        SimpleModule amounts = new SimpleModule("decimal-string-amounts");
        amounts.addSerializer(BigInteger.class, ToStringSerializer.instance);
        this.payloadMapper = objectMapper.copy()
                .registerModule(amounts)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Map<String, Object> payload(DomainEvent event) {
        return payloadMapper.convertValue(event, PAYLOAD);
    }

    /**
     * Copies {@code event} into {@code target}, which may be a fresh record or the one already stored under
     * the same id.
     */
    public DomainEventRecord toRecord(DomainEvent event, long blockNumber, DomainEventRecord target) {
        target.setId(event.contentId());
        target.setTxHash(event.txHash());
        target.setBlockNumber(blockNumber);
        target.setLogIndex(event.logIndex());
        target.setEventType(event.eventType());
        target.setTimestamp(event.timestamp());
        target.setPayload(payload(event));
        return target;
    }

    public ProcessingErrorRecord toRecord(ProcessingError error, long blockNumber, ProcessingErrorRecord target) {
        target.setId(error.errorId());
        target.setTxHash(error.txHash());
        target.setBlockNumber(blockNumber);
        target.setStage(ProcessingError.STAGE);
        target.setErrorType(error.errorType());
        target.setMessage(error.message());
        target.setLogIndex(error.logIndex());
        target.setContract(error.contract());
        target.setTransformerName(error.transformerName());
        target.setContext(new HashMap<>(error.context()));
        return target;
    }
}
