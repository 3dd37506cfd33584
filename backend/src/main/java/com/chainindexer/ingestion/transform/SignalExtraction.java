package com.chainindexer.ingestion.transform;

import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Signal;

import java.util.Map;

/**
 * Phase-1 output of one transformer for one contract: signals keyed by log index, and errors by id.
 */
public record SignalExtraction(Map<Integer, Signal> signals, Map<String, ProcessingError> errors) {

    public SignalExtraction {
        signals = Map.copyOf(signals);
        errors = Map.copyOf(errors);
    }

    public static SignalExtraction empty() {
        return new SignalExtraction(Map.of(), Map.of());
    }
}
