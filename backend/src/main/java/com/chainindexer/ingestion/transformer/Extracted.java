package com.chainindexer.ingestion.transformer;

import com.chainindexer.domain.ProcessingError;
import com.chainindexer.domain.Signal;

/**
 * Phase-1 result for one log: a signal, nothing, or an error.
 */
record Extracted(Signal signal, ProcessingError error) {

    static Extracted of(Signal signal) {
        return new Extracted(signal, null);
    }

    static Extracted none() {
        return new Extracted(null, null);
    }

    static Extracted failure(ProcessingError error) {
        return new Extracted(null, error);
    }
}
