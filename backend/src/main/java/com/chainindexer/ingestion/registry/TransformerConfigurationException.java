package com.chainindexer.ingestion.registry;

/**
 * A contract entry that cannot be turned into a transformer. Raised while loading configuration so a bad entry
 * stops start-up instead of failing transactions later.
 */
public class TransformerConfigurationException extends RuntimeException {

    public TransformerConfigurationException(String message) {
        super(message);
    }

    public TransformerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
