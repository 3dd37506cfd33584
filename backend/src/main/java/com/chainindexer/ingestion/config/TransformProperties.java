package com.chainindexer.ingestion.config;

import com.chainindexer.ingestion.transformer.TransformerType;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transform pipeline config: per-block parallelism and the contract table the transformer registry is built
 * from. See application.yml chainindexer.transform; the executor sub-keys are read by AsyncConfig.
 */
@ConfigurationProperties(prefix = "chainindexer.transform")
@NoArgsConstructor
@Getter
@Setter
public class TransformProperties {

    /**
     * Maximum transactions of one block reconciled concurrently. Default 4 (match transform-executor core size).
     */
    private int parallelism = 4;

    /**
     * Map: contract address (0x…) -> transformer entry.
     */
    private Map<String, Contract> contracts = new LinkedHashMap<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Contract {
        private TransformerType transformer;
        /** Constructor parameters, e.g. token0, token1, base-token, fee-collector. */
        private Map<String, String> params = new HashMap<>();
        /** Overrides the transformer's default phase-1 priorities when non-empty. */
        private Map<String, Integer> transferPriorities = new HashMap<>();
        /** Overrides the transformer's default phase-2 priorities when non-empty. */
        private Map<String, Integer> logPriorities = new HashMap<>();
        private boolean active = true;
    }
}
