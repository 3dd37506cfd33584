package com.chainindexer.ingestion.config;

import com.chainindexer.ingestion.registry.ContractDefinition;
import com.chainindexer.ingestion.registry.TransformerFactory;
import com.chainindexer.ingestion.registry.TransformerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the transformer registry from {@link TransformProperties}. A malformed contract entry fails start-up.
 */
@Configuration
@EnableConfigurationProperties(TransformProperties.class)
@Slf4j
public class TransformConfig {

    @Bean
    public TransformerFactory transformerFactory() {
        return new TransformerFactory();
    }

    @Bean
    public TransformerRegistry transformerRegistry(TransformProperties properties, TransformerFactory factory) {
        TransformerRegistry registry = new TransformerRegistry();
        properties.getContracts().forEach((address, contract) -> {
            if (!contract.isActive()) {
                log.warn("Skipping inactive transformer entry for {}", address);
                return;
            }
            ContractDefinition definition = new ContractDefinition(address, contract.getTransformer(),
                    contract.getParams(), contract.getTransferPriorities(), contract.getLogPriorities());
            factory.register(registry, definition);
            log.info("Registered {} transformer for {}", contract.getTransformer(), address);
        });
        log.info("Transformer registry ready with {} contracts", registry.size());
        return registry;
    }
}
