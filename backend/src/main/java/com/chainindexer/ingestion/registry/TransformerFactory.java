package com.chainindexer.ingestion.registry;

import com.chainindexer.common.EvmAddresses;
import com.chainindexer.ingestion.transformer.AuctionTransformer;
import com.chainindexer.ingestion.transformer.BinPoolTransformer;
import com.chainindexer.ingestion.transformer.ConstantProductPoolTransformer;
import com.chainindexer.ingestion.transformer.FarmTransformer;
import com.chainindexer.ingestion.transformer.RouterTransformer;
import com.chainindexer.ingestion.transformer.StakingWrapperTransformer;
import com.chainindexer.ingestion.transformer.TokenTransformer;
import com.chainindexer.ingestion.transformer.Transformer;
import com.chainindexer.ingestion.transformer.WrappedNativeTransformer;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds typed transformers from contract definitions and registers them. Every parameter is validated here;
 * the engine never sees a half-configured transformer.
 */
public class TransformerFactory {

    static final String TOKEN0 = "token0";
    static final String TOKEN1 = "token1";
    static final String BASE_TOKEN = "base-token";
    static final String FEE_COLLECTOR = "fee-collector";
    static final String QUOTE_TOKENS = "quote-tokens";
    static final String UNDERLYING_TOKEN = "underlying-token";
    static final String DEPOSIT_TOKEN = "deposit-token";
    static final String POOL_TOKEN_PREFIX = "pool-token-";
    static final String REWARD_TOKEN = "reward-token";
    static final String LOT_TOKEN = "lot-token";
    static final String PAYMENT_TOKEN = "payment-token";

    public Transformer create(ContractDefinition definition) {
        String address = definition.address();
        if (!EvmAddresses.isValid(address)) {
            throw new TransformerConfigurationException("Invalid contract address: " + address);
        }
        if (definition.type() == null) {
            throw new TransformerConfigurationException("No transformer type for contract " + address);
        }
        Map<String, String> params = definition.params();
        try {
            return switch (definition.type()) {
                case TOKEN -> new TokenTransformer(address);
                case WRAPPED_NATIVE -> new WrappedNativeTransformer(address);
                case CONSTANT_PRODUCT_POOL -> new ConstantProductPoolTransformer(address,
                        requireAddress(params, TOKEN0, address), requireAddress(params, TOKEN1, address),
                        requireAddress(params, BASE_TOKEN, address), optionalAddress(params, FEE_COLLECTOR, address));
                case BIN_POOL -> new BinPoolTransformer(address,
                        requireAddress(params, TOKEN0, address), requireAddress(params, TOKEN1, address),
                        requireAddress(params, BASE_TOKEN, address));
                case ROUTER -> new RouterTransformer(address, addressList(params, QUOTE_TOKENS, address));
                case STAKING_WRAPPER -> new StakingWrapperTransformer(address,
                        requireAddress(params, UNDERLYING_TOKEN, address));
                case FARM -> farm(address, params);
                case AUCTION -> new AuctionTransformer(address,
                        requireAddress(params, LOT_TOKEN, address), requireAddress(params, PAYMENT_TOKEN, address));
            };
        } catch (IllegalArgumentException e) {
            throw new TransformerConfigurationException("Contract " + address + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates the transformer and registers it under the definition's effective priorities.
     */
    public void register(TransformerRegistry registry, ContractDefinition definition) {
        Transformer transformer = create(definition);
        validatePriorities(definition);
        registry.registerContract(definition.address(), transformer,
                definition.effectiveTransferPriorities(), definition.effectiveLogPriorities());
    }

    private FarmTransformer farm(String address, Map<String, String> params) {
        Map<BigInteger, String> poolTokens = new HashMap<>();
        params.forEach((key, value) -> {
            if (key.startsWith(POOL_TOKEN_PREFIX)) {
                String pid = key.substring(POOL_TOKEN_PREFIX.length());
                try {
                    poolTokens.put(new BigInteger(pid), requireAddress(params, key, address));
                } catch (NumberFormatException e) {
                    throw new TransformerConfigurationException("Contract " + address + ": bad pool id in " + key, e);
                }
            }
        });
        String depositToken = optionalAddress(params, DEPOSIT_TOKEN, address);
        if (depositToken == null && poolTokens.isEmpty()) {
            throw new TransformerConfigurationException("Farm " + address + " needs " + DEPOSIT_TOKEN
                    + " or at least one " + POOL_TOKEN_PREFIX + "<pid>");
        }
        return new FarmTransformer(address, depositToken, poolTokens, requireAddress(params, REWARD_TOKEN, address));
    }

    private static void validatePriorities(ContractDefinition definition) {
        definition.transferPriorities().forEach((name, priority) -> requirePriority(definition, name, priority));
        definition.logPriorities().forEach((name, priority) -> requirePriority(definition, name, priority));
    }

    private static void requirePriority(ContractDefinition definition, String name, Integer priority) {
        if (name == null || name.isBlank() || priority == null) {
            throw new TransformerConfigurationException("Contract " + definition.address()
                    + " has an incomplete priority entry: " + name + "=" + priority);
        }
    }

    private static String requireAddress(Map<String, String> params, String key, String contract) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            throw new TransformerConfigurationException("Contract " + contract + " is missing parameter " + key);
        }
        if (!EvmAddresses.isValid(value)) {
            throw new TransformerConfigurationException("Contract " + contract + " parameter " + key
                    + " is not an address: " + value);
        }
        return EvmAddresses.normalize(value);
    }

    private static String optionalAddress(Map<String, String> params, String key, String contract) {
        String value = params.get(key);
        return value == null || value.isBlank() ? null : requireAddress(params, key, contract);
    }

    private static List<String> addressList(Map<String, String> params, String key, String contract) {
        String value = params.get(key);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        List<String> out = Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        for (String address : out) {
            if (!EvmAddresses.isValid(address)) {
                throw new TransformerConfigurationException("Contract " + contract + " parameter " + key
                        + " has a non-address entry: " + address);
            }
        }
        return out.stream().map(EvmAddresses::normalize).toList();
    }
}
