package com.feetrail.ingestion.vault;

import com.feetrail.common.EvmHex;
import com.feetrail.domain.FeeDistribution;
import com.feetrail.domain.FeeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes fee-vault logs into distribution records. A log that cannot be decoded is logged and skipped.
 */
@Slf4j
@Component
public class FeeVaultLogParser {

    /**
     * @param blockTimestamp block time, or null when unresolved (falls back to indexing time)
     */
    public Optional<FeeDistribution> parse(VaultLog vaultLog, Instant blockTimestamp) {
        Optional<FeeEventType> type = FeeVaultEvents.typeForTopic(vaultLog.topic0());
        if (type.isEmpty()) {
            log.warn("Skipping log with unknown topic0 {} tx={} logIndex={}",
                    vaultLog.topic0(), vaultLog.transactionHash(), vaultLog.logIndex());
            return Optional.empty();
        }
        try {
            return Optional.of(decode(type.get(), vaultLog, blockTimestamp));
        } catch (RuntimeException e) {
            log.error("Failed to decode {} log tx={} logIndex={}: {}",
                    type.get().getWireName(), vaultLog.transactionHash(), vaultLog.logIndex(), e.getMessage());
            return Optional.empty();
        }
    }

    private static FeeDistribution decode(FeeEventType type, VaultLog vaultLog, Instant blockTimestamp) {
        Event event = FeeVaultEvents.event(type);
        List<String> topics = vaultLog.topics();
        List<TypeReference<Type>> indexedParams = event.getIndexedParameters();
        if (topics.size() != indexedParams.size() + 1) {
            throw new IllegalArgumentException("expected " + (indexedParams.size() + 1) + " topics, got " + topics.size());
        }
        List<Type> data = FunctionReturnDecoder.decode(vaultLog.data(), event.getNonIndexedParameters());
        if (data.size() != event.getNonIndexedParameters().size()) {
            throw new IllegalArgumentException("data does not match " + event.getName() + " layout");
        }

        Instant now = Instant.now();
        FeeDistribution record = new FeeDistribution();
        record.setTxHash(vaultLog.transactionHash().toLowerCase(Locale.ROOT));
        record.setLogIndex(vaultLog.logIndex());
        record.setBlockNumber(vaultLog.blockNumber());
        record.setBlockTimestamp(blockTimestamp != null ? blockTimestamp : now);
        record.setEventType(type);
        record.setVaultAddress(lower(vaultLog.address()));
        record.setIndexedAt(now);

        switch (type) {
            case DEPOSIT -> {
                record.setPoolId(indexed(topics, 1, indexedParams.get(0)));
                record.setDevAddress(indexed(topics, 2, indexedParams.get(1)));
                record.setTokenAddress(indexed(topics, 3, indexedParams.get(2)));
                record.setDevAmount(amount(data.get(0)));
                record.setProtocolAmount(amount(data.get(1)));
            }
            case ESCROW, EXPIRED -> {
                record.setPoolId(indexed(topics, 1, indexedParams.get(0)));
                record.setTokenAddress(indexed(topics, 2, indexedParams.get(1)));
                record.setAmount(amount(data.get(0)));
            }
            case DEV_ASSIGNED -> {
                record.setPoolId(indexed(topics, 1, indexedParams.get(0)));
                record.setDevAddress(indexed(topics, 2, indexedParams.get(1)));
                record.setTokenAddress(EvmHex.ZERO_ADDRESS);
                record.setAmount(amount(data.get(0)));
            }
            case DEV_CLAIMED -> {
                record.setDevAddress(indexed(topics, 1, indexedParams.get(0)));
                record.setTokenAddress(indexed(topics, 2, indexedParams.get(1)));
                record.setAmount(amount(data.get(0)));
            }
            case PROTOCOL_CLAIMED -> {
                record.setTokenAddress(indexed(topics, 1, indexedParams.get(0)));
                record.setAmount(amount(data.get(0)));
                record.setRecipientAddress(lower(data.get(1).toString()));
            }
        }
        return record;
    }

    private static String indexed(List<String> topics, int position, TypeReference<Type> typeReference) {
        Type value = FunctionReturnDecoder.decodeIndexedValue(topics.get(position), typeReference);
        if (value instanceof Address address) {
            return lower(address.getValue());
        }
        return lower(topics.get(position));
    }

    private static String amount(Type value) {
        return ((BigInteger) value.getValue()).toString();
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }
}
