package com.feetrail.ingestion.vault;

import com.feetrail.domain.FeeEventType;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ABI definitions of the fee-vault events that are indexed, with their topic0 hashes.
 */
public final class FeeVaultEvents {

    public static final Event FEES_DEPOSITED = new Event("FeesDeposited", Arrays.asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    public static final Event FEES_ESCROWED = new Event("FeesEscrowed", Arrays.asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}));

    public static final Event DEV_ASSIGNED = new Event("DevAssigned", Arrays.asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}));

    public static final Event FEES_EXPIRED = new Event("FeesExpired", Arrays.asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}));

    public static final Event DEV_FEES_CLAIMED = new Event("DevFeesClaimed", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {}));

    public static final Event PROTOCOL_FEES_CLAIMED = new Event("ProtocolFeesClaimed", Arrays.asList(
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Address>() {}));

    private static final Map<FeeEventType, Event> BY_TYPE = Map.of(
            FeeEventType.DEPOSIT, FEES_DEPOSITED,
            FeeEventType.ESCROW, FEES_ESCROWED,
            FeeEventType.DEV_ASSIGNED, DEV_ASSIGNED,
            FeeEventType.EXPIRED, FEES_EXPIRED,
            FeeEventType.DEV_CLAIMED, DEV_FEES_CLAIMED,
            FeeEventType.PROTOCOL_CLAIMED, PROTOCOL_FEES_CLAIMED);

    private static final Map<String, FeeEventType> TYPE_BY_TOPIC = BY_TYPE.entrySet().stream()
            .collect(Collectors.toUnmodifiableMap(e -> EventEncoder.encode(e.getValue()), Map.Entry::getKey));

    private FeeVaultEvents() {
    }

    public static Event event(FeeEventType type) {
        return BY_TYPE.get(type);
    }

    public static String topic(FeeEventType type) {
        return EventEncoder.encode(BY_TYPE.get(type));
    }

    /** topic0 values for the eth_getLogs OR-filter. */
    public static List<String> allTopics() {
        return Arrays.stream(FeeEventType.values()).map(FeeVaultEvents::topic).toList();
    }

    public static Optional<FeeEventType> typeForTopic(String topic0) {
        if (topic0 == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TYPE_BY_TOPIC.get(topic0.toLowerCase(Locale.ROOT)));
    }
}
