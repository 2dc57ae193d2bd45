package com.feetrail.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One decoded fee-vault log. Idempotency key: (txHash, logIndex). Amounts are base-unit decimal strings.
 * Records are written once; only a null projectId is ever filled in afterwards.
 */
@Document(collection = "fee_distributions")
@CompoundIndexes({
    @CompoundIndex(name = "txHash_logIndex", def = "{'txHash': 1, 'logIndex': 1}", unique = true),
    @CompoundIndex(name = "poolId_block", def = "{'poolId': 1, 'blockNumber': -1}"),
    @CompoundIndex(name = "devAddress_block", def = "{'devAddress': 1, 'blockNumber': -1}"),
    @CompoundIndex(name = "projectId_block", def = "{'projectId': 1, 'blockNumber': -1}"),
    @CompoundIndex(name = "eventType_block", def = "{'eventType': 1, 'blockNumber': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FeeDistribution {

    @Id
    private String id;
    @EqualsAndHashCode.Include
    private String txHash;
    @EqualsAndHashCode.Include
    private int logIndex;
    private long blockNumber;
    private Instant blockTimestamp;
    private FeeEventType eventType;
    /** Null for events not scoped to a pool (claims). */
    private String poolId;
    private String devAddress;
    private String tokenAddress;
    private String recipientAddress;
    private String amount;
    private String devAmount;
    private String protocolAmount;
    private String projectId;
    private String vaultAddress;
    private Instant indexedAt;
}
