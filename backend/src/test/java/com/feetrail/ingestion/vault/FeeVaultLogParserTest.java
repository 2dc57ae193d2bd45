package com.feetrail.ingestion.vault;

import com.feetrail.common.EvmHex;
import com.feetrail.domain.FeeDistribution;
import com.feetrail.domain.FeeEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.feetrail.ingestion.vault.VaultLogFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class FeeVaultLogParserTest {

    private final FeeVaultLogParser parser = new FeeVaultLogParser();
    private final Instant blockTime = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    @DisplayName("FeesDeposited decodes pool, dev, token and both amounts")
    void parse_feesDeposited() {
        Optional<FeeDistribution> parsed = parser.parse(deposit(100, 3, txHash(1), 100, 5), blockTime);

        assertThat(parsed).isPresent();
        FeeDistribution d = parsed.get();
        assertThat(d.getEventType()).isEqualTo(FeeEventType.DEPOSIT);
        assertThat(d.getPoolId()).isEqualTo(POOL_ID);
        assertThat(d.getDevAddress()).isEqualTo(DEV);
        assertThat(d.getTokenAddress()).isEqualTo(TOKEN);
        assertThat(d.getDevAmount()).isEqualTo("100");
        assertThat(d.getProtocolAmount()).isEqualTo("5");
        assertThat(d.getAmount()).isNull();
        assertThat(d.getTxHash()).isEqualTo(txHash(1));
        assertThat(d.getLogIndex()).isEqualTo(3);
        assertThat(d.getBlockNumber()).isEqualTo(100);
        assertThat(d.getBlockTimestamp()).isEqualTo(blockTime);
        assertThat(d.getVaultAddress()).isEqualTo(VAULT);
    }

    @Test
    void parse_feesEscrowed() {
        VaultLog log = log(FeeEventType.ESCROW, 10, 0, txHash(2), List.of(POOL_ID, addressTopic(TOKEN)), uint(42));

        FeeDistribution d = parser.parse(log, blockTime).orElseThrow();

        assertThat(d.getEventType()).isEqualTo(FeeEventType.ESCROW);
        assertThat(d.getPoolId()).isEqualTo(POOL_ID);
        assertThat(d.getTokenAddress()).isEqualTo(TOKEN);
        assertThat(d.getAmount()).isEqualTo("42");
        assertThat(d.getDevAddress()).isNull();
    }

    @Test
    @DisplayName("DevAssigned carries tokensTransferred as amount and the zero-address token sentinel")
    void parse_devAssigned() {
        VaultLog log = log(FeeEventType.DEV_ASSIGNED, 10, 1, txHash(3), List.of(POOL_ID, addressTopic(DEV)), uint(7));

        FeeDistribution d = parser.parse(log, blockTime).orElseThrow();

        assertThat(d.getEventType()).isEqualTo(FeeEventType.DEV_ASSIGNED);
        assertThat(d.getDevAddress()).isEqualTo(DEV);
        assertThat(d.getTokenAddress()).isEqualTo(EvmHex.ZERO_ADDRESS);
        assertThat(d.getAmount()).isEqualTo("7");
    }

    @Test
    void parse_feesExpired() {
        VaultLog log = log(FeeEventType.EXPIRED, 10, 2, txHash(4), List.of(POOL_ID, addressTopic(TOKEN)), uint(9));

        FeeDistribution d = parser.parse(log, blockTime).orElseThrow();

        assertThat(d.getEventType()).isEqualTo(FeeEventType.EXPIRED);
        assertThat(d.getAmount()).isEqualTo("9");
    }

    @Test
    void parse_devFeesClaimed_hasNoPool() {
        VaultLog log = log(FeeEventType.DEV_CLAIMED, 10, 0, txHash(5), List.of(addressTopic(DEV), addressTopic(TOKEN)), uint(1_000));

        FeeDistribution d = parser.parse(log, blockTime).orElseThrow();

        assertThat(d.getEventType()).isEqualTo(FeeEventType.DEV_CLAIMED);
        assertThat(d.getPoolId()).isNull();
        assertThat(d.getDevAddress()).isEqualTo(DEV);
        assertThat(d.getTokenAddress()).isEqualTo(TOKEN);
        assertThat(d.getAmount()).isEqualTo("1000");
    }

    @Test
    void parse_protocolFeesClaimed_readsRecipientFromData() {
        VaultLog log = log(FeeEventType.PROTOCOL_CLAIMED, 10, 0, txHash(6), List.of(addressTopic(TOKEN)),
                uint(55), address(TREASURY));

        FeeDistribution d = parser.parse(log, blockTime).orElseThrow();

        assertThat(d.getEventType()).isEqualTo(FeeEventType.PROTOCOL_CLAIMED);
        assertThat(d.getTokenAddress()).isEqualTo(TOKEN);
        assertThat(d.getAmount()).isEqualTo("55");
        assertThat(d.getRecipientAddress()).isEqualTo(TREASURY);
    }

    @Test
    void parse_missingTimestamp_fallsBackToIndexingTime() {
        FeeDistribution d = parser.parse(deposit(100, 0, txHash(7), 1, 1), null).orElseThrow();

        assertThat(d.getBlockTimestamp()).isEqualTo(d.getIndexedAt());
    }

    @Test
    void parse_wrongTopicCount_skipped() {
        VaultLog log = log(FeeEventType.DEPOSIT, 10, 0, txHash(8), List.of(POOL_ID), uint(1), uint(2));

        assertThat(parser.parse(log, blockTime)).isEmpty();
    }

    @Test
    void parse_truncatedData_skipped() {
        VaultLog log = log(FeeEventType.DEPOSIT, 10, 0, txHash(9),
                List.of(POOL_ID, addressTopic(DEV), addressTopic(TOKEN)), uint(1));

        assertThat(parser.parse(log, blockTime)).isEmpty();
    }

    @Test
    void parse_unknownTopic_skipped() {
        VaultLog log = new VaultLog(VAULT, List.of("0x" + "ff".repeat(32)), "0x", 10, txHash(10), 0);

        assertThat(parser.parse(log, blockTime)).isEmpty();
    }
}
