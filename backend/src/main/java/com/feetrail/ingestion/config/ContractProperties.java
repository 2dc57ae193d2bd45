package com.feetrail.ingestion.config;

import com.feetrail.common.EvmHex;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * On-chain contract addresses. Vault addresses are ordered: current vault first, legacy vaults after.
 */
@ConfigurationProperties(prefix = "feetrail.contracts")
@NoArgsConstructor
@Getter
@Setter
public class ContractProperties {

    private List<String> vaultAddresses = new ArrayList<>();
    private String factoryAddress;
    private String hookAddress;
    private String lockerAddress;

    /** Valid, lower-cased vault addresses in configured order; blanks and malformed entries dropped. */
    public List<String> normalizedVaultAddresses() {
        return vaultAddresses.stream()
                .filter(a -> a != null && EvmHex.isAddress(a.trim()))
                .map(a -> EvmHex.normalizeAddress(a.trim()))
                .distinct()
                .toList();
    }

    public boolean hasVault() {
        return !normalizedVaultAddresses().isEmpty();
    }
}
