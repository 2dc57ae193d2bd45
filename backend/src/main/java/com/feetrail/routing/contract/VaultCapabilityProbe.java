package com.feetrail.routing.contract;

import com.feetrail.config.CaffeineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Detects whether a vault deployment supports {@code reassignDev(bytes32,address)} by looking for the
 * function selector in its runtime bytecode. Results are cached per vault address without expiry.
 */
@Slf4j
@Component
public class VaultCapabilityProbe {

    static final String REASSIGN_DEV_SELECTOR = ContractFailure.selector("reassignDev(bytes32,address)").substring(2);

    private final FeeRoutingContracts contracts;
    private final Cache cache;

    public VaultCapabilityProbe(FeeRoutingContracts contracts, CacheManager cacheManager) {
        this.contracts = contracts;
        this.cache = cacheManager.getCache(CaffeineConfig.VAULT_CAPABILITY_CACHE);
    }

    public boolean supportsReassign(String vault) {
        String key = vault.toLowerCase(Locale.ROOT);
        if (cache != null) {
            Boolean cached = cache.get(key, Boolean.class);
            if (cached != null) {
                return cached;
            }
        }
        String code = contracts.getCode(vault);
        boolean supported = code.toLowerCase(Locale.ROOT).contains(REASSIGN_DEV_SELECTOR);
        log.info("Vault {} reassignDev support: {}", vault, supported);
        if (cache != null) {
            cache.put(key, supported);
        }
        return supported;
    }
}
