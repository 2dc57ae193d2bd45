package com.feetrail.routing;

import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.RpcException;
import com.feetrail.ingestion.config.ContractProperties;
import com.feetrail.routing.contract.ContractFailure;
import com.feetrail.routing.contract.FeeRoutingContracts;
import com.feetrail.routing.contract.LaunchInfo;
import com.feetrail.routing.contract.VaultCapabilityProbe;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Makes hook, LP locker and fee vault agree on a pool's verified developer, then releases escrowed fees.
 *
 * <p>Steps run in a fixed order and each is idempotent: hook routing, locker routing, escrow assignment.
 * Hook and locker failures only lower their flags. Escrow walks the configured vaults (current first,
 * then legacy): "no unclaimed fees" is a noop, "already assigned" falls through to reassignDev when the
 * vault supports it, anything else is thrown as {@link RoutingException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DevRoutingReconciler {

    private final FeeRoutingContracts contracts;
    private final VaultCapabilityProbe capabilityProbe;
    private final ContractProperties contractProperties;

    private record HookResult(boolean updated, boolean blockedByPoolAssigned) {}

    public RoutingOutcome reconcile(RoutingRequest request) {
        if (!EvmHex.isBytes32(request.poolId())) {
            throw new IllegalArgumentException("poolId must be 0x-prefixed 32-byte hex: " + request.poolId());
        }
        if (!EvmHex.isNonZeroAddress(request.devAddress())) {
            throw new IllegalArgumentException("dev address must be a non-zero 20-byte address: " + request.devAddress());
        }
        if (!contracts.canSign()) {
            log.warn("Routing skipped for pool {}: no administrative key configured", EvmHex.abbreviate(request.poolId()));
            return RoutingOutcome.noop();
        }
        String poolId = request.poolId().toLowerCase(Locale.ROOT);
        String dev = EvmHex.normalizeAddress(request.devAddress());

        HookResult hook = syncHook(poolId, dev);
        boolean locker = syncLocker(poolId, dev, request.poolTokenAddress());
        EscrowAction escrow = assignEscrow(poolId, dev, request.projectId());

        RoutingOutcome outcome = new RoutingOutcome(hook.updated(), hook.blockedByPoolAssigned(), locker, escrow);
        log.info("Routing reconciled for pool {} dev {} project {}: {}",
                EvmHex.abbreviate(poolId), dev, request.projectId(), outcome);
        return outcome;
    }

    private HookResult syncHook(String poolId, String dev) {
        String hook = contractProperties.getHookAddress();
        if (!EvmHex.isNonZeroAddress(hook)) {
            return new HookResult(false, false);
        }
        boolean registered;
        try {
            registered = contracts.isPoolRegistered(hook, poolId);
        } catch (RuntimeException e) {
            log.warn("Hook isPoolRegistered read failed for pool {}: {}", EvmHex.abbreviate(poolId), e.getMessage());
            return new HookResult(false, false);
        }
        if (!registered) {
            log.debug("Pool {} not registered on hook, skipping hook routing", EvmHex.abbreviate(poolId));
            return new HookResult(false, false);
        }
        try {
            String txHash = contracts.setDevForPool(hook, poolId, dev);
            log.info("Hook routing updated for pool {} -> {} (tx {})", EvmHex.abbreviate(poolId), dev, txHash);
            return new HookResult(true, false);
        } catch (RuntimeException e) {
            if (ContractFailure.classify(e).isAlreadyAssigned()) {
                log.warn("Hook routing for pool {} blocked: pool already assigned", EvmHex.abbreviate(poolId));
                return new HookResult(false, true);
            }
            log.warn("Hook setDevForPool failed for pool {}: {}", EvmHex.abbreviate(poolId), e.getMessage());
            return new HookResult(false, false);
        }
    }

    private boolean syncLocker(String poolId, String dev, String poolTokenAddress) {
        String factory = contractProperties.getFactoryAddress();
        String locker = contractProperties.getLockerAddress();
        if (!EvmHex.isNonZeroAddress(factory) || !EvmHex.isNonZeroAddress(locker)
                || !EvmHex.isNonZeroAddress(poolTokenAddress)) {
            return false;
        }
        LaunchInfo launch;
        try {
            launch = contracts.getLaunchInfo(factory, poolTokenAddress);
        } catch (RuntimeException e) {
            log.warn("Factory getLaunchInfo failed for token {}: {}", poolTokenAddress, e.getMessage());
            return false;
        }
        if (!poolId.equalsIgnoreCase(launch.poolId())) {
            log.warn("Launch info pool {} does not match expected pool {} for token {}",
                    EvmHex.abbreviate(launch.poolId()), EvmHex.abbreviate(poolId), poolTokenAddress);
            return false;
        }
        List<BigInteger> positions = launch.nonZeroLpTokenIds();
        boolean updated = false;
        for (BigInteger tokenId : positions) {
            try {
                String txHash = contracts.updateDev(locker, tokenId, dev);
                log.info("Locker routing updated for position {} -> {} (tx {})", tokenId, dev, txHash);
                updated = true;
            } catch (RuntimeException e) {
                log.warn("Locker updateDev failed for position {}: {}", tokenId, e.getMessage());
            }
        }
        return updated;
    }

    private EscrowAction assignEscrow(String poolId, String dev, String projectId) {
        List<String> vaults = contractProperties.normalizedVaultAddresses();
        if (vaults.isEmpty()) {
            return EscrowAction.NOOP;
        }
        RuntimeException lastUnexpected = null;
        for (int i = 0; i < vaults.size(); i++) {
            String vault = vaults.get(i);
            boolean hasNextVault = i < vaults.size() - 1;
            try {
                String txHash = contracts.assignDev(vault, poolId, dev);
                log.info("assignDev succeeded on vault {} for pool {} (project {}, tx {})",
                        vault, EvmHex.abbreviate(poolId), projectId, txHash);
                return EscrowAction.ASSIGNED;
            } catch (RuntimeException e) {
                ContractFailure failure = ContractFailure.classify(e);
                if (failure == ContractFailure.NO_UNCLAIMED_FEES) {
                    log.info("No unclaimed fees for pool {} on vault {}", EvmHex.abbreviate(poolId), vault);
                    return EscrowAction.NOOP;
                }
                if (!failure.isAlreadyAssigned()) {
                    log.warn("assignDev on vault {} failed unexpectedly for pool {}: {}",
                            vault, EvmHex.abbreviate(poolId), e.getMessage());
                    lastUnexpected = e;
                    continue;
                }
            }

            boolean supportsReassign;
            try {
                supportsReassign = capabilityProbe.supportsReassign(vault);
            } catch (RpcException e) {
                log.warn("Could not probe vault {} for reassignDev: {}", vault, e.getMessage());
                lastUnexpected = e;
                continue;
            }
            if (!supportsReassign) {
                log.warn("Pool {} already assigned on legacy vault {} without reassignDev{}",
                        EvmHex.abbreviate(poolId), vault, hasNextVault ? ", trying next vault" : "");
                if (hasNextVault) {
                    continue;
                }
                break;
            }
            try {
                String txHash = contracts.reassignDev(vault, poolId, dev);
                log.info("reassignDev succeeded on vault {} for pool {} (tx {})", vault, EvmHex.abbreviate(poolId), txHash);
                return EscrowAction.REASSIGNED;
            } catch (RuntimeException e) {
                if (ContractFailure.classify(e) == ContractFailure.NO_UNCLAIMED_FEES) {
                    log.info("No unclaimed fees to reassign for pool {} on vault {}", EvmHex.abbreviate(poolId), vault);
                    return EscrowAction.NOOP;
                }
                throw new RoutingException("reassignDev failed on vault " + vault + ": " + e.getMessage(), e);
            }
        }
        if (lastUnexpected == null) {
            return EscrowAction.NOOP;
        }
        throw new RoutingException("Escrow assignment failed for pool " + EvmHex.abbreviate(poolId)
                + ": " + lastUnexpected.getMessage(), lastUnexpected);
    }
}
