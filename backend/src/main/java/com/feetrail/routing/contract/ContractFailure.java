package com.feetrail.routing.contract;

import com.feetrail.ingestion.adapter.JsonRpcErrorException;
import org.web3j.crypto.Hash;

import java.util.List;
import java.util.Locale;

/**
 * Classification of failed contract calls. Matches the custom error selector in revert data first,
 * then known error names / reason substrings in the error message chain. Anything else is {@link #UNEXPECTED}.
 * Declaration order matters: the first matching entry wins.
 */
public enum ContractFailure {

    NO_UNCLAIMED_FEES(List.of("NoUnclaimedFees()"), List.of("nounclaimedfees", "no unclaimed fees")),
    POOL_ALREADY_ASSIGNED(List.of("PoolAlreadyAssigned()"), List.of("poolalreadyassigned", "pool already assigned")),
    ALREADY_ASSIGNED(List.of("AlreadyAssigned()", "DevAlreadyAssigned()"), List.of("alreadyassigned", "already assigned")),
    UNEXPECTED(List.of(), List.of());

    private final List<String> selectors;
    private final List<String> substrings;

    ContractFailure(List<String> errorSignatures, List<String> substrings) {
        this.selectors = errorSignatures.stream().map(ContractFailure::selector).toList();
        this.substrings = substrings;
    }

    /** Either flavour of "pool already has a dev". */
    public boolean isAlreadyAssigned() {
        return this == POOL_ALREADY_ASSIGNED || this == ALREADY_ASSIGNED;
    }

    public static ContractFailure classify(Throwable error) {
        StringBuilder messages = new StringBuilder();
        String revertData = null;
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                messages.append(t.getMessage().toLowerCase(Locale.ROOT)).append('\n');
            }
            if (revertData == null && t instanceof JsonRpcErrorException rpcError && rpcError.getData() != null) {
                revertData = rpcError.getData().toLowerCase(Locale.ROOT);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        for (ContractFailure failure : values()) {
            if (revertData != null && failure.selectors.stream().anyMatch(revertData::startsWith)) {
                return failure;
            }
        }
        String text = messages.toString();
        for (ContractFailure failure : values()) {
            if (failure.substrings.stream().anyMatch(text::contains)) {
                return failure;
            }
        }
        return UNEXPECTED;
    }

    /** 4-byte selector ("0x" + 8 hex) of an error or function signature. */
    static String selector(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }
}
