package com.feetrail.routing.contract;

import com.feetrail.ingestion.adapter.evm.EvmContractReader;
import com.feetrail.ingestion.adapter.evm.EvmTransactionSender;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.DynamicStruct;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Typed calls into the hook, factory, LP locker and fee vault. State-changing calls block until mined;
 * reverts surface as exceptions to be classified with {@link ContractFailure}.
 */
@Slf4j
public class FeeRoutingContracts {

    private final EvmContractReader reader;
    private final EvmTransactionSender sender;

    /**
     * @param sender null when no administrative key is configured; state-changing calls are then rejected
     */
    public FeeRoutingContracts(EvmContractReader reader, EvmTransactionSender sender) {
        this.reader = reader;
        this.sender = sender;
    }

    public boolean canSign() {
        return sender != null;
    }

    // hook

    public boolean isPoolRegistered(String hook, String poolId) {
        Function function = new Function("isPoolRegistered",
                List.of(bytes32(poolId)),
                List.of(new TypeReference<Bool>() {}));
        List<Type> result = FunctionReturnDecoder.decode(reader.call(hook, FunctionEncoder.encode(function)),
                function.getOutputParameters());
        if (result.isEmpty()) {
            throw new IllegalStateException("isPoolRegistered returned no data");
        }
        return (Boolean) result.get(0).getValue();
    }

    public String setDevForPool(String hook, String poolId, String dev) {
        return send(hook, new Function("setDevForPool", List.of(bytes32(poolId), new Address(dev)), List.of()));
    }

    // factory / locker

    public LaunchInfo getLaunchInfo(String factory, String poolToken) {
        Function function = new Function("getLaunchInfo", List.of(new Address(poolToken)), List.of());
        return decodeLaunchInfo(reader.call(factory, FunctionEncoder.encode(function)));
    }

    public String updateDev(String locker, BigInteger lpTokenId, String dev) {
        return send(locker, new Function("updateDev", List.of(new Uint256(lpTokenId), new Address(dev)), List.of()));
    }

    // vault

    public String assignDev(String vault, String poolId, String dev) {
        return send(vault, new Function("assignDev", List.of(bytes32(poolId), new Address(dev)), List.of()));
    }

    public String reassignDev(String vault, String poolId, String dev) {
        return send(vault, new Function("reassignDev", List.of(bytes32(poolId), new Address(dev)), List.of()));
    }

    public String getCode(String address) {
        return reader.getCode(address);
    }

    private String send(String to, Function function) {
        if (sender == null) {
            throw new IllegalStateException("No administrative key configured for " + function.getName());
        }
        String txHash = sender.sendAndConfirm(to, FunctionEncoder.encode(function));
        log.debug("{} on {} confirmed in {}", function.getName(), to, txHash);
        return txHash;
    }

    private static Bytes32 bytes32(String hex) {
        return new Bytes32(Numeric.hexStringToByteArray(hex));
    }

    /**
     * Decodes {@code getLaunchInfo} return data: a single dynamic tuple
     * (address token, address dev, string projectId, bytes32 poolId, address pool, uint256[] lpTokenIds,
     * uint256 launchedAt, address launchedBy).
     */
    @SuppressWarnings({"rawtypes", "unchecked"})
    static LaunchInfo decodeLaunchInfo(String hex) {
        int length = Numeric.hexStringToByteArray(hex).length;
        if (length < 32 * 9) {
            throw new IllegalStateException("getLaunchInfo returned " + length + " bytes");
        }
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(hex, (List) List.of(new TypeReference<LaunchInfoTuple>() {}));
        } catch (RuntimeException e) {
            throw new IllegalStateException("Malformed getLaunchInfo return data: " + e.getMessage(), e);
        }
        if (decoded.size() != 1 || !(decoded.get(0) instanceof LaunchInfoTuple tuple)) {
            throw new IllegalStateException("getLaunchInfo returned no tuple");
        }
        return tuple.toLaunchInfo();
    }

    /**
     * ABI shape of the factory's launch record. Public with a typed constructor so web3j can build it reflectively.
     */
    public static class LaunchInfoTuple extends DynamicStruct {

        private final Address token;
        private final Address dev;
        private final Utf8String projectId;
        private final Bytes32 poolId;
        private final Address pool;
        private final DynamicArray<Uint256> lpTokenIds;

        public LaunchInfoTuple(Address token, Address dev, Utf8String projectId, Bytes32 poolId, Address pool,
                               DynamicArray<Uint256> lpTokenIds, Uint256 launchedAt, Address launchedBy) {
            super(token, dev, projectId, poolId, pool, lpTokenIds, launchedAt, launchedBy);
            this.token = token;
            this.dev = dev;
            this.projectId = projectId;
            this.poolId = poolId;
            this.pool = pool;
            this.lpTokenIds = lpTokenIds;
        }

        LaunchInfo toLaunchInfo() {
            return new LaunchInfo(
                    lower(token.getValue()),
                    lower(dev.getValue()),
                    projectId.getValue(),
                    lower(Numeric.toHexString(poolId.getValue())),
                    lower(pool.getValue()),
                    lpTokenIds.getValue().stream().map(Uint256::getValue).toList());
        }

        private static String lower(String hex) {
            return hex.toLowerCase(Locale.ROOT);
        }
    }
}
