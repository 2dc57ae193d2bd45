package com.feetrail.common;

import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validators and converters for EVM hex values: addresses, 32-byte ids, quantities.
 */
public final class EvmHex {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern BYTES32 = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private EvmHex() {
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value).matches();
    }

    /** Syntactically valid and not the zero address. */
    public static boolean isNonZeroAddress(String value) {
        return isAddress(value) && !ZERO_ADDRESS.equalsIgnoreCase(value);
    }

    public static boolean isBytes32(String value) {
        return value != null && BYTES32.matcher(value).matches();
    }

    public static String normalizeAddress(String address) {
        if (!isAddress(address)) {
            throw new IllegalArgumentException("invalid address: " + address);
        }
        return address.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a JSON-RPC quantity ("0x1a"). Throws on anything else.
     */
    public static long parseQuantity(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new IllegalArgumentException("invalid hex quantity: " + hex);
        }
        return Long.parseLong(hex.substring(2), 16);
    }

    public static BigInteger parseBigQuantity(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new IllegalArgumentException("invalid hex quantity: " + hex);
        }
        return new BigInteger(hex.substring(2), 16);
    }

    public static String toQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    public static String toQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }

    /** Shortened poolId for log lines. */
    public static String abbreviate(String id) {
        if (id == null || id.length() <= 18) {
            return id;
        }
        return id.substring(0, 18) + "...";
    }
}
