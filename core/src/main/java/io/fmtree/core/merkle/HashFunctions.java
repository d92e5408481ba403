package io.fmtree.core.merkle;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Stock combiners.
 * <p>
 *  - longSum():   a + b, handy for tests and the arithmetic default (zero = 0L).
 *  - sha256():    SHA-256(left || right) over raw digests.
 *  - sha256Hex(): same, over lowercase hex strings, so leaves have value equality.
 */
public final class HashFunctions {
    /** SHA-256 digest length in bytes. */
    public static final int SHA256_LEN = 32;

    /** Hex zero element matching {@link #sha256Hex()}: 64 '0' characters. */
    public static final String SHA256_HEX_ZERO = "0".repeat(SHA256_LEN * 2);

    private static final HexFormat HEX = HexFormat.of();

    private HashFunctions() {
        // utility
    }

    public static HashFunction<Long> longSum() {
        return Long::sum;
    }

    public static HashFunction<byte[]> sha256() {
        return HashFunctions::h;
    }

    public static HashFunction<String> sha256Hex() {
        return (left, right) -> HEX.formatHex(h(HEX.parseHex(left), HEX.parseHex(right)));
    }

    /** H(left || right). */
    static byte[] h(byte[] left, byte[] right) {
        var md = newDigest();
        md.update(left);
        md.update(right);
        return md.digest();
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
