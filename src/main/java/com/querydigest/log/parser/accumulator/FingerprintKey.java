package com.querydigest.log.parser.accumulator;

import java.util.Arrays;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * SHA-256 digest of a query fingerprint, used as the aggregation key.
 */
public final class FingerprintKey {

    private static final int SHORT_BYTES = 5;

    private final byte[] digest;

    private FingerprintKey(byte[] digest) {
        this.digest = digest;
    }

    public static FingerprintKey of(String fingerprint) {
        return new FingerprintKey(DigestUtils.sha256(fingerprint));
    }

    public static FingerprintKey fromHex(String hex) {
        try {
            byte[] bytes = Hex.decodeHex(hex);
            if (bytes.length != 32) {
                throw new IllegalArgumentException("Expected a 32 byte digest, got " + bytes.length);
            }
            return new FingerprintKey(bytes);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid fingerprint key: " + hex, e);
        }
    }

    public String toHex() {
        return Hex.encodeHexString(digest);
    }

    /**
     * First five bytes in hex, as shown in reports.
     */
    public String toShortHex() {
        return Hex.encodeHexString(Arrays.copyOf(digest, SHORT_BYTES));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        return Arrays.equals(digest, ((FingerprintKey) obj).digest);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
