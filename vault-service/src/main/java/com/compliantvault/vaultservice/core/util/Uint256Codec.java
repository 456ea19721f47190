package com.compliantvault.vaultservice.core.util;

import com.compliantvault.vaultservice.core.exception.MalformedPayloadException;

import java.math.BigInteger;
import java.util.HexFormat;

/**
 * Oracle payloads travel as hex strings. A success payload is one 32-byte
 * big-endian unsigned word where exactly {@code 1} means approved.
 */
public class Uint256Codec {

    private Uint256Codec(){}

    public static final int WORD_SIZE = 32;

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    public static byte[] fromHex(String hex) {
        if (hex == null) return new byte[0];

        String digits = hex.strip();
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
        }

        try {
            return HexFormat.of().parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Not a hex string: " + hex);
        }
    }

    public static BigInteger decode(byte[] word) {
        if (word == null || word.length != WORD_SIZE) {
            throw new MalformedPayloadException("Expected " + WORD_SIZE + " bytes, got " + (word == null ? 0 : word.length));
        }
        return new BigInteger(1, word);
    }

    public static byte[] encode(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(MAX) > 0) {
            throw new MalformedPayloadException("Value out of uint256 range: " + value);
        }

        byte[] raw = value.toByteArray();
        byte[] word = new byte[WORD_SIZE];
        int copy = Math.min(raw.length, WORD_SIZE);
        System.arraycopy(raw, raw.length - copy, word, WORD_SIZE - copy, copy);
        return word;
    }

    public static String toHex(byte[] bytes) {
        return "0x" + HexFormat.of().formatHex(bytes);
    }

    public static boolean isApproved(BigInteger decoded) {
        return BigInteger.ONE.equals(decoded);
    }
}
