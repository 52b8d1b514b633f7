package com.bit.vault.common;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.primitives.UnsignedBytes;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Comparator;

/**
 * 20字节账户地址（keccak256(公钥)的后20字节）
 * 按无符号字节序比较，预言机签名必须按签名者地址严格递增排列
 */
@EqualsAndHashCode(of = "value")
public final class Address implements Comparable<Address>, Serializable {
    public static final int LENGTH = 20;
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    private final byte[] value;

    private Address(byte[] value) {
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be " + LENGTH + " bytes");
        }
        return new Address(Arrays.copyOf(bytes, LENGTH));
    }

    public static Address fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Address hex cannot be null");
        }
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Invalid address: " + hex);
        }
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int high = Character.digit(hex.charAt(i * 2), 16);
            int low = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("Invalid hex character in address: " + hex);
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return new Address(bytes);
    }

    public byte[] getBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @JsonValue
    public String toHex() {
        StringBuilder sb = new StringBuilder(2 + LENGTH * 2).append("0x");
        for (byte b : value) {
            sb.append(HEX_CHARS[(b >>> 4) & 0x0F]);
            sb.append(HEX_CHARS[b & 0x0F]);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(Address other) {
        return ORDER.compare(value, other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
