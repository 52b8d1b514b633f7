package com.bit.vault.util;

import com.bit.vault.common.Address;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 字节工具：二进制统一大端
 */
public class ByteUtils {

    public static final int WORD_LENGTH = 32;

    /**
     * long 类型转 byte[]（大端，保证作为KV键时按数值顺序排列）
     */
    public static byte[] longToBytes(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    /**
     * 字节数组转十六进制字符串（带0x前缀）
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(2 + bytes.length * 2).append("0x");
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 十六进制字符串转字节数组（允许0x前缀）
     */
    public static byte[] hexToBytes(String hex) {
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        int len = hex.length();
        if (len % 2 != 0) {
            throw new IllegalArgumentException("十六进制长度必须为偶数: " + hex);
        }
        byte[] data = new byte[len / 2];
        for (int i = 0; i < len; i += 2) {
            int high = Character.digit(hex.charAt(i), 16);
            int low = Character.digit(hex.charAt(i + 1), 16);
            if (high == -1 || low == -1) {
                throw new IllegalArgumentException("非法十六进制字符: " + hex);
            }
            data[i / 2] = (byte) ((high << 4) + low);
        }
        return data;
    }

    public static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] combined = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, combined, offset, part.length);
            offset += part.length;
        }
        return combined;
    }

    // ------------------------------ ABI 32字节字编码 ------------------------------

    /**
     * 整数编码为32字节字（负数按二进制补码符号扩展）
     */
    public static byte[] toWord(BigInteger value) {
        byte[] raw = value.toByteArray();
        if (raw.length > WORD_LENGTH + 1 || (raw.length == WORD_LENGTH + 1 && raw[0] != 0)) {
            throw new IllegalArgumentException("数值超出256位: " + value);
        }
        byte[] word = new byte[WORD_LENGTH];
        if (value.signum() < 0) {
            Arrays.fill(word, (byte) 0xFF);
        }
        int copy = Math.min(raw.length, WORD_LENGTH);
        System.arraycopy(raw, raw.length - copy, word, WORD_LENGTH - copy, copy);
        return word;
    }

    public static byte[] toWord(long value) {
        return toWord(BigInteger.valueOf(value));
    }

    /**
     * 地址左侧补零为32字节字
     */
    public static byte[] toWord(Address address) {
        byte[] word = new byte[WORD_LENGTH];
        System.arraycopy(address.getBytes(), 0, word, WORD_LENGTH - Address.LENGTH, Address.LENGTH);
        return word;
    }

    // ------------------------------ 流式序列化 ------------------------------

    /**
     * 写入有符号大整数：1字节长度 + 二进制补码
     */
    public static void writeBigInteger(DataOutputStream dos, BigInteger value) throws IOException {
        byte[] raw = value.toByteArray();
        if (raw.length > 255) {
            throw new IllegalArgumentException("数值过大无法序列化: " + value);
        }
        dos.writeByte(raw.length);
        dos.write(raw);
    }

    public static BigInteger readBigInteger(DataInputStream dis) throws IOException {
        int length = dis.readUnsignedByte();
        byte[] raw = new byte[length];
        dis.readFully(raw);
        return new BigInteger(raw);
    }

    public static void writeAddress(DataOutputStream dos, Address address) throws IOException {
        dos.write(address.getBytes());
    }

    public static Address readAddress(DataInputStream dis) throws IOException {
        byte[] raw = new byte[Address.LENGTH];
        dis.readFully(raw);
        return Address.fromBytes(raw);
    }
}
