package com.bit.vault.util;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;

public class Sha {
    // ThreadLocal存储每个线程独立的Keccak-256实例（以太坊风格哈希，非标准SHA3）
    private static final ThreadLocal<Keccak.Digest256> KECCAK256_THREAD_LOCAL = ThreadLocal.withInitial(Keccak.Digest256::new);

    /**
     * 线程安全的Keccak-256计算（默克尔叶子、类型化数据摘要、地址推导）
     */
    public static byte[] keccak256(byte[] data) {
        data = data == null ? new byte[0] : data;
        Keccak.Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        return digest.digest(data);
    }

    /**
     * 多段数据拼接后计算Keccak-256，避免中间数组拷贝
     */
    public static byte[] keccak256(byte[]... parts) {
        Keccak.Digest256 digest = KECCAK256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            if (part != null) {
                digest.update(part);
            }
        }
        return digest.digest();
    }

    public static byte[] keccak256(String text) {
        return keccak256(text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8));
    }
}
