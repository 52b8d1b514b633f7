package com.bit.vault.util;

import com.google.common.primitives.UnsignedBytes;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 默克尔证明校验（有序对哈希：每层先按无符号字节序排序再拼接做 Keccak-256）
 * 与链下构树工具的 sortPairs 模式一致，证明中不需要携带左右方向
 */
public final class MerkleProof {

    private static final Comparator<byte[]> ORDER = UnsignedBytes.lexicographicalComparator();

    private MerkleProof() {
    }

    public static boolean verify(List<byte[]> proof, byte[] root, byte[] leaf) {
        if (root == null || leaf == null) {
            return false;
        }
        return Arrays.equals(processProof(proof, leaf), root);
    }

    /**
     * 自叶子向上逐层哈希，返回重建出的根
     */
    public static byte[] processProof(List<byte[]> proof, byte[] leaf) {
        byte[] computed = leaf;
        if (proof == null) {
            return computed;
        }
        for (byte[] sibling : proof) {
            computed = hashPair(computed, sibling);
        }
        return computed;
    }

    public static byte[] hashPair(byte[] a, byte[] b) {
        return ORDER.compare(a, b) < 0 ? Sha.keccak256(a, b) : Sha.keccak256(b, a);
    }
}
