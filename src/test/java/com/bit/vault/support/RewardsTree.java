package com.bit.vault.support;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import com.bit.vault.rewards.RewardLeaf;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.util.MerkleProof;
import com.google.common.primitives.UnsignedBytes;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 链下奖励树构造：叶子按字节序排序，逐层有序对哈希，落单节点直接上提
 */
public class RewardsTree {

    private final Map<Address, BigInteger[]> values = new LinkedHashMap<>();
    private List<List<byte[]>> levels;

    public RewardsTree add(Address vault, long reward, long unlockedMevReward) {
        return add(vault, BigInteger.valueOf(reward), BigInteger.valueOf(unlockedMevReward));
    }

    public RewardsTree add(Address vault, BigInteger reward, BigInteger unlockedMevReward) {
        values.put(vault, new BigInteger[]{reward, unlockedMevReward});
        levels = null;
        return this;
    }

    public RewardsRoot root() {
        List<List<byte[]>> tree = build();
        return RewardsRoot.fromBytes(tree.get(tree.size() - 1).get(0));
    }

    public List<byte[]> proof(Address vault) {
        List<List<byte[]>> tree = build();
        byte[] leaf = leaf(vault);
        int index = -1;
        for (int i = 0; i < tree.get(0).size(); i++) {
            if (Arrays.equals(tree.get(0).get(i), leaf)) {
                index = i;
            }
        }
        if (index < 0) {
            throw new IllegalArgumentException("金库不在奖励树中: " + vault);
        }
        List<byte[]> proof = new ArrayList<>();
        for (int level = 0; level < tree.size() - 1; level++) {
            List<byte[]> nodes = tree.get(level);
            int sibling = index ^ 1;
            if (sibling < nodes.size()) {
                proof.add(nodes.get(sibling));
            }
            index /= 2;
        }
        return proof;
    }

    public HarvestParams params(Address vault) {
        BigInteger[] value = values.get(vault);
        return HarvestParams.builder()
                .reward(value[0])
                .unlockedMevReward(value[1])
                .proof(proof(vault))
                .build();
    }

    private byte[] leaf(Address vault) {
        BigInteger[] value = values.get(vault);
        return RewardLeaf.hash(vault, value[0], value[1]);
    }

    private List<List<byte[]>> build() {
        if (levels != null) {
            return levels;
        }
        if (values.isEmpty()) {
            throw new IllegalStateException("奖励树为空");
        }
        List<byte[]> leaves = new ArrayList<>();
        for (Address vault : values.keySet()) {
            leaves.add(leaf(vault));
        }
        leaves.sort(UnsignedBytes.lexicographicalComparator());
        List<List<byte[]>> tree = new ArrayList<>();
        tree.add(leaves);
        List<byte[]> current = leaves;
        while (current.size() > 1) {
            List<byte[]> next = new ArrayList<>();
            for (int i = 0; i < current.size(); i += 2) {
                next.add(i + 1 < current.size() ? MerkleProof.hashPair(current.get(i), current.get(i + 1)) : current.get(i));
            }
            tree.add(next);
            current = next;
        }
        levels = tree;
        return tree;
    }
}
