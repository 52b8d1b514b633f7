package com.bit.vault.rewards;

import com.bit.vault.common.Address;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.SafeCast;
import com.bit.vault.util.Sha;

import java.math.BigInteger;

/**
 * 奖励树叶子 = keccak256(keccak256(abi.encode(address vault, int160 reward, uint160 unlockedMevReward)))
 * 双重哈希使叶子与内部节点不可混淆
 */
public final class RewardLeaf {

    private RewardLeaf() {
    }

    public static byte[] hash(Address vault, BigInteger reward, BigInteger unlockedMevReward) {
        byte[] encoded = ByteUtils.concat(
                ByteUtils.toWord(vault),
                ByteUtils.toWord(SafeCast.toInt160(reward)),
                ByteUtils.toWord(SafeCast.toUint160(unlockedMevReward)));
        return Sha.keccak256(Sha.keccak256(encoded));
    }
}
