package com.bit.vault.common;

/**
 * 奖励默克尔根（32字节），预言机共识提交的所有金库累计奖励的承诺
 */
public class RewardsRoot extends ByteHash32 {

    // 零根：尚未接受任何快照时的当前根/上一根
    public static final RewardsRoot ZERO = new RewardsRoot(new byte[HASH_LENGTH]);

    public RewardsRoot(byte[] value) {
        super(value);
    }

    public static RewardsRoot fromBytes(byte[] bytes) {
        return new RewardsRoot(bytes);
    }

    public static RewardsRoot fromHex(String hex) {
        return new RewardsRoot(hexToBytes(hex));
    }
}
