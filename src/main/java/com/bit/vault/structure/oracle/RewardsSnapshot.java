package com.bit.vault.structure.oracle;

import com.bit.vault.common.RewardsRoot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * 全局奖励快照：当前根、上一根、nonce、最近一次被接受的快照时间
 * nonce 从 1 开始，每接受一次快照加一；金库记录中的 nonce 为 0 表示从未抵押
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RewardsSnapshot {
    public static final long INITIAL_NONCE = 1;

    private RewardsRoot rewardsRoot;
    private RewardsRoot prevRewardsRoot;
    private long nonce;
    private long updateTimestamp;

    public static RewardsSnapshot initial() {
        return new RewardsSnapshot(RewardsRoot.ZERO, RewardsRoot.ZERO, INITIAL_NONCE, 0);
    }

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            dos.write(rewardsRoot.getBytes());
            dos.write(prevRewardsRoot.getBytes());
            dos.writeLong(nonce);
            dos.writeLong(updateTimestamp);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("快照序列化失败", e);
        }
    }

    public static RewardsSnapshot deserialize(byte[] data) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            byte[] root = new byte[RewardsRoot.HASH_LENGTH];
            dis.readFully(root);
            byte[] prevRoot = new byte[RewardsRoot.HASH_LENGTH];
            dis.readFully(prevRoot);
            return new RewardsSnapshot(new RewardsRoot(root), new RewardsRoot(prevRoot), dis.readLong(), dis.readLong());
        } catch (IOException e) {
            throw new IllegalStateException("快照反序列化失败", e);
        }
    }
}
