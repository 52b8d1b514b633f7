package com.bit.vault.structure.reward;

import com.bit.vault.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;

/**
 * 金库最近一次收割的累计值（主奖励流可为负，代表罚没）与同步到的快照 nonce
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Reward {
    private BigInteger assets;
    private long nonce;

    public static Reward empty() {
        return new Reward(BigInteger.ZERO, 0);
    }

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            dos.writeLong(nonce);
            ByteUtils.writeBigInteger(dos, assets);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("奖励记录序列化失败", e);
        }
    }

    public static Reward deserialize(byte[] data) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            long nonce = dis.readLong();
            return new Reward(ByteUtils.readBigInteger(dis), nonce);
        } catch (IOException e) {
            throw new IllegalStateException("奖励记录反序列化失败", e);
        }
    }
}
