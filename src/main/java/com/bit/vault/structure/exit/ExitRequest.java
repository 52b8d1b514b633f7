package com.bit.vault.structure.exit;

import com.bit.vault.common.Address;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.Sha;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;

/**
 * 退出队列持仓：接收方、入队时间、票据（入队时全局累计排队份额）与剩余排队份额
 * 部分结算后原记录删除，以 票据+已结算份额 生成后继持仓，入队时间不变
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ExitRequest {
    private Address vault;
    private Address receiver;
    private long timestamp;
    private BigInteger positionTicket;
    private BigInteger shares;

    public byte[] id() {
        return id(vault, receiver, timestamp, positionTicket);
    }

    /**
     * 持仓ID = keccak256(金库 || 接收方 || 入队时间 || 票据)，票据全局唯一，因此ID不会复用
     */
    public static byte[] id(Address vault, Address receiver, long timestamp, BigInteger positionTicket) {
        return Sha.keccak256(
                ByteUtils.toWord(vault),
                ByteUtils.toWord(receiver),
                ByteUtils.toWord(timestamp),
                ByteUtils.toWord(positionTicket));
    }

    public ExitRequest successor(BigInteger exitedShares, BigInteger leftShares) {
        return new ExitRequest(vault, receiver, timestamp, positionTicket.add(exitedShares), leftShares);
    }

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            ByteUtils.writeAddress(dos, vault);
            ByteUtils.writeAddress(dos, receiver);
            dos.writeLong(timestamp);
            ByteUtils.writeBigInteger(dos, positionTicket);
            ByteUtils.writeBigInteger(dos, shares);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("退出请求序列化失败", e);
        }
    }

    public static ExitRequest deserialize(byte[] data) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            return new ExitRequest(
                    ByteUtils.readAddress(dis),
                    ByteUtils.readAddress(dis),
                    dis.readLong(),
                    ByteUtils.readBigInteger(dis),
                    ByteUtils.readBigInteger(dis));
        } catch (IOException e) {
            throw new IllegalStateException("退出请求反序列化失败", e);
        }
    }
}
