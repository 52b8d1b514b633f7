package com.bit.vault.structure.exit;

import com.bit.vault.util.ByteUtils;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;

/**
 * 退出队列检查点：截至该检查点累计处理的份额（票据上界）与累计释放的资产
 * 一经写入不再修改
 */
@Data
@AllArgsConstructor
public class Checkpoint {
    public static final Checkpoint ZERO = new Checkpoint(BigInteger.ZERO, BigInteger.ZERO);

    private final BigInteger totalTickets;
    private final BigInteger totalExitedAssets;

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            ByteUtils.writeBigInteger(dos, totalTickets);
            ByteUtils.writeBigInteger(dos, totalExitedAssets);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("检查点序列化失败", e);
        }
    }

    public static Checkpoint deserialize(byte[] data) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            return new Checkpoint(ByteUtils.readBigInteger(dis), ByteUtils.readBigInteger(dis));
        } catch (IOException e) {
            throw new IllegalStateException("检查点反序列化失败", e);
        }
    }
}
