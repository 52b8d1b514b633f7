package com.bit.vault.structure.vault;

import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.util.ByteUtils;
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
 * 金库记账状态
 * totalShares 包含已入队但尚未被检查点销毁的份额；balance 为金库当前持有的流动资产，
 * 其中 unclaimedAssets 已划给退出队列，不可再用于新的检查点
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class VaultState {
    private Address vault;
    private Address admin;
    private Address feeRecipient;
    // 手续费（基点）
    private int feePercent;
    // true：使用独立MEV托管；false：使用共享MEV托管
    private boolean ownMevEscrow;

    @Builder.Default
    private BigInteger totalShares = BigInteger.ZERO;
    @Builder.Default
    private BigInteger totalAssets = BigInteger.ZERO;
    @Builder.Default
    private BigInteger queuedShares = BigInteger.ZERO;
    @Builder.Default
    private BigInteger unclaimedAssets = BigInteger.ZERO;
    @Builder.Default
    private BigInteger balance = BigInteger.ZERO;
    // 独立MEV托管中尚未收割的执行层奖励
    @Builder.Default
    private BigInteger ownMevBalance = BigInteger.ZERO;

    /**
     * 资产换算份额（向下取整，偏向金库）
     * 已有份额但总资产被罚没至0时无法定价，拒绝换算
     */
    public BigInteger convertToShares(BigInteger assets) {
        if (totalShares.signum() == 0) {
            return assets;
        }
        if (totalAssets.signum() == 0) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "金库总资产为0而份额为 " + totalShares + "，无法换算份额");
        }
        return assets.multiply(totalShares).divide(totalAssets);
    }

    /**
     * 份额换算资产（向下取整，偏向金库）
     */
    public BigInteger convertToAssets(BigInteger shares) {
        if (totalShares.signum() == 0) {
            return shares;
        }
        return shares.multiply(totalAssets).divide(totalShares);
    }

    /**
     * 可用于新检查点的流动资产
     */
    public BigInteger availableAssets() {
        BigInteger available = balance.subtract(unclaimedAssets);
        return available.signum() > 0 ? available : BigInteger.ZERO;
    }

    public byte[] serialize() {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            ByteUtils.writeAddress(dos, vault);
            ByteUtils.writeAddress(dos, admin);
            ByteUtils.writeAddress(dos, feeRecipient);
            dos.writeInt(feePercent);
            dos.writeBoolean(ownMevEscrow);
            ByteUtils.writeBigInteger(dos, totalShares);
            ByteUtils.writeBigInteger(dos, totalAssets);
            ByteUtils.writeBigInteger(dos, queuedShares);
            ByteUtils.writeBigInteger(dos, unclaimedAssets);
            ByteUtils.writeBigInteger(dos, balance);
            ByteUtils.writeBigInteger(dos, ownMevBalance);
            dos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("金库状态序列化失败", e);
        }
    }

    public static VaultState deserialize(byte[] data) {
        try (DataInputStream dis = new DataInputStream(new ByteArrayInputStream(data))) {
            return VaultState.builder()
                    .vault(ByteUtils.readAddress(dis))
                    .admin(ByteUtils.readAddress(dis))
                    .feeRecipient(ByteUtils.readAddress(dis))
                    .feePercent(dis.readInt())
                    .ownMevEscrow(dis.readBoolean())
                    .totalShares(ByteUtils.readBigInteger(dis))
                    .totalAssets(ByteUtils.readBigInteger(dis))
                    .queuedShares(ByteUtils.readBigInteger(dis))
                    .unclaimedAssets(ByteUtils.readBigInteger(dis))
                    .balance(ByteUtils.readBigInteger(dis))
                    .ownMevBalance(ByteUtils.readBigInteger(dis))
                    .build();
        } catch (IOException e) {
            throw new IllegalStateException("金库状态反序列化失败", e);
        }
    }
}
