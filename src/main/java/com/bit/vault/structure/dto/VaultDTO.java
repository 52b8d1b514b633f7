package com.bit.vault.structure.dto;

import com.bit.vault.structure.vault.VaultState;
import lombok.Data;

import java.math.BigInteger;

@Data
public class VaultDTO {
    private String vault;
    private String admin;
    private String feeRecipient;
    private int feePercent;
    private boolean ownMevEscrow;
    private BigInteger totalShares;
    private BigInteger totalAssets;
    private BigInteger queuedShares;
    private BigInteger unclaimedAssets;
    private BigInteger balance;
    private BigInteger ownMevBalance;

    public static VaultDTO from(VaultState state) {
        VaultDTO dto = new VaultDTO();
        dto.setVault(state.getVault().toHex());
        dto.setAdmin(state.getAdmin().toHex());
        dto.setFeeRecipient(state.getFeeRecipient().toHex());
        dto.setFeePercent(state.getFeePercent());
        dto.setOwnMevEscrow(state.isOwnMevEscrow());
        dto.setTotalShares(state.getTotalShares());
        dto.setTotalAssets(state.getTotalAssets());
        dto.setQueuedShares(state.getQueuedShares());
        dto.setUnclaimedAssets(state.getUnclaimedAssets());
        dto.setBalance(state.getBalance());
        dto.setOwnMevBalance(state.getOwnMevBalance());
        return dto;
    }
}
