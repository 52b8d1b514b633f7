package com.bit.vault.structure.exit;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class ClaimResult {
    // 后继持仓票据，0 表示持仓已全部结算
    private BigInteger newPositionTicket;
    private BigInteger claimedShares;
    private BigInteger claimedAssets;
}
