package com.bit.vault.structure.exit;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

/**
 * 单个检查点对某持仓的结算结果
 */
@Data
@AllArgsConstructor
public class ExitedAssets {
    private BigInteger leftShares;
    private BigInteger exitedShares;
    private BigInteger exitedAssets;

    public static ExitedAssets none(BigInteger positionShares) {
        return new ExitedAssets(positionShares, BigInteger.ZERO, BigInteger.ZERO);
    }
}
