package com.bit.vault.structure.reward;

import com.bit.vault.common.RewardsRoot;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class HarvestResult {
    private BigInteger totalAssetsDelta;
    private BigInteger unlockedMevDelta;
    // false 表示该快照已经收割过，本次调用没有任何状态变化
    private boolean harvested;
    private RewardsRoot rewardsRoot;

    public static HarvestResult skipped(RewardsRoot root) {
        return new HarvestResult(BigInteger.ZERO, BigInteger.ZERO, false, root);
    }
}
