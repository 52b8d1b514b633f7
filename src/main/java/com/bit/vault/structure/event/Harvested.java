package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class Harvested implements LedgerEvent {
    private final Address vault;
    private final RewardsRoot rewardsRoot;
    private final BigInteger totalAssetsDelta;
    private final BigInteger unlockedMevDelta;
}
