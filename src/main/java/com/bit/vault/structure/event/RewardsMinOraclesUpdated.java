package com.bit.vault.structure.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RewardsMinOraclesUpdated implements LedgerEvent {
    private final int rewardsMinOracles;
}
