package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import lombok.AllArgsConstructor;
import lombok.Data;

// 新的奖励快照被接受
@Data
@AllArgsConstructor
public class RewardsUpdated implements LedgerEvent {
    private final Address caller;
    private final RewardsRoot rewardsRoot;
    private final String rewardsIpfsHash;
    private final long updateTimestamp;
    private final long nonce;
}
