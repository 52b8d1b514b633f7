package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class VaultCreated implements LedgerEvent {
    private final Address vault;
    private final Address admin;
    private final int feePercent;
    private final boolean ownMevEscrow;
}
