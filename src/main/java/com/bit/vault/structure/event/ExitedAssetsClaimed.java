package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

// newPositionTicket 为 0 表示持仓已全部结算
@Data
@AllArgsConstructor
public class ExitedAssetsClaimed implements LedgerEvent {
    private final Address vault;
    private final Address receiver;
    private final BigInteger prevPositionTicket;
    private final BigInteger newPositionTicket;
    private final BigInteger withdrawnAssets;
}
