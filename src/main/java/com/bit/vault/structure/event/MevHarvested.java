package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

// 共享MEV托管向金库划转
@Data
@AllArgsConstructor
public class MevHarvested implements LedgerEvent {
    private final Address vault;
    private final BigInteger assets;
}
