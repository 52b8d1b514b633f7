package com.bit.vault.structure.event;

import com.bit.vault.common.Address;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class Redeemed implements LedgerEvent {
    private final Address vault;
    private final Address owner;
    private final Address receiver;
    private final BigInteger assets;
    private final BigInteger shares;
}
