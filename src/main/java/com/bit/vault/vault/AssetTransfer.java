package com.bit.vault.vault;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;

import java.math.BigInteger;

/**
 * 对外转出资产，必须是操作的最后一步
 */
public interface AssetTransfer {

    void transfer(StateTransaction tx, Address vault, Address receiver, BigInteger assets);

    /**
     * 接收方累计收到的资产
     */
    BigInteger getPaid(Address receiver);
}
