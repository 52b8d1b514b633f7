package com.bit.vault.mev;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;

import java.math.BigInteger;

/**
 * 共享MEV托管：汇集所有使用共享托管金库的执行层奖励，金库按快照中的已解锁额度领取
 */
public interface SharedMevEscrow {

    /**
     * 执行层奖励进入共享托管
     */
    void receive(StateTransaction tx, BigInteger assets);

    /**
     * 向注册金库划转已解锁的奖励
     * @return 实际划转的金额
     */
    BigInteger harvest(StateTransaction tx, Address vault, BigInteger assets);

    BigInteger getBalance();
}
