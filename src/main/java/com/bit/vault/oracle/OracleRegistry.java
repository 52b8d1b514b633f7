package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;

import java.util.List;

/**
 * 预言机注册表
 */
public interface OracleRegistry {

    void addOracle(Address oracle);

    void removeOracle(Address oracle);

    void setRewardsMinOracles(int rewardsMinOracles);

    boolean isOracle(Address oracle);

    int getTotalOracles();

    int getRewardsMinOracles();

    List<Address> getOracles();

    // ------------------------------ 事务内调用 ------------------------------

    boolean isOracle(StateTransaction tx, Address oracle);

    int getRewardsMinOracles(StateTransaction tx);
}
