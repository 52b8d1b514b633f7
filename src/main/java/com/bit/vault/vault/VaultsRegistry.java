package com.bit.vault.vault;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.structure.vault.VaultState;

/**
 * 金库注册表：只有注册过的金库才能收割奖励、领取共享MEV
 */
public interface VaultsRegistry {

    boolean isVault(StateTransaction tx, Address vault);

    /**
     * @throws com.bit.vault.exception.VaultException VAULT_NOT_FOUND
     */
    VaultState getVault(StateTransaction tx, Address vault);

    void saveVault(StateTransaction tx, VaultState state);
}
