package com.bit.vault.vault.impl;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.structure.vault.VaultState;
import com.bit.vault.util.SafeCast;
import com.bit.vault.vault.VaultsRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class VaultsRegistryImpl implements VaultsRegistry {

    @Autowired
    private TransactionExecutor executor;

    @Override
    public boolean isVault(StateTransaction tx, Address vault) {
        return vault != null && tx.isExist(TableEnum.VAULT, vault.getBytes());
    }

    @Override
    public VaultState getVault(StateTransaction tx, Address vault) {
        byte[] data = vault == null ? null : tx.get(TableEnum.VAULT, vault.getBytes());
        if (data == null) {
            throw new VaultException(ErrorType.VAULT_NOT_FOUND, "金库不存在: " + vault);
        }
        return VaultState.deserialize(data);
    }

    @Override
    public void saveVault(StateTransaction tx, VaultState state) {
        // 金库总量为 uint128
        SafeCast.toUint128(state.getTotalShares());
        SafeCast.toUint128(state.getTotalAssets());
        SafeCast.toUint128(state.getQueuedShares());
        SafeCast.toUint128(state.getUnclaimedAssets());
        SafeCast.toUint256(state.getBalance());
        SafeCast.toUint256(state.getOwnMevBalance());
        tx.put(TableEnum.VAULT, state.getVault().getBytes(), state.serialize());
    }
}
