package com.bit.vault.mev.impl;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.mev.SharedMevEscrow;
import com.bit.vault.structure.event.MevHarvested;
import com.bit.vault.util.SafeCast;
import com.bit.vault.vault.VaultsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class SharedMevEscrowImpl implements SharedMevEscrow {

    static final byte[] BALANCE_KEY = "sharedMevEscrow".getBytes(StandardCharsets.UTF_8);

    @Autowired
    private TransactionExecutor executor;

    @Autowired
    private VaultsRegistry vaultsRegistry;

    @Override
    public void receive(StateTransaction tx, BigInteger assets) {
        if (assets == null || assets.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "MEV奖励金额必须大于0");
        }
        BigInteger balance = SafeCast.toUint256(balance(tx).add(assets));
        tx.put(TableEnum.ESCROW, BALANCE_KEY, balance.toByteArray());
        log.debug("共享MEV托管收到{}，余额{}", assets, balance);
    }

    @Override
    public BigInteger harvest(StateTransaction tx, Address vault, BigInteger assets) {
        if (!vaultsRegistry.isVault(tx, vault)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "调用方不是注册金库: " + vault);
        }
        if (assets.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger balance = balance(tx);
        if (balance.compareTo(assets) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                    "共享MEV托管余额 " + balance + " 不足以划转 " + assets);
        }
        tx.put(TableEnum.ESCROW, BALANCE_KEY, balance.subtract(assets).toByteArray());
        tx.emit(new MevHarvested(vault, assets));
        log.info("共享MEV托管向金库{}划转{}", vault, assets);
        return assets;
    }

    @Override
    public BigInteger getBalance() {
        return executor.query(SharedMevEscrowImpl::balance);
    }

    private static BigInteger balance(StateTransaction tx) {
        byte[] data = tx.get(TableEnum.ESCROW, BALANCE_KEY);
        return data == null ? BigInteger.ZERO : new BigInteger(data);
    }
}
