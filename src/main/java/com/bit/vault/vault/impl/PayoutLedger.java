package com.bit.vault.vault.impl;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.vault.AssetTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * 转出记账：记录每个接收方累计收到的资产，与金库扣减在同一事务内提交
 */
@Slf4j
@Component
public class PayoutLedger implements AssetTransfer {

    @Autowired
    private TransactionExecutor executor;

    @Override
    public void transfer(StateTransaction tx, Address vault, Address receiver, BigInteger assets) {
        if (receiver == null || receiver.isZero()) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "接收方地址为空");
        }
        BigInteger paid = paid(tx, receiver).add(assets);
        tx.put(TableEnum.PAYOUT, receiver.getBytes(), paid.toByteArray());
        log.info("金库{}向{}转出{}", vault, receiver, assets);
    }

    @Override
    public BigInteger getPaid(Address receiver) {
        return executor.query(tx -> paid(tx, receiver));
    }

    private static BigInteger paid(StateTransaction tx, Address receiver) {
        byte[] data = tx.get(TableEnum.PAYOUT, receiver.getBytes());
        return data == null ? BigInteger.ZERO : new BigInteger(data);
    }
}
