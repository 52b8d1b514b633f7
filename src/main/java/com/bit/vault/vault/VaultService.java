package com.bit.vault.vault;

import com.bit.vault.common.Address;
import com.bit.vault.structure.exit.ClaimResult;
import com.bit.vault.structure.exit.ExitRequest;
import com.bit.vault.structure.exit.ExitedAssets;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.vault.VaultState;

import java.math.BigInteger;

/**
 * 金库：份额记账、状态更新与退出队列持仓的完整生命周期
 */
public interface VaultService {

    VaultState createVault(Address vault, Address admin, Address feeRecipient, int feePercent, boolean ownMevEscrow);

    /**
     * 按当前汇率铸造份额
     * @return 铸造的份额
     */
    BigInteger deposit(Address vault, Address caller, Address receiver, BigInteger assets);

    /**
     * 未抵押金库的即时赎回
     * @return 转出的资产
     */
    BigInteger redeem(Address vault, Address owner, Address receiver, BigInteger shares);

    /**
     * 从流动资产中扣除验证者押金并完成抵押
     */
    void registerValidator(Address vault, BigInteger depositAssets);

    /**
     * 共识层提款到账
     */
    void receiveValidatorAssets(Address vault, BigInteger assets);

    /**
     * 执行层奖励到账，按金库配置进入独立托管或共享托管
     */
    void receiveMevReward(Address vault, BigInteger assets);

    /**
     * 份额进入退出队列
     * @return 持仓票据
     */
    BigInteger enterExitQueue(Address vault, Address owner, BigInteger shares, Address receiver);

    /**
     * 收割奖励、结算收益与罚没，并把可用流动资产推入退出队列
     */
    HarvestResult updateState(Address vault, HarvestParams params);

    ClaimResult claimExitedAssets(Address vault, Address receiver, BigInteger positionTicket, long timestamp,
                                  int checkpointIndex);

    /**
     * 领取预览，不检查领取延迟
     */
    ExitedAssets calculateExitedAssets(Address vault, Address receiver, BigInteger positionTicket, long timestamp,
                                       int checkpointIndex);

    int getExitQueueIndex(Address vault, BigInteger positionTicket);

    ExitRequest getExitRequest(Address vault, Address receiver, BigInteger positionTicket, long timestamp);

    BigInteger convertToShares(Address vault, BigInteger assets);

    BigInteger convertToAssets(Address vault, BigInteger shares);

    VaultState getVaultState(Address vault);

    BigInteger getShares(Address vault, Address holder);
}
