package com.bit.vault.rewards;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.reward.Reward;

/**
 * 金库奖励收割：把全局快照中属于金库的累计奖励折算为本次增量，每个快照对每个金库只生效一次
 */
public interface KeeperRewards {

    /**
     * 校验证明并记录该金库的累计奖励
     * 已经同步过该快照时不做任何修改，返回 harvested=false 的零增量
     */
    HarvestResult harvest(StateTransaction tx, Address vault, HarvestParams params);

    /**
     * 已抵押且同步的 nonce 落后于当前 nonce
     */
    boolean canHarvest(Address vault);

    /**
     * 在 {@link #canHarvest(Address)} 的基础上校验证明，不修改状态
     */
    boolean canHarvest(Address vault, HarvestParams params);

    boolean isHarvestRequired(Address vault);

    boolean isHarvestRequired(StateTransaction tx, Address vault);

    boolean isCollateralized(Address vault);

    boolean isCollateralized(StateTransaction tx, Address vault);

    /**
     * 首次注册验证者时调用，之后该金库必须跟随快照收割
     */
    void collateralize(StateTransaction tx, Address vault);

    /**
     * 落后超过一个快照，存入与入队前必须先更新状态
     */
    boolean isStateUpdateRequired(Address vault);

    boolean isStateUpdateRequired(StateTransaction tx, Address vault);

    Reward getReward(Address vault);

    Reward getUnlockedMevReward(Address vault);
}
