package com.bit.vault.oracle;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.structure.oracle.RewardsSnapshot;
import com.bit.vault.structure.oracle.RewardsUpdateParams;

/**
 * 预言机奖励共识：接受多签名的默克尔快照
 */
public interface RewardsConsensus {

    /**
     * 提交新的奖励快照
     * @param caller 提交者，必须是已注册预言机
     * @return 接受后的快照
     */
    RewardsSnapshot updateRewards(Address caller, RewardsUpdateParams params);

    /**
     * 距离上一次被接受的快照已经满足最小间隔
     */
    boolean canUpdateRewards();

    RewardsSnapshot getSnapshot();

    RewardsSnapshot getSnapshot(StateTransaction tx);

    /**
     * 以当前 nonce 计算待签名摘要，供预言机签名使用
     */
    byte[] rewardsDigest(RewardsUpdateParams params);
}
