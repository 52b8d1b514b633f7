package com.bit.vault.structure.reward;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 金库收割参数：快照中属于该金库的叶子值及其默克尔证明
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class HarvestParams {
    // 累计共识层奖励（int160，可为负）
    private BigInteger reward;
    // 共享MEV托管中累计已解锁的执行层奖励（uint160）
    private BigInteger unlockedMevReward;
    @Builder.Default
    private List<byte[]> proof = new ArrayList<>();
}
