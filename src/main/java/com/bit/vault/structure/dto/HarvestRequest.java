package com.bit.vault.structure.dto;

import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.util.ByteUtils;
import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 状态更新请求：金库地址 + 该金库在快照中的叶子值与证明
 */
@Data
public class HarvestRequest {
    private String vault;
    private BigInteger reward;
    private BigInteger unlockedMevReward;
    private List<String> proof = new ArrayList<>();

    public HarvestParams toParams() {
        return HarvestParams.builder()
                .reward(reward)
                .unlockedMevReward(unlockedMevReward == null ? BigInteger.ZERO : unlockedMevReward)
                .proof(proof.stream().map(ByteUtils::hexToBytes).collect(Collectors.toList()))
                .build();
    }
}
