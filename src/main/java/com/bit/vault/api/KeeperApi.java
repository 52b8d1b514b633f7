package com.bit.vault.api;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import com.bit.vault.oracle.OracleRegistry;
import com.bit.vault.oracle.RewardsConsensus;
import com.bit.vault.result.Result;
import com.bit.vault.rewards.KeeperRewards;
import com.bit.vault.structure.dto.HarvestStatusDTO;
import com.bit.vault.structure.dto.SnapshotDTO;
import com.bit.vault.structure.dto.SubmitRewardsRequest;
import com.bit.vault.structure.oracle.RewardsUpdateParams;
import com.bit.vault.structure.reward.Reward;
import com.bit.vault.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/keeper")
public class KeeperApi {

    @Autowired
    private RewardsConsensus rewardsConsensus;

    @Autowired
    private KeeperRewards keeperRewards;

    @Autowired
    private OracleRegistry oracleRegistry;

    // 预言机提交奖励快照
    @PostMapping("/rewards")
    public Result<SnapshotDTO> updateRewards(@RequestBody SubmitRewardsRequest request) {
        RewardsUpdateParams params = RewardsUpdateParams.builder()
                .rewardsRoot(RewardsRoot.fromHex(request.getRewardsRoot()))
                .rewardsIpfsHash(request.getRewardsIpfsHash())
                .updateTimestamp(request.getUpdateTimestamp())
                .signatures(ByteUtils.hexToBytes(request.getSignatures()))
                .build();
        return Result.OK(SnapshotDTO.from(rewardsConsensus.updateRewards(Address.fromHex(request.getCaller()), params)));
    }

    // 当前快照
    @GetMapping("/snapshot")
    public Result<SnapshotDTO> getSnapshot() {
        return Result.OK(SnapshotDTO.from(rewardsConsensus.getSnapshot()));
    }

    @GetMapping("/canUpdate")
    public Result<Boolean> canUpdateRewards() {
        return Result.OK(rewardsConsensus.canUpdateRewards());
    }

    // 金库收割状态
    @GetMapping("/harvestStatus")
    public Result<HarvestStatusDTO> getHarvestStatus(@RequestParam String vault) {
        Address address = Address.fromHex(vault);
        Reward reward = keeperRewards.getReward(address);
        HarvestStatusDTO dto = new HarvestStatusDTO();
        dto.setCollateralized(keeperRewards.isCollateralized(address));
        dto.setHarvestRequired(keeperRewards.isHarvestRequired(address));
        dto.setCanHarvest(keeperRewards.canHarvest(address));
        dto.setStateUpdateRequired(keeperRewards.isStateUpdateRequired(address));
        dto.setRewardAssets(reward.getAssets());
        dto.setRewardNonce(reward.getNonce());
        return Result.OK(dto);
    }

    @GetMapping("/oracles")
    public Result<List<String>> getOracles() {
        return Result.OK(oracleRegistry.getOracles().stream().map(Address::toHex).collect(Collectors.toList()));
    }
}
