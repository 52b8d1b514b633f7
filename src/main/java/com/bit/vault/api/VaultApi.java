package com.bit.vault.api;

import com.bit.vault.common.Address;
import com.bit.vault.result.Result;
import com.bit.vault.structure.dto.ClaimRequest;
import com.bit.vault.structure.dto.CreateVaultRequest;
import com.bit.vault.structure.dto.DepositRequest;
import com.bit.vault.structure.dto.EnterExitQueueRequest;
import com.bit.vault.structure.dto.HarvestRequest;
import com.bit.vault.structure.dto.VaultDTO;
import com.bit.vault.structure.exit.ClaimResult;
import com.bit.vault.structure.exit.ExitedAssets;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.vault.VaultService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

@Slf4j
@RestController
@RequestMapping("/vault")
public class VaultApi {

    @Autowired
    private VaultService vaultService;

    @PostMapping("/create")
    public Result<VaultDTO> createVault(@RequestBody CreateVaultRequest request) {
        Address feeRecipient = request.getFeeRecipient() == null ? null : Address.fromHex(request.getFeeRecipient());
        return Result.OK(VaultDTO.from(vaultService.createVault(
                Address.fromHex(request.getVault()),
                Address.fromHex(request.getAdmin()),
                feeRecipient,
                request.getFeePercent(),
                request.isOwnMevEscrow())));
    }

    // 存入资产，返回铸造的份额
    @PostMapping("/deposit")
    public Result<BigInteger> deposit(@RequestBody DepositRequest request) {
        return Result.OK(vaultService.deposit(
                Address.fromHex(request.getVault()),
                Address.fromHex(request.getCaller()),
                Address.fromHex(request.getReceiver()),
                request.getAssets()));
    }

    // 进入退出队列，返回持仓票据
    @PostMapping("/enterExitQueue")
    public Result<BigInteger> enterExitQueue(@RequestBody EnterExitQueueRequest request) {
        return Result.OK(vaultService.enterExitQueue(
                Address.fromHex(request.getVault()),
                Address.fromHex(request.getOwner()),
                request.getShares(),
                Address.fromHex(request.getReceiver())));
    }

    @PostMapping("/updateState")
    public Result<HarvestResult> updateState(@RequestBody HarvestRequest request) {
        return Result.OK(vaultService.updateState(Address.fromHex(request.getVault()), request.toParams()));
    }

    @PostMapping("/claim")
    public Result<ClaimResult> claimExitedAssets(@RequestBody ClaimRequest request) {
        return Result.OK(vaultService.claimExitedAssets(
                Address.fromHex(request.getVault()),
                Address.fromHex(request.getReceiver()),
                request.getPositionTicket(),
                request.getTimestamp(),
                request.getCheckpointIndex()));
    }

    // 领取预览
    @PostMapping("/calculateExitedAssets")
    public Result<ExitedAssets> calculateExitedAssets(@RequestBody ClaimRequest request) {
        return Result.OK(vaultService.calculateExitedAssets(
                Address.fromHex(request.getVault()),
                Address.fromHex(request.getReceiver()),
                request.getPositionTicket(),
                request.getTimestamp(),
                request.getCheckpointIndex()));
    }

    @GetMapping("/exitQueueIndex")
    public Result<Integer> getExitQueueIndex(@RequestParam String vault, @RequestParam BigInteger positionTicket) {
        return Result.OK(vaultService.getExitQueueIndex(Address.fromHex(vault), positionTicket));
    }

    @GetMapping("/state")
    public Result<VaultDTO> getVaultState(@RequestParam String vault) {
        return Result.OK(VaultDTO.from(vaultService.getVaultState(Address.fromHex(vault))));
    }

    @GetMapping("/shares")
    public Result<BigInteger> getShares(@RequestParam String vault, @RequestParam String holder) {
        return Result.OK(vaultService.getShares(Address.fromHex(vault), Address.fromHex(holder)));
    }
}
