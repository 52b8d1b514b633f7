package com.bit.vault.rewards;

import com.bit.vault.common.Address;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.structure.event.Harvested;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.reward.Reward;
import com.bit.vault.support.RewardsTree;
import com.bit.vault.support.TestLedger;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class KeeperRewardsTest {

    private static final Address SHARED_VAULT = TestLedger.address(1);
    private static final Address OWN_VAULT = TestLedger.address(2);
    private static final Address ADMIN = TestLedger.address(100);

    private TestLedger ledger;
    private KeeperRewards keeperRewards;

    @BeforeEach
    void setUp() {
        ledger = new TestLedger(1, 1);
        keeperRewards = ledger.keeperRewards;
        ledger.vaultService.createVault(SHARED_VAULT, ADMIN, null, 0, false);
        ledger.vaultService.createVault(OWN_VAULT, ADMIN, null, 0, true);
    }

    @Test
    void harvestsCurrentRootOnce() {
        collateralize(SHARED_VAULT);
        RewardsTree tree = new RewardsTree().add(SHARED_VAULT, 100, 0).add(OWN_VAULT, 5, 0);
        ledger.publish(tree);
        assertTrue(keeperRewards.isHarvestRequired(SHARED_VAULT));
        assertTrue(keeperRewards.canHarvest(SHARED_VAULT));

        HarvestResult result = harvest(SHARED_VAULT, tree.params(SHARED_VAULT));
        assertTrue(result.isHarvested());
        assertEquals(BigInteger.valueOf(100), result.getTotalAssetsDelta());
        assertEquals(tree.root(), result.getRewardsRoot());
        assertEquals(new Reward(BigInteger.valueOf(100), 2), keeperRewards.getReward(SHARED_VAULT));
        assertFalse(keeperRewards.isHarvestRequired(SHARED_VAULT));
        assertFalse(keeperRewards.canHarvest(SHARED_VAULT));

        // 同一快照再次收割：零增量，状态不变
        HarvestResult again = harvest(SHARED_VAULT, tree.params(SHARED_VAULT));
        assertFalse(again.isHarvested());
        assertEquals(BigInteger.ZERO, again.getTotalAssetsDelta());
        assertEquals(new Reward(BigInteger.valueOf(100), 2), keeperRewards.getReward(SHARED_VAULT));
        assertEquals(1, ledger.events(Harvested.class).size());
    }

    @Test
    void deltaIsDifferenceOfCumulativeRewards() {
        collateralize(SHARED_VAULT);
        RewardsTree first = new RewardsTree().add(SHARED_VAULT, 100, 0);
        ledger.publish(first);
        harvest(SHARED_VAULT, first.params(SHARED_VAULT));

        RewardsTree second = new RewardsTree().add(SHARED_VAULT, 60, 0);
        ledger.publish(second);
        HarvestResult penalty = harvest(SHARED_VAULT, second.params(SHARED_VAULT));
        assertEquals(BigInteger.valueOf(-40), penalty.getTotalAssetsDelta());
    }

    @Test
    void proofTwoGenerationsOldIsRejected() {
        collateralize(SHARED_VAULT);
        RewardsTree first = new RewardsTree().add(SHARED_VAULT, 100, 0);
        ledger.publish(first);
        ledger.publish(new RewardsTree().add(SHARED_VAULT, 200, 0));
        ledger.publish(new RewardsTree().add(SHARED_VAULT, 300, 0));

        VaultException e = assertThrows(VaultException.class, () -> harvest(SHARED_VAULT, first.params(SHARED_VAULT)));
        assertEquals(ErrorType.INVALID_PROOF, e.getErrorType());
        assertEquals(1, keeperRewards.getReward(SHARED_VAULT).getNonce());
    }

    @Test
    void previousRootCreditsPreviousNonce() {
        collateralize(SHARED_VAULT);
        RewardsTree first = new RewardsTree().add(SHARED_VAULT, 100, 0);
        RewardsTree second = new RewardsTree().add(SHARED_VAULT, 250, 0);
        ledger.publish(first);
        ledger.publish(second);

        HarvestResult late = harvest(SHARED_VAULT, first.params(SHARED_VAULT));
        assertTrue(late.isHarvested());
        assertEquals(first.root(), late.getRewardsRoot());
        assertEquals(new Reward(BigInteger.valueOf(100), 2), keeperRewards.getReward(SHARED_VAULT));
        // 仍可追上当前根
        assertTrue(keeperRewards.canHarvest(SHARED_VAULT, second.params(SHARED_VAULT)));

        HarvestResult current = harvest(SHARED_VAULT, second.params(SHARED_VAULT));
        assertEquals(BigInteger.valueOf(150), current.getTotalAssetsDelta());
        assertEquals(3, keeperRewards.getReward(SHARED_VAULT).getNonce());

        // 已同步到当前根后，上一根的证明不再产生增量
        HarvestResult stale = harvest(SHARED_VAULT, first.params(SHARED_VAULT));
        assertFalse(stale.isHarvested());
    }

    @Test
    void sharedEscrowTracksUnlockedMev() {
        collateralize(SHARED_VAULT);
        collateralize(OWN_VAULT);
        RewardsTree first = new RewardsTree().add(SHARED_VAULT, 100, 30).add(OWN_VAULT, 10, 99);
        ledger.publish(first);
        assertEquals(BigInteger.valueOf(30), harvest(SHARED_VAULT, first.params(SHARED_VAULT)).getUnlockedMevDelta());
        // 独立托管金库忽略共享MEV
        assertEquals(BigInteger.ZERO, harvest(OWN_VAULT, first.params(OWN_VAULT)).getUnlockedMevDelta());

        RewardsTree second = new RewardsTree().add(SHARED_VAULT, 150, 50);
        ledger.publish(second);
        HarvestResult result = harvest(SHARED_VAULT, second.params(SHARED_VAULT));
        assertEquals(BigInteger.valueOf(20), result.getUnlockedMevDelta());
        assertEquals(new Reward(BigInteger.valueOf(50), 3), keeperRewards.getUnlockedMevReward(SHARED_VAULT));
        assertEquals(Reward.empty(), keeperRewards.getUnlockedMevReward(OWN_VAULT));
    }

    @Test
    void decreasingUnlockedMevIsRejected() {
        collateralize(SHARED_VAULT);
        RewardsTree first = new RewardsTree().add(SHARED_VAULT, 100, 30);
        ledger.publish(first);
        harvest(SHARED_VAULT, first.params(SHARED_VAULT));

        RewardsTree second = new RewardsTree().add(SHARED_VAULT, 120, 10);
        ledger.publish(second);
        VaultException e = assertThrows(VaultException.class, () -> harvest(SHARED_VAULT, second.params(SHARED_VAULT)));
        assertEquals(ErrorType.INVALID_AMOUNT, e.getErrorType());
        // 整个收割回滚
        assertEquals(new Reward(BigInteger.valueOf(100), 2), keeperRewards.getReward(SHARED_VAULT));
    }

    @Test
    void unregisteredCallerIsDenied() {
        Address stranger = TestLedger.address(50);
        RewardsTree tree = new RewardsTree().add(stranger, 100, 0);
        ledger.publish(tree);
        VaultException e = assertThrows(VaultException.class, () -> harvest(stranger, tree.params(stranger)));
        assertEquals(ErrorType.ACCESS_DENIED, e.getErrorType());
    }

    @Test
    void tamperedProofOrValueIsRejected() {
        collateralize(SHARED_VAULT);
        RewardsTree tree = new RewardsTree()
                .add(SHARED_VAULT, 100, 0)
                .add(OWN_VAULT, 200, 0)
                .add(TestLedger.address(3), 300, 0);
        ledger.publish(tree);

        HarvestParams inflated = tree.params(SHARED_VAULT);
        inflated.setReward(BigInteger.valueOf(1_000_000));
        assertEquals(ErrorType.INVALID_PROOF,
                assertThrows(VaultException.class, () -> harvest(SHARED_VAULT, inflated)).getErrorType());

        HarvestParams tampered = tree.params(SHARED_VAULT);
        List<byte[]> proof = new ArrayList<>(tampered.getProof());
        byte[] first = proof.get(0).clone();
        first[0] ^= 0x40;
        proof.set(0, first);
        tampered.setProof(proof);
        assertFalse(keeperRewards.canHarvest(SHARED_VAULT, tampered));
        assertEquals(ErrorType.INVALID_PROOF,
                assertThrows(VaultException.class, () -> harvest(SHARED_VAULT, tampered)).getErrorType());

        // 借用其他金库的叶子也不行
        assertEquals(ErrorType.INVALID_PROOF,
                assertThrows(VaultException.class, () -> harvest(SHARED_VAULT, tree.params(OWN_VAULT))).getErrorType());
    }

    @Test
    void collateralizationAndStalenessFlags() {
        assertFalse(keeperRewards.isCollateralized(SHARED_VAULT));
        assertFalse(keeperRewards.isHarvestRequired(SHARED_VAULT));
        assertFalse(keeperRewards.canHarvest(SHARED_VAULT));
        assertFalse(keeperRewards.isStateUpdateRequired(SHARED_VAULT));

        collateralize(SHARED_VAULT);
        assertTrue(keeperRewards.isCollateralized(SHARED_VAULT));
        assertEquals(new Reward(BigInteger.ZERO, 1), keeperRewards.getReward(SHARED_VAULT));
        // 重复抵押不改变记录
        collateralize(SHARED_VAULT);
        assertEquals(1, keeperRewards.getReward(SHARED_VAULT).getNonce());

        ledger.publish(new RewardsTree().add(SHARED_VAULT, 1, 0));
        assertTrue(keeperRewards.isHarvestRequired(SHARED_VAULT));
        assertFalse(keeperRewards.isStateUpdateRequired(SHARED_VAULT));

        ledger.publish(new RewardsTree().add(SHARED_VAULT, 2, 0));
        assertTrue(keeperRewards.isStateUpdateRequired(SHARED_VAULT));
    }

    @Test
    void canHarvestWithParamsDoesNotMutate() {
        collateralize(SHARED_VAULT);
        RewardsTree tree = new RewardsTree().add(SHARED_VAULT, 100, 0);
        ledger.publish(tree);
        assertTrue(keeperRewards.canHarvest(SHARED_VAULT, tree.params(SHARED_VAULT)));
        assertTrue(keeperRewards.canHarvest(SHARED_VAULT, tree.params(SHARED_VAULT)));
        assertEquals(1, keeperRewards.getReward(SHARED_VAULT).getNonce());
    }

    private void collateralize(Address vault) {
        ledger.executor.execute(tx -> {
            keeperRewards.collateralize(tx, vault);
            return null;
        });
    }

    private HarvestResult harvest(Address vault, HarvestParams params) {
        return ledger.executor.execute(tx -> keeperRewards.harvest(tx, vault, params));
    }
}
