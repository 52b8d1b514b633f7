package com.bit.vault.vault;

import com.bit.vault.common.Address;
import com.bit.vault.database.TableEnum;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.structure.event.CheckpointCreated;
import com.bit.vault.structure.event.ExitQueueEntered;
import com.bit.vault.structure.event.ExitedAssetsClaimed;
import com.bit.vault.structure.event.FeeSharesMinted;
import com.bit.vault.structure.exit.ClaimResult;
import com.bit.vault.structure.exit.ExitRequest;
import com.bit.vault.structure.exit.ExitedAssets;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.vault.VaultState;
import com.bit.vault.support.RewardsTree;
import com.bit.vault.support.TestLedger;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class VaultServiceTest {

    private static final Address VAULT = TestLedger.address(1);
    private static final Address ADMIN = TestLedger.address(100);
    private static final Address ALICE = TestLedger.address(201);
    private static final Address BOB = TestLedger.address(202);
    private static final Address CAROL = TestLedger.address(203);
    private static final Address FILLER = TestLedger.address(999);

    private TestLedger ledger;
    private VaultService vaultService;
    private int round;

    @BeforeEach
    void setUp() {
        ledger = new TestLedger(1, 1);
        vaultService = ledger.vaultService;
        round = 0;
    }

    @Test
    void fullExitLifecycle() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        assertEquals(big(100), vaultService.deposit(VAULT, ALICE, ALICE, big(100)));
        vaultService.registerValidator(VAULT, big(100));

        long enteredAt = ledger.clock.seconds();
        BigInteger ticket = vaultService.enterExitQueue(VAULT, ALICE, big(40), ALICE);
        assertEquals(BigInteger.ZERO, ticket);
        assertEquals(big(60), vaultService.getShares(VAULT, ALICE));
        assertEquals(-1, vaultService.getExitQueueIndex(VAULT, ticket));

        vaultService.receiveValidatorAssets(VAULT, big(50));
        HarvestResult result = updateState(0, 0);
        assertTrue(result.isHarvested());

        VaultState state = vaultService.getVaultState(VAULT);
        assertEquals(BigInteger.ZERO, state.getQueuedShares());
        assertEquals(big(40), state.getUnclaimedAssets());
        assertEquals(big(60), state.getTotalShares());
        assertEquals(big(60), state.getTotalAssets());
        assertEquals(1, ledger.events(CheckpointCreated.class).size());

        VaultException early = assertThrows(VaultException.class,
                () -> vaultService.claimExitedAssets(VAULT, ALICE, ticket, enteredAt, 0));
        assertEquals(ErrorType.CLAIM_TOO_EARLY, early.getErrorType());

        ledger.clock.advance(ledger.vaultConfig.getExitedAssetsClaimDelay());
        int index = vaultService.getExitQueueIndex(VAULT, ticket);
        assertEquals(0, index);
        ExitedAssets preview = vaultService.calculateExitedAssets(VAULT, ALICE, ticket, enteredAt, index);
        ClaimResult claim = vaultService.claimExitedAssets(VAULT, ALICE, ticket, enteredAt, index);

        assertEquals(preview.getExitedAssets(), claim.getClaimedAssets());
        assertEquals(big(40), claim.getClaimedAssets());
        assertEquals(BigInteger.ZERO, claim.getNewPositionTicket());
        assertEquals(big(40), ledger.payoutLedger.getPaid(ALICE));
        assertNull(vaultService.getExitRequest(VAULT, ALICE, ticket, enteredAt));

        state = vaultService.getVaultState(VAULT);
        assertEquals(BigInteger.ZERO, state.getUnclaimedAssets());
        assertEquals(big(10), state.getBalance());

        ExitedAssetsClaimed event = ledger.events(ExitedAssetsClaimed.class).get(0);
        assertEquals(ticket, event.getPrevPositionTicket());
        assertEquals(big(40), event.getWithdrawnAssets());

        VaultException again = assertThrows(VaultException.class,
                () -> vaultService.claimExitedAssets(VAULT, ALICE, ticket, enteredAt, index));
        assertEquals(ErrorType.EXIT_REQUEST_NOT_PROCESSED, again.getErrorType());
    }

    @Test
    void partialClaimCreatesSuccessorPosition() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        long enteredAt = ledger.clock.seconds();
        vaultService.enterExitQueue(VAULT, ALICE, big(60), ALICE);

        vaultService.receiveValidatorAssets(VAULT, big(30));
        updateState(0, 0);
        ledger.clock.advance(ledger.vaultConfig.getExitedAssetsClaimDelay());

        ClaimResult first = vaultService.claimExitedAssets(VAULT, ALICE, BigInteger.ZERO, enteredAt, 0);
        assertEquals(big(30), first.getClaimedShares());
        assertEquals(big(30), first.getClaimedAssets());
        assertEquals(big(30), first.getNewPositionTicket());
        assertNull(vaultService.getExitRequest(VAULT, ALICE, BigInteger.ZERO, enteredAt));
        ExitRequest successor = vaultService.getExitRequest(VAULT, ALICE, big(30), enteredAt);
        assertNotNull(successor);
        assertEquals(big(30), successor.getShares());

        // 后继持仓尚未被处理
        VaultException pending = assertThrows(VaultException.class,
                () -> vaultService.claimExitedAssets(VAULT, ALICE, big(30), enteredAt, 1));
        assertEquals(ErrorType.EXIT_REQUEST_NOT_PROCESSED, pending.getErrorType());

        vaultService.receiveValidatorAssets(VAULT, big(40));
        updateState(0, 0);
        int index = vaultService.getExitQueueIndex(VAULT, big(30));
        assertEquals(1, index);
        ClaimResult second = vaultService.claimExitedAssets(VAULT, ALICE, big(30), enteredAt, index);
        assertEquals(big(30), second.getClaimedAssets());
        assertEquals(BigInteger.ZERO, second.getNewPositionTicket());
        assertEquals(big(60), ledger.payoutLedger.getPaid(ALICE));
        assertEquals(BigInteger.ZERO, vaultService.getVaultState(VAULT).getUnclaimedAssets());
    }

    @Test
    void ticketsFollowArrivalOrder() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.deposit(VAULT, BOB, BOB, big(100));
        vaultService.deposit(VAULT, CAROL, CAROL, big(100));
        vaultService.registerValidator(VAULT, big(300));

        assertEquals(big(0), vaultService.enterExitQueue(VAULT, ALICE, big(40), ALICE));
        assertEquals(big(40), vaultService.enterExitQueue(VAULT, BOB, big(20), BOB));

        // 只够处理 ALICE 的部分
        vaultService.receiveValidatorAssets(VAULT, big(40));
        updateState(0, 0);
        assertEquals(big(20), vaultService.getVaultState(VAULT).getQueuedShares());

        // 新票据 = 最新检查点累计票据 + 仍在排队的份额
        assertEquals(big(60), vaultService.enterExitQueue(VAULT, CAROL, big(10), CAROL));
        assertEquals(0, vaultService.getExitQueueIndex(VAULT, big(0)));
        assertEquals(-1, vaultService.getExitQueueIndex(VAULT, big(40)));
        assertEquals(3, ledger.events(ExitQueueEntered.class).size());
    }

    @Test
    void profitMintsFeeShares() {
        vaultService.createVault(VAULT, ADMIN, null, 1_000, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(1_000));
        vaultService.registerValidator(VAULT, big(1_000));

        HarvestResult result = updateState(100, 0);
        assertEquals(big(100), result.getTotalAssetsDelta());

        VaultState state = vaultService.getVaultState(VAULT);
        assertEquals(big(1_100), state.getTotalAssets());
        // 10 * 1000 / (1100 - 10) = 9
        assertEquals(big(1_009), state.getTotalShares());
        assertEquals(big(9), vaultService.getShares(VAULT, ADMIN));
        FeeSharesMinted event = ledger.events(FeeSharesMinted.class).get(0);
        assertEquals(big(10), event.getAssets());
    }

    @Test
    void penaltyReducesTotalAssets() {
        vaultService.createVault(VAULT, ADMIN, null, 1_000, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));

        updateState(-30, 0);
        VaultState state = vaultService.getVaultState(VAULT);
        assertEquals(big(70), state.getTotalAssets());
        assertEquals(big(100), state.getTotalShares());
        assertTrue(ledger.events(FeeSharesMinted.class).isEmpty());
        assertEquals(big(35), vaultService.convertToAssets(VAULT, big(50)));
        assertEquals(big(100), vaultService.convertToShares(VAULT, big(70)));

        // 罚没超过总资产：整体回滚，奖励记录保持上一轮
        VaultException e = assertThrows(VaultException.class, () -> updateState(-200, 0));
        assertEquals(ErrorType.OVERFLOW, e.getErrorType());
        assertEquals(big(70), vaultService.getVaultState(VAULT).getTotalAssets());
        assertEquals(big(-30), ledger.keeperRewards.getReward(VAULT).getAssets());
    }

    @Test
    void depositRejectedAfterTotalAssetsWipedOut() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));

        updateState(-100, 0);
        VaultState wiped = vaultService.getVaultState(VAULT);
        assertEquals(BigInteger.ZERO, wiped.getTotalAssets());
        assertEquals(big(100), wiped.getTotalShares());

        // 按 1:1 铸造会把新存款分给已被罚没的持有人
        VaultException e = assertThrows(VaultException.class,
                () -> vaultService.deposit(VAULT, BOB, BOB, big(100)));
        assertEquals(ErrorType.INVALID_AMOUNT, e.getErrorType());
        assertEquals(BigInteger.ZERO, vaultService.getShares(VAULT, BOB));
        assertEquals(wiped, vaultService.getVaultState(VAULT));
        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(VaultException.class,
                () -> vaultService.convertToShares(VAULT, big(1))).getErrorType());
    }

    @Test
    void oneShareRemainderClaimClosesPosition() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        long enteredAt = ledger.clock.seconds();
        vaultService.enterExitQueue(VAULT, ALICE, big(10), ALICE);

        // 只够处理 9 份，检查点之后持仓剩 1 份
        vaultService.receiveValidatorAssets(VAULT, big(9));
        updateState(0, 0);
        assertEquals(big(1), vaultService.getVaultState(VAULT).getQueuedShares());
        ledger.clock.advance(ledger.vaultConfig.getExitedAssetsClaimDelay());

        ExitedAssets preview = vaultService.calculateExitedAssets(VAULT, ALICE, BigInteger.ZERO, enteredAt, 0);
        assertEquals(big(9), preview.getExitedShares());
        assertEquals(BigInteger.ZERO, preview.getLeftShares());

        ClaimResult claim = vaultService.claimExitedAssets(VAULT, ALICE, BigInteger.ZERO, enteredAt, 0);
        assertEquals(BigInteger.ZERO, claim.getNewPositionTicket());
        assertEquals(big(9), claim.getClaimedAssets());
        assertNull(vaultService.getExitRequest(VAULT, ALICE, BigInteger.ZERO, enteredAt));
        assertNull(vaultService.getExitRequest(VAULT, ALICE, big(9), enteredAt));
        assertEquals(0, ledger.dataBase.count(TableEnum.EXIT_REQUEST));
        assertEquals(BigInteger.ZERO, ledger.events(ExitedAssetsClaimed.class).get(0).getNewPositionTicket());
    }

    @Test
    void ownEscrowMevIsDrainedOnHarvest() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        vaultService.receiveMevReward(VAULT, big(5));
        assertEquals(big(5), vaultService.getVaultState(VAULT).getOwnMevBalance());

        HarvestResult result = updateState(0, 0);
        assertEquals(big(5), result.getTotalAssetsDelta());
        VaultState state = vaultService.getVaultState(VAULT);
        assertEquals(BigInteger.ZERO, state.getOwnMevBalance());
        assertEquals(big(5), state.getBalance());
        assertEquals(big(105), state.getTotalAssets());
    }

    @Test
    void sharedEscrowMevMovesUnlockedDelta() {
        vaultService.createVault(VAULT, ADMIN, null, 0, false);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        vaultService.receiveMevReward(VAULT, big(30));
        assertEquals(big(30), ledger.sharedMevEscrow.getBalance());

        HarvestResult result = updateState(30, 30);
        assertEquals(big(30), result.getUnlockedMevDelta());
        VaultState state = vaultService.getVaultState(VAULT);
        assertEquals(big(30), state.getBalance());
        assertEquals(big(130), state.getTotalAssets());
        assertEquals(BigInteger.ZERO, ledger.sharedMevEscrow.getBalance());

        // 快照声明的已解锁额度超过托管余额
        VaultException e = assertThrows(VaultException.class, () -> updateState(60, 60));
        assertEquals(ErrorType.INSUFFICIENT_ASSETS, e.getErrorType());
    }

    @Test
    void repeatedUpdateWithSameSnapshotIsNoop() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        vaultService.enterExitQueue(VAULT, ALICE, big(10), ALICE);
        vaultService.receiveValidatorAssets(VAULT, big(100));

        RewardsTree tree = nextTree(7, 0);
        ledger.publish(tree);
        assertTrue(vaultService.updateState(VAULT, tree.params(VAULT)).isHarvested());
        VaultState before = vaultService.getVaultState(VAULT);

        HarvestResult again = vaultService.updateState(VAULT, tree.params(VAULT));
        assertFalse(again.isHarvested());
        assertEquals(before, vaultService.getVaultState(VAULT));
        assertEquals(1, ledger.events(CheckpointCreated.class).size());
    }

    @Test
    void staleVaultMustUpdateBeforeDepositOrExit() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(100));
        ledger.publish(nextTree(0, 0));
        // 落后一个快照仍允许
        vaultService.deposit(VAULT, BOB, BOB, big(10));

        ledger.publish(nextTree(0, 0));
        assertEquals(ErrorType.NOT_HARVESTED, assertThrows(VaultException.class,
                () -> vaultService.deposit(VAULT, BOB, BOB, big(10))).getErrorType());
        assertEquals(ErrorType.NOT_HARVESTED, assertThrows(VaultException.class,
                () -> vaultService.enterExitQueue(VAULT, ALICE, big(10), ALICE)).getErrorType());
    }

    @Test
    void uncollateralizedVaultRedeemsInstantly() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));

        assertEquals(ErrorType.NOT_COLLATERALIZED, assertThrows(VaultException.class,
                () -> vaultService.enterExitQueue(VAULT, ALICE, big(10), ALICE)).getErrorType());

        assertEquals(big(40), vaultService.redeem(VAULT, ALICE, BOB, big(40)));
        assertEquals(big(40), ledger.payoutLedger.getPaid(BOB));
        assertEquals(big(60), vaultService.getShares(VAULT, ALICE));

        vaultService.registerValidator(VAULT, big(32));
        assertEquals(ErrorType.ACCESS_DENIED, assertThrows(VaultException.class,
                () -> vaultService.redeem(VAULT, ALICE, ALICE, big(10))).getErrorType());
    }

    @Test
    void invalidRequestsAreRejected() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(100));
        vaultService.registerValidator(VAULT, big(60));

        assertEquals(ErrorType.INSUFFICIENT_SHARES, assertThrows(VaultException.class,
                () -> vaultService.enterExitQueue(VAULT, ALICE, big(101), ALICE)).getErrorType());
        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(VaultException.class,
                () -> vaultService.enterExitQueue(VAULT, ALICE, BigInteger.ZERO, ALICE)).getErrorType());
        assertEquals(ErrorType.INSUFFICIENT_ASSETS, assertThrows(VaultException.class,
                () -> vaultService.registerValidator(VAULT, big(41))).getErrorType());
        assertEquals(ErrorType.VAULT_NOT_FOUND, assertThrows(VaultException.class,
                () -> vaultService.deposit(TestLedger.address(2), ALICE, ALICE, big(1))).getErrorType());
        assertEquals(ErrorType.ACCESS_DENIED, assertThrows(VaultException.class,
                () -> vaultService.createVault(VAULT, ADMIN, null, 0, true)).getErrorType());
        assertEquals(ErrorType.INVALID_AMOUNT, assertThrows(VaultException.class,
                () -> vaultService.createVault(TestLedger.address(3), ADMIN, null, 10_001, true)).getErrorType());
    }

    @Test
    void claimsNeverExceedCheckpointAssets() {
        vaultService.createVault(VAULT, ADMIN, null, 0, true);
        vaultService.deposit(VAULT, ALICE, ALICE, big(1_000));
        vaultService.deposit(VAULT, BOB, BOB, big(1_000));
        vaultService.registerValidator(VAULT, big(2_000));
        updateState(37, 0);

        long enteredAt = ledger.clock.seconds();
        BigInteger aliceTicket = vaultService.enterExitQueue(VAULT, ALICE, big(333), ALICE);
        BigInteger bobTicket = vaultService.enterExitQueue(VAULT, BOB, big(667), BOB);
        vaultService.receiveValidatorAssets(VAULT, big(2_000));
        updateState(37, 0);
        ledger.clock.advance(ledger.vaultConfig.getExitedAssetsClaimDelay());

        BigInteger released = ledger.events(CheckpointCreated.class).get(0).getAssets();
        ClaimResult alice = vaultService.claimExitedAssets(VAULT, ALICE, aliceTicket, enteredAt, 0);
        ClaimResult bob = vaultService.claimExitedAssets(VAULT, BOB, bobTicket, enteredAt, 0);
        assertTrue(alice.getClaimedAssets().add(bob.getClaimedAssets()).compareTo(released) <= 0);
        assertTrue(vaultService.getVaultState(VAULT).getUnclaimedAssets().signum() >= 0);
        log.info("释放资产{}，ALICE领取{}，BOB领取{}", released, alice.getClaimedAssets(), bob.getClaimedAssets());
    }

    /**
     * 发布只包含本金库当前累计奖励的新快照（加入轮次填充叶子保证每轮根不同）并更新状态
     */
    private HarvestResult updateState(long reward, long unlockedMev) {
        RewardsTree tree = nextTree(reward, unlockedMev);
        ledger.publish(tree);
        return vaultService.updateState(VAULT, tree.params(VAULT));
    }

    private RewardsTree nextTree(long reward, long unlockedMev) {
        round++;
        return new RewardsTree().add(VAULT, reward, unlockedMev).add(FILLER, round, 0);
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
