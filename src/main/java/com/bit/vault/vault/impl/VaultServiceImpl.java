package com.bit.vault.vault.impl;

import com.bit.vault.common.Address;
import com.bit.vault.config.VaultConfig;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.exitqueue.ExitQueue;
import com.bit.vault.mev.SharedMevEscrow;
import com.bit.vault.rewards.KeeperRewards;
import com.bit.vault.structure.event.CheckpointCreated;
import com.bit.vault.structure.event.Deposited;
import com.bit.vault.structure.event.ExitQueueEntered;
import com.bit.vault.structure.event.ExitedAssetsClaimed;
import com.bit.vault.structure.event.FeeSharesMinted;
import com.bit.vault.structure.event.Redeemed;
import com.bit.vault.structure.event.ValidatorRegistered;
import com.bit.vault.structure.event.VaultCreated;
import com.bit.vault.structure.exit.ClaimResult;
import com.bit.vault.structure.exit.ExitRequest;
import com.bit.vault.structure.exit.ExitedAssets;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.vault.VaultState;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.vault.AssetTransfer;
import com.bit.vault.vault.VaultService;
import com.bit.vault.vault.VaultsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Slf4j
@Component
public class VaultServiceImpl implements VaultService {

    private static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(10_000);

    @Autowired
    private TransactionExecutor executor;

    @Autowired
    private VaultsRegistry vaultsRegistry;

    @Autowired
    private KeeperRewards keeperRewards;

    @Autowired
    private SharedMevEscrow sharedMevEscrow;

    @Autowired
    private ExitQueue exitQueue;

    @Autowired
    private AssetTransfer assetTransfer;

    @Autowired
    private VaultConfig vaultConfig;

    @Override
    public VaultState createVault(Address vault, Address admin, Address feeRecipient, int feePercent,
                                  boolean ownMevEscrow) {
        return executor.execute(tx -> {
            if (vault == null || vault.isZero() || vaultsRegistry.isVault(tx, vault)) {
                throw new VaultException(ErrorType.ACCESS_DENIED, "金库地址无效或已注册: " + vault);
            }
            if (admin == null || admin.isZero()) {
                throw new VaultException(ErrorType.ACCESS_DENIED, "金库管理员地址为空");
            }
            if (feePercent < 0 || feePercent > vaultConfig.getMaxFeePercent()) {
                throw new VaultException(ErrorType.INVALID_AMOUNT, "手续费超出范围: " + feePercent);
            }
            VaultState state = VaultState.builder()
                    .vault(vault)
                    .admin(admin)
                    .feeRecipient(feeRecipient == null || feeRecipient.isZero() ? admin : feeRecipient)
                    .feePercent(feePercent)
                    .ownMevEscrow(ownMevEscrow)
                    .build();
            vaultsRegistry.saveVault(tx, state);
            tx.emit(new VaultCreated(vault, admin, feePercent, ownMevEscrow));
            log.info("创建金库:{}，手续费:{}bp，独立MEV托管:{}", vault, feePercent, ownMevEscrow);
            return state;
        });
    }

    @Override
    public BigInteger deposit(Address vault, Address caller, Address receiver, BigInteger assets) {
        return executor.execute(tx -> {
            checkPositive(assets, "存入金额");
            checkReceiver(receiver);
            VaultState state = vaultsRegistry.getVault(tx, vault);
            checkHarvested(tx, vault);

            BigInteger shares = state.convertToShares(assets);
            if (shares.signum() == 0) {
                throw new VaultException(ErrorType.INVALID_AMOUNT, "存入金额过小，铸造份额为0");
            }
            state.setTotalShares(state.getTotalShares().add(shares));
            state.setTotalAssets(state.getTotalAssets().add(assets));
            state.setBalance(state.getBalance().add(assets));
            addShares(tx, vault, receiver, shares);
            vaultsRegistry.saveVault(tx, state);

            tx.emit(new Deposited(vault, caller, receiver, assets, shares));
            log.info("金库{}存入{}，接收方{}获得份额{}", vault, assets, receiver, shares);
            return shares;
        });
    }

    @Override
    public BigInteger redeem(Address vault, Address owner, Address receiver, BigInteger shares) {
        return executor.execute(tx -> {
            checkPositive(shares, "赎回份额");
            checkReceiver(receiver);
            VaultState state = vaultsRegistry.getVault(tx, vault);
            if (keeperRewards.isCollateralized(tx, vault)) {
                throw new VaultException(ErrorType.ACCESS_DENIED, "金库已抵押，只能通过退出队列赎回");
            }
            BigInteger assets = state.convertToAssets(shares);
            if (assets.compareTo(state.availableAssets()) > 0) {
                throw new VaultException(ErrorType.INSUFFICIENT_ASSETS, "金库流动资产不足，需要 " + assets);
            }
            subtractShares(tx, vault, owner, shares);
            state.setTotalShares(state.getTotalShares().subtract(shares));
            state.setTotalAssets(state.getTotalAssets().subtract(assets));
            state.setBalance(state.getBalance().subtract(assets));
            vaultsRegistry.saveVault(tx, state);

            tx.emit(new Redeemed(vault, owner, receiver, assets, shares));
            assetTransfer.transfer(tx, vault, receiver, assets);
            return assets;
        });
    }

    @Override
    public void registerValidator(Address vault, BigInteger depositAssets) {
        executor.execute(tx -> {
            checkPositive(depositAssets, "验证者押金");
            VaultState state = vaultsRegistry.getVault(tx, vault);
            checkHarvested(tx, vault);
            if (depositAssets.compareTo(state.availableAssets()) > 0) {
                throw new VaultException(ErrorType.INSUFFICIENT_ASSETS,
                        "可用资产 " + state.availableAssets() + " 不足以注册验证者");
            }
            state.setBalance(state.getBalance().subtract(depositAssets));
            vaultsRegistry.saveVault(tx, state);
            keeperRewards.collateralize(tx, vault);
            tx.emit(new ValidatorRegistered(vault, depositAssets));
            log.info("金库{}注册验证者，押金{}", vault, depositAssets);
            return null;
        });
    }

    @Override
    public void receiveValidatorAssets(Address vault, BigInteger assets) {
        executor.execute(tx -> {
            checkPositive(assets, "共识层提款");
            VaultState state = vaultsRegistry.getVault(tx, vault);
            state.setBalance(state.getBalance().add(assets));
            vaultsRegistry.saveVault(tx, state);
            log.debug("金库{}收到共识层提款{}", vault, assets);
            return null;
        });
    }

    @Override
    public void receiveMevReward(Address vault, BigInteger assets) {
        executor.execute(tx -> {
            checkPositive(assets, "执行层奖励");
            VaultState state = vaultsRegistry.getVault(tx, vault);
            if (state.isOwnMevEscrow()) {
                state.setOwnMevBalance(state.getOwnMevBalance().add(assets));
                vaultsRegistry.saveVault(tx, state);
            } else {
                sharedMevEscrow.receive(tx, assets);
            }
            return null;
        });
    }

    @Override
    public BigInteger enterExitQueue(Address vault, Address owner, BigInteger shares, Address receiver) {
        return executor.execute(tx -> {
            checkPositive(shares, "退出份额");
            checkReceiver(receiver);
            VaultState state = vaultsRegistry.getVault(tx, vault);
            if (!keeperRewards.isCollateralized(tx, vault)) {
                throw new VaultException(ErrorType.NOT_COLLATERALIZED, "金库未抵押，请直接赎回: " + vault);
            }
            checkHarvested(tx, vault);

            // 票据在累加排队份额之前读取
            BigInteger positionTicket = exitQueue.getLatestTotalTickets(tx, vault).add(state.getQueuedShares());
            subtractShares(tx, vault, owner, shares);
            state.setQueuedShares(state.getQueuedShares().add(shares));
            vaultsRegistry.saveVault(tx, state);

            ExitRequest request = new ExitRequest(vault, receiver, tx.getTimestamp(), positionTicket, shares);
            tx.put(TableEnum.EXIT_REQUEST, request.id(), request.serialize());
            tx.emit(new ExitQueueEntered(vault, owner, receiver, positionTicket, shares));
            log.info("金库{}：{}的{}份额进入退出队列，票据:{}", vault, owner, shares, positionTicket);
            return positionTicket;
        });
    }

    @Override
    public HarvestResult updateState(Address vault, HarvestParams params) {
        return executor.execute(tx -> {
            VaultState state = vaultsRegistry.getVault(tx, vault);
            HarvestResult result = keeperRewards.harvest(tx, vault, params);
            if (!result.isHarvested()) {
                return result;
            }

            BigInteger totalAssetsDelta = result.getTotalAssetsDelta();
            if (state.isOwnMevEscrow()) {
                BigInteger mev = state.getOwnMevBalance();
                if (mev.signum() > 0) {
                    state.setOwnMevBalance(BigInteger.ZERO);
                    state.setBalance(state.getBalance().add(mev));
                    totalAssetsDelta = totalAssetsDelta.add(mev);
                }
            } else if (result.getUnlockedMevDelta().signum() > 0) {
                BigInteger mev = sharedMevEscrow.harvest(tx, vault, result.getUnlockedMevDelta());
                state.setBalance(state.getBalance().add(mev));
            }

            processTotalAssetsDelta(tx, state, totalAssetsDelta);
            updateExitQueue(tx, state);
            vaultsRegistry.saveVault(tx, state);
            return new HarvestResult(totalAssetsDelta, result.getUnlockedMevDelta(), true, result.getRewardsRoot());
        });
    }

    /**
     * 收益按比例收取手续费份额，罚没直接从总资产扣除
     */
    private void processTotalAssetsDelta(StateTransaction tx, VaultState state, BigInteger delta) {
        if (delta.signum() == 0) {
            return;
        }
        if (delta.signum() < 0) {
            BigInteger totalAssets = state.getTotalAssets().add(delta);
            if (totalAssets.signum() < 0) {
                throw new VaultException(ErrorType.OVERFLOW, "罚没 " + delta.negate() + " 超过总资产");
            }
            state.setTotalAssets(totalAssets);
            log.warn("金库{}发生罚没{}，总资产降为{}", state.getVault(), delta.negate(), totalAssets);
            return;
        }

        BigInteger newTotalAssets = state.getTotalAssets().add(delta);
        BigInteger feeAssets = delta.multiply(BigInteger.valueOf(state.getFeePercent())).divide(FEE_DENOMINATOR);
        state.setTotalAssets(newTotalAssets);
        if (feeAssets.signum() == 0) {
            return;
        }
        BigInteger denominator = newTotalAssets.subtract(feeAssets);
        BigInteger feeShares = state.getTotalShares().signum() == 0 || denominator.signum() == 0
                ? feeAssets
                : feeAssets.multiply(state.getTotalShares()).divide(denominator);
        if (feeShares.signum() == 0) {
            return;
        }
        state.setTotalShares(state.getTotalShares().add(feeShares));
        addShares(tx, state.getVault(), state.getFeeRecipient(), feeShares);
        tx.emit(new FeeSharesMinted(state.getVault(), state.getFeeRecipient(), feeShares, feeAssets));
        log.info("金库{}收益{}，手续费份额{}铸造给{}", state.getVault(), delta, feeShares, state.getFeeRecipient());
    }

    /**
     * 用未划给退出队列的流动资产处理排队份额，生成一个新检查点
     */
    private void updateExitQueue(StateTransaction tx, VaultState state) {
        BigInteger queuedShares = state.getQueuedShares();
        if (queuedShares.signum() == 0) {
            return;
        }
        BigInteger exitedAssets = state.availableAssets().min(state.convertToAssets(queuedShares));
        if (exitedAssets.signum() == 0) {
            return;
        }
        BigInteger burnedShares = state.convertToShares(exitedAssets).min(queuedShares);
        if (burnedShares.signum() == 0) {
            return;
        }
        exitQueue.push(tx, state.getVault(), burnedShares, exitedAssets);

        state.setQueuedShares(queuedShares.subtract(burnedShares));
        state.setUnclaimedAssets(state.getUnclaimedAssets().add(exitedAssets));
        state.setTotalShares(state.getTotalShares().subtract(burnedShares));
        state.setTotalAssets(state.getTotalAssets().subtract(exitedAssets));
        tx.emit(new CheckpointCreated(state.getVault(), burnedShares, exitedAssets));
        log.info("金库{}生成检查点，处理份额{}，释放资产{}", state.getVault(), burnedShares, exitedAssets);
    }

    @Override
    public ClaimResult claimExitedAssets(Address vault, Address receiver, BigInteger positionTicket, long timestamp,
                                         int checkpointIndex) {
        return executor.execute(tx -> {
            VaultState state = vaultsRegistry.getVault(tx, vault);
            if (tx.getTimestamp() < timestamp + vaultConfig.getExitedAssetsClaimDelay()) {
                throw new VaultException(ErrorType.CLAIM_TOO_EARLY,
                        "入队时间 " + timestamp + " 起需等待 " + vaultConfig.getExitedAssetsClaimDelay() + " 秒");
            }
            ExitRequest request = readRequest(tx, vault, receiver, positionTicket, timestamp);
            BigInteger positionShares = request == null ? BigInteger.ZERO : request.getShares();
            ExitedAssets exited = exitQueue.calculateExitedAssets(tx, vault, positionTicket, positionShares,
                    checkpointIndex);
            if (exited.getExitedAssets().signum() == 0) {
                throw new VaultException(ErrorType.EXIT_REQUEST_NOT_PROCESSED,
                        "票据 " + positionTicket + " 尚未被检查点处理");
            }

            tx.delete(TableEnum.EXIT_REQUEST, request.id());
            BigInteger newPositionTicket = BigInteger.ZERO;
            if (exited.getLeftShares().signum() > 0) {
                ExitRequest successor = request.successor(exited.getExitedShares(), exited.getLeftShares());
                tx.put(TableEnum.EXIT_REQUEST, successor.id(), successor.serialize());
                newPositionTicket = successor.getPositionTicket();
            }

            BigInteger claimedAssets = exited.getExitedAssets();
            state.setUnclaimedAssets(state.getUnclaimedAssets().subtract(claimedAssets));
            state.setBalance(state.getBalance().subtract(claimedAssets));
            vaultsRegistry.saveVault(tx, state);

            tx.emit(new ExitedAssetsClaimed(vault, receiver, positionTicket, newPositionTicket, claimedAssets));
            log.info("金库{}：{}领取退出资产{}，票据{} -> {}", vault, receiver, claimedAssets, positionTicket,
                    newPositionTicket);
            assetTransfer.transfer(tx, vault, receiver, claimedAssets);
            return new ClaimResult(newPositionTicket, exited.getExitedShares(), claimedAssets);
        });
    }

    @Override
    public ExitedAssets calculateExitedAssets(Address vault, Address receiver, BigInteger positionTicket,
                                              long timestamp, int checkpointIndex) {
        return executor.query(tx -> {
            ExitRequest request = readRequest(tx, vault, receiver, positionTicket, timestamp);
            if (request == null) {
                return ExitedAssets.none(BigInteger.ZERO);
            }
            return exitQueue.calculateExitedAssets(tx, vault, positionTicket, request.getShares(), checkpointIndex);
        });
    }

    @Override
    public int getExitQueueIndex(Address vault, BigInteger positionTicket) {
        return executor.query(tx -> exitQueue.getCheckpointIndex(tx, vault, positionTicket));
    }

    @Override
    public ExitRequest getExitRequest(Address vault, Address receiver, BigInteger positionTicket, long timestamp) {
        return executor.query(tx -> readRequest(tx, vault, receiver, positionTicket, timestamp));
    }

    @Override
    public BigInteger convertToShares(Address vault, BigInteger assets) {
        return executor.query(tx -> vaultsRegistry.getVault(tx, vault).convertToShares(assets));
    }

    @Override
    public BigInteger convertToAssets(Address vault, BigInteger shares) {
        return executor.query(tx -> vaultsRegistry.getVault(tx, vault).convertToAssets(shares));
    }

    @Override
    public VaultState getVaultState(Address vault) {
        return executor.query(tx -> vaultsRegistry.getVault(tx, vault));
    }

    @Override
    public BigInteger getShares(Address vault, Address holder) {
        return executor.query(tx -> shares(tx, vault, holder));
    }

    private void checkHarvested(StateTransaction tx, Address vault) {
        if (keeperRewards.isStateUpdateRequired(tx, vault)) {
            throw new VaultException(ErrorType.NOT_HARVESTED, "金库落后多个奖励快照，请先更新状态: " + vault);
        }
    }

    private static ExitRequest readRequest(StateTransaction tx, Address vault, Address receiver,
                                           BigInteger positionTicket, long timestamp) {
        byte[] data = tx.get(TableEnum.EXIT_REQUEST, ExitRequest.id(vault, receiver, timestamp, positionTicket));
        return data == null ? null : ExitRequest.deserialize(data);
    }

    private static BigInteger shares(StateTransaction tx, Address vault, Address holder) {
        byte[] data = tx.get(TableEnum.SHARES, sharesKey(vault, holder));
        return data == null ? BigInteger.ZERO : new BigInteger(data);
    }

    private static void addShares(StateTransaction tx, Address vault, Address holder, BigInteger shares) {
        tx.put(TableEnum.SHARES, sharesKey(vault, holder), shares(tx, vault, holder).add(shares).toByteArray());
    }

    private static void subtractShares(StateTransaction tx, Address vault, Address holder, BigInteger shares) {
        BigInteger balance = shares(tx, vault, holder);
        if (balance.compareTo(shares) < 0) {
            throw new VaultException(ErrorType.INSUFFICIENT_SHARES,
                    holder + " 份额 " + balance + " 不足 " + shares);
        }
        BigInteger left = balance.subtract(shares);
        if (left.signum() == 0) {
            tx.delete(TableEnum.SHARES, sharesKey(vault, holder));
        } else {
            tx.put(TableEnum.SHARES, sharesKey(vault, holder), left.toByteArray());
        }
    }

    private static byte[] sharesKey(Address vault, Address holder) {
        return ByteUtils.concat(vault.getBytes(), holder.getBytes());
    }

    private static void checkPositive(BigInteger amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, name + "必须大于0");
        }
    }

    private static void checkReceiver(Address receiver) {
        if (receiver == null || receiver.isZero()) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "接收方地址为空");
        }
    }
}
