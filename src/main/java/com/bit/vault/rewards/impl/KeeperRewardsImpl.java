package com.bit.vault.rewards.impl;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.oracle.RewardsConsensus;
import com.bit.vault.rewards.KeeperRewards;
import com.bit.vault.rewards.RewardLeaf;
import com.bit.vault.structure.event.Harvested;
import com.bit.vault.structure.oracle.RewardsSnapshot;
import com.bit.vault.structure.reward.HarvestParams;
import com.bit.vault.structure.reward.HarvestResult;
import com.bit.vault.structure.reward.Reward;
import com.bit.vault.util.MerkleProof;
import com.bit.vault.vault.VaultsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Slf4j
@Component
public class KeeperRewardsImpl implements KeeperRewards {

    @Autowired
    private TransactionExecutor executor;

    @Autowired
    private RewardsConsensus rewardsConsensus;

    @Autowired
    private VaultsRegistry vaultsRegistry;

    @Override
    public HarvestResult harvest(StateTransaction tx, Address vault, HarvestParams params) {
        if (!vaultsRegistry.isVault(tx, vault)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "调用方不是注册金库: " + vault);
        }
        RewardsSnapshot snapshot = rewardsConsensus.getSnapshot(tx);
        ProvenRoot proven = prove(snapshot, vault, params);
        if (proven == null) {
            throw new VaultException(ErrorType.INVALID_PROOF, "证明对当前根与上一根均不成立，金库: " + vault);
        }

        Reward last = readReward(tx, TableEnum.REWARD, vault);
        if (last.getNonce() >= proven.nonce) {
            log.debug("金库{}已同步 nonce {}，跳过收割", vault, last.getNonce());
            return HarvestResult.skipped(proven.root);
        }

        BigInteger totalAssetsDelta = params.getReward().subtract(last.getAssets());
        writeReward(tx, TableEnum.REWARD, vault, new Reward(params.getReward(), proven.nonce));

        BigInteger unlockedMevDelta = BigInteger.ZERO;
        if (!vaultsRegistry.getVault(tx, vault).isOwnMevEscrow()) {
            Reward lastMev = readReward(tx, TableEnum.MEV_REWARD, vault);
            unlockedMevDelta = params.getUnlockedMevReward().subtract(lastMev.getAssets());
            if (unlockedMevDelta.signum() < 0) {
                throw new VaultException(ErrorType.INVALID_AMOUNT, "已解锁MEV奖励不能减少: " + unlockedMevDelta);
            }
            writeReward(tx, TableEnum.MEV_REWARD, vault, new Reward(params.getUnlockedMevReward(), proven.nonce));
        }

        tx.emit(new Harvested(vault, proven.root, totalAssetsDelta, unlockedMevDelta));
        log.info("金库{}收割完成，根:{}，nonce:{}，奖励增量:{}，MEV增量:{}",
                vault, proven.root, proven.nonce, totalAssetsDelta, unlockedMevDelta);
        return new HarvestResult(totalAssetsDelta, unlockedMevDelta, true, proven.root);
    }

    @Override
    public boolean canHarvest(Address vault) {
        return executor.query(tx -> canHarvest(tx, vault));
    }

    @Override
    public boolean canHarvest(Address vault, HarvestParams params) {
        return executor.query(tx -> {
            if (!canHarvest(tx, vault)) {
                return false;
            }
            ProvenRoot proven = prove(rewardsConsensus.getSnapshot(tx), vault, params);
            return proven != null && readReward(tx, TableEnum.REWARD, vault).getNonce() < proven.nonce;
        });
    }

    @Override
    public boolean isHarvestRequired(Address vault) {
        return executor.query(tx -> isHarvestRequired(tx, vault));
    }

    @Override
    public boolean isHarvestRequired(StateTransaction tx, Address vault) {
        long nonce = readReward(tx, TableEnum.REWARD, vault).getNonce();
        return nonce != 0 && nonce != rewardsConsensus.getSnapshot(tx).getNonce();
    }

    @Override
    public boolean isCollateralized(Address vault) {
        return executor.query(tx -> isCollateralized(tx, vault));
    }

    @Override
    public boolean isCollateralized(StateTransaction tx, Address vault) {
        return readReward(tx, TableEnum.REWARD, vault).getNonce() != 0;
    }

    @Override
    public void collateralize(StateTransaction tx, Address vault) {
        if (!vaultsRegistry.isVault(tx, vault)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "调用方不是注册金库: " + vault);
        }
        if (isCollateralized(tx, vault)) {
            return;
        }
        long nonce = rewardsConsensus.getSnapshot(tx).getNonce();
        writeReward(tx, TableEnum.REWARD, vault, new Reward(BigInteger.ZERO, nonce));
        log.info("金库{}已抵押，起始 nonce:{}", vault, nonce);
    }

    @Override
    public boolean isStateUpdateRequired(Address vault) {
        return executor.query(tx -> isStateUpdateRequired(tx, vault));
    }

    @Override
    public boolean isStateUpdateRequired(StateTransaction tx, Address vault) {
        long nonce = readReward(tx, TableEnum.REWARD, vault).getNonce();
        return nonce != 0 && nonce + 1 < rewardsConsensus.getSnapshot(tx).getNonce();
    }

    @Override
    public Reward getReward(Address vault) {
        return executor.query(tx -> readReward(tx, TableEnum.REWARD, vault));
    }

    @Override
    public Reward getUnlockedMevReward(Address vault) {
        return executor.query(tx -> readReward(tx, TableEnum.MEV_REWARD, vault));
    }

    private boolean canHarvest(StateTransaction tx, Address vault) {
        long nonce = readReward(tx, TableEnum.REWARD, vault).getNonce();
        return nonce != 0 && nonce < rewardsConsensus.getSnapshot(tx).getNonce();
    }

    /**
     * 先对当前根校验，再对上一根校验（上一根收割记入 nonce - 1）
     */
    private ProvenRoot prove(RewardsSnapshot snapshot, Address vault, HarvestParams params) {
        if (params == null || params.getReward() == null || params.getUnlockedMevReward() == null) {
            throw new VaultException(ErrorType.INVALID_PROOF, "收割参数不完整");
        }
        byte[] leaf = RewardLeaf.hash(vault, params.getReward(), params.getUnlockedMevReward());
        RewardsRoot current = snapshot.getRewardsRoot();
        if (!current.isZero() && MerkleProof.verify(params.getProof(), current.getBytes(), leaf)) {
            return new ProvenRoot(current, snapshot.getNonce());
        }
        RewardsRoot previous = snapshot.getPrevRewardsRoot();
        if (!previous.isZero() && MerkleProof.verify(params.getProof(), previous.getBytes(), leaf)) {
            return new ProvenRoot(previous, snapshot.getNonce() - 1);
        }
        return null;
    }

    private static Reward readReward(StateTransaction tx, TableEnum table, Address vault) {
        byte[] data = tx.get(table, vault.getBytes());
        return data == null ? Reward.empty() : Reward.deserialize(data);
    }

    private static void writeReward(StateTransaction tx, TableEnum table, Address vault, Reward reward) {
        tx.put(table, vault.getBytes(), reward.serialize());
    }

    private static final class ProvenRoot {
        private final RewardsRoot root;
        private final long nonce;

        private ProvenRoot(RewardsRoot root, long nonce) {
            this.root = root;
            this.nonce = nonce;
        }
    }
}
