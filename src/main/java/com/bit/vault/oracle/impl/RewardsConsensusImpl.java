package com.bit.vault.oracle.impl;

import com.bit.vault.common.Address;
import com.bit.vault.common.RewardsRoot;
import com.bit.vault.config.KeeperConfig;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.oracle.OracleRegistry;
import com.bit.vault.oracle.OracleSignatureVerifier;
import com.bit.vault.oracle.RewardsConsensus;
import com.bit.vault.oracle.RewardsTypedData;
import com.bit.vault.structure.event.RewardsUpdated;
import com.bit.vault.structure.oracle.RewardsSnapshot;
import com.bit.vault.structure.oracle.RewardsUpdateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Slf4j
@Component
public class RewardsConsensusImpl implements RewardsConsensus {

    static final byte[] SNAPSHOT_KEY = "rewardsSnapshot".getBytes(StandardCharsets.UTF_8);

    @Autowired
    private TransactionExecutor executor;

    @Autowired
    private OracleRegistry oracleRegistry;

    @Autowired
    private OracleSignatureVerifier signatureVerifier;

    @Autowired
    private RewardsTypedData typedData;

    @Autowired
    private KeeperConfig keeperConfig;

    @Override
    public RewardsSnapshot updateRewards(Address caller, RewardsUpdateParams params) {
        try {
            return executor.execute(tx -> update(tx, caller, params));
        } catch (VaultException e) {
            log.warn("奖励快照被拒绝，提交者:{}，原因:{}", caller, e.getMessage());
            throw e;
        }
    }

    private RewardsSnapshot update(StateTransaction tx, Address caller, RewardsUpdateParams params) {
        if (!oracleRegistry.isOracle(tx, caller)) {
            throw new VaultException(ErrorType.ACCESS_DENIED, "提交者不是预言机: " + caller);
        }
        RewardsSnapshot snapshot = getSnapshot(tx);
        RewardsRoot root = params.getRewardsRoot();
        if (root == null || root.isZero() || root.equals(snapshot.getRewardsRoot())) {
            throw new VaultException(ErrorType.INVALID_ROOT, "奖励根为空或与当前根相同");
        }
        long now = tx.getTimestamp();
        if (params.getUpdateTimestamp() > now) {
            throw new VaultException(ErrorType.FUTURE_TIMESTAMP,
                    "快照时间 " + params.getUpdateTimestamp() + " 晚于当前时间 " + now);
        }
        long earliest = snapshot.getUpdateTimestamp() + keeperConfig.getRewardsDelay();
        if (params.getUpdateTimestamp() <= earliest) {
            throw new VaultException(ErrorType.TOO_EARLY_UPDATE,
                    "快照时间必须晚于 " + earliest + "，实际为 " + params.getUpdateTimestamp());
        }

        byte[] digest = typedData.hashRewards(root, params.getRewardsIpfsHash(),
                params.getUpdateTimestamp(), snapshot.getNonce());
        signatureVerifier.verify(tx, digest, params.getSignatures());

        RewardsSnapshot next = new RewardsSnapshot(
                root,
                snapshot.getRewardsRoot(),
                snapshot.getNonce() + 1,
                params.getUpdateTimestamp());
        tx.put(TableEnum.KEEPER, SNAPSHOT_KEY, next.serialize());
        tx.emit(new RewardsUpdated(caller, root, params.getRewardsIpfsHash(),
                params.getUpdateTimestamp(), next.getNonce()));
        log.info("奖励快照已更新，根:{}，nonce:{}，快照时间:{}", root, next.getNonce(), params.getUpdateTimestamp());
        return next;
    }

    @Override
    public boolean canUpdateRewards() {
        return executor.query(tx ->
                tx.getTimestamp() >= getSnapshot(tx).getUpdateTimestamp() + keeperConfig.getRewardsDelay());
    }

    @Override
    public RewardsSnapshot getSnapshot() {
        return executor.query(this::getSnapshot);
    }

    @Override
    public RewardsSnapshot getSnapshot(StateTransaction tx) {
        byte[] data = tx.get(TableEnum.KEEPER, SNAPSHOT_KEY);
        return data == null ? RewardsSnapshot.initial() : RewardsSnapshot.deserialize(data);
    }

    @Override
    public byte[] rewardsDigest(RewardsUpdateParams params) {
        return executor.query(tx -> typedData.hashRewards(params.getRewardsRoot(), params.getRewardsIpfsHash(),
                params.getUpdateTimestamp(), getSnapshot(tx).getNonce()));
    }
}
