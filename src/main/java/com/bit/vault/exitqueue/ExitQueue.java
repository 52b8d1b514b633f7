package com.bit.vault.exitqueue;

import com.bit.vault.common.Address;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.structure.exit.Checkpoint;
import com.bit.vault.structure.exit.ExitedAssets;
import com.bit.vault.util.ByteUtils;
import com.bit.vault.util.SafeCast;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.concurrent.TimeUnit;

/**
 * 按金库划分的退出队列账本
 * 每个检查点记录截至该点的累计票据与累计资产，只追加不修改；
 * 持仓按票据落入的检查点区间按比例结算，舍入偏向账本
 */
@Slf4j
@Component
public class ExitQueue {

    // 已提交的检查点不可变，可以放心缓存；事务内尚未提交的检查点不进缓存
    private final Cache<ByteBuffer, Checkpoint> checkpointCache = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .recordStats()
            .build();

    public int length(StateTransaction tx, Address vault) {
        byte[] data = tx.get(TableEnum.EXIT_QUEUE, vault.getBytes());
        return data == null ? 0 : ByteBuffer.wrap(data).getInt();
    }

    /**
     * @throws VaultException 下标越界时 INVALID_CHECKPOINT_INDEX
     */
    public Checkpoint getCheckpoint(StateTransaction tx, Address vault, int index) {
        if (index < 0 || index >= length(tx, vault)) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT_INDEX, "检查点下标越界: " + index);
        }
        return read(tx, vault, index);
    }

    /**
     * 最新检查点的累计值，空队列时为零
     */
    public Checkpoint latest(StateTransaction tx, Address vault) {
        int length = length(tx, vault);
        return length == 0 ? Checkpoint.ZERO : read(tx, vault, length - 1);
    }

    public BigInteger getLatestTotalTickets(StateTransaction tx, Address vault) {
        return latest(tx, vault).getTotalTickets();
    }

    /**
     * 追加检查点，唯一的修改入口
     * @param shares 本次处理的份额，必须大于0
     * @param assets 本次释放的资产，可以为0
     */
    public Checkpoint push(StateTransaction tx, Address vault, BigInteger shares, BigInteger assets) {
        if (shares == null || shares.signum() <= 0) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "检查点份额必须大于0");
        }
        if (assets == null || assets.signum() < 0) {
            throw new VaultException(ErrorType.INVALID_AMOUNT, "检查点资产不能为负");
        }
        int length = length(tx, vault);
        Checkpoint last = length == 0 ? Checkpoint.ZERO : read(tx, vault, length - 1);
        Checkpoint checkpoint = new Checkpoint(
                SafeCast.toUint160(last.getTotalTickets().add(shares)),
                SafeCast.toUint256(last.getTotalExitedAssets().add(assets)));
        tx.put(TableEnum.CHECKPOINT, checkpointKey(vault, length), checkpoint.serialize());
        tx.put(TableEnum.EXIT_QUEUE, vault.getBytes(), ByteBuffer.allocate(Integer.BYTES).putInt(length + 1).array());
        log.debug("金库{}追加检查点#{}，累计票据:{}，累计资产:{}",
                vault, length, checkpoint.getTotalTickets(), checkpoint.getTotalExitedAssets());
        return checkpoint;
    }

    /**
     * 二分查找第一个累计票据大于 ticket 的检查点
     * @return 检查点下标，票据尚未被任何检查点覆盖时返回 -1
     */
    public int getCheckpointIndex(StateTransaction tx, Address vault, BigInteger positionTicket) {
        int high = length(tx, vault);
        int low = 0;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (read(tx, vault, mid).getTotalTickets().compareTo(positionTicket) > 0) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return high == length(tx, vault) ? -1 : high;
    }

    /**
     * 计算持仓在指定检查点上可结算的份额与资产，不修改状态
     * exitedAssets = floor(exitedShares * 区间资产 / 区间票据)；剩余份额为 1 时视为已全部结算
     */
    public ExitedAssets calculateExitedAssets(StateTransaction tx, Address vault, BigInteger positionTicket,
                                              BigInteger positionShares, int checkpointIndex) {
        int length = length(tx, vault);
        if (checkpointIndex < 0 || checkpointIndex >= length || positionShares.signum() == 0) {
            return ExitedAssets.none(positionShares);
        }
        Checkpoint checkpoint = read(tx, vault, checkpointIndex);
        if (checkpoint.getTotalTickets().compareTo(positionTicket) <= 0) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT_INDEX,
                    "检查点#" + checkpointIndex + "未覆盖票据 " + positionTicket);
        }
        Checkpoint prev = checkpointIndex == 0 ? Checkpoint.ZERO : read(tx, vault, checkpointIndex - 1);
        if (prev.getTotalTickets().compareTo(positionTicket) > 0) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT_INDEX,
                    "票据 " + positionTicket + " 属于更早的检查点，而不是#" + checkpointIndex);
        }

        BigInteger ticketsDelta = checkpoint.getTotalTickets().subtract(prev.getTotalTickets());
        BigInteger assetsDelta = checkpoint.getTotalExitedAssets().subtract(prev.getTotalExitedAssets());
        BigInteger exitedShares = checkpoint.getTotalTickets().subtract(positionTicket).min(positionShares);
        BigInteger exitedAssets = exitedShares.multiply(assetsDelta).divide(ticketsDelta);
        BigInteger leftShares = positionShares.subtract(exitedShares);
        if (leftShares.equals(BigInteger.ONE)) {
            leftShares = BigInteger.ZERO;
        }
        return new ExitedAssets(leftShares, exitedShares, exitedAssets);
    }

    private Checkpoint read(StateTransaction tx, Address vault, int index) {
        byte[] key = checkpointKey(vault, index);
        ByteBuffer cacheKey = ByteBuffer.wrap(key);
        Checkpoint cached = checkpointCache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }
        byte[] committed = tx.getCommitted(TableEnum.CHECKPOINT, key);
        if (committed != null) {
            Checkpoint checkpoint = Checkpoint.deserialize(committed);
            checkpointCache.put(cacheKey, checkpoint);
            return checkpoint;
        }
        byte[] pending = tx.get(TableEnum.CHECKPOINT, key);
        if (pending == null) {
            throw new VaultException(ErrorType.INVALID_CHECKPOINT_INDEX, "检查点缺失，金库:" + vault + "，下标:" + index);
        }
        return Checkpoint.deserialize(pending);
    }

    private static byte[] checkpointKey(Address vault, int index) {
        return ByteUtils.concat(vault.getBytes(), ByteUtils.longToBytes(index));
    }

    int cachedCheckpoints() {
        return (int) checkpointCache.estimatedSize();
    }
}
