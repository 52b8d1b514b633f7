package com.bit.vault.oracle.impl;

import com.bit.vault.common.Address;
import com.bit.vault.config.KeeperConfig;
import com.bit.vault.database.StateTransaction;
import com.bit.vault.database.TableEnum;
import com.bit.vault.database.TransactionExecutor;
import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import com.bit.vault.oracle.OracleRegistry;
import com.bit.vault.structure.event.OracleAdded;
import com.bit.vault.structure.event.OracleRemoved;
import com.bit.vault.structure.event.RewardsMinOraclesUpdated;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class OracleRegistryImpl implements OracleRegistry {

    static final byte[] TOTAL_ORACLES_KEY = "totalOracles".getBytes(StandardCharsets.UTF_8);
    static final byte[] MIN_ORACLES_KEY = "rewardsMinOracles".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PRESENT = new byte[]{1};

    @Autowired
    private TransactionExecutor executor;

    @Autowired
    private KeeperConfig keeperConfig;

    /**
     * 首次启动时用配置中的预言机初始化注册表，已有数据时不覆盖
     */
    @PostConstruct
    public void init() {
        if (keeperConfig.getOracles().isEmpty()) {
            log.warn("未配置预言机，奖励快照在注册预言机之前无法更新");
            return;
        }
        executor.execute(tx -> {
            if (readInt(tx, TOTAL_ORACLES_KEY) > 0) {
                log.info("预言机注册表已存在，跳过配置初始化");
                return null;
            }
            for (String hex : keeperConfig.getOracles()) {
                add(tx, Address.fromHex(hex));
            }
            updateMinOracles(tx, keeperConfig.getRewardsMinOracles());
            log.info("预言机注册表初始化完成，预言机{}个，最少签名数{}",
                    keeperConfig.getOracles().size(), keeperConfig.getRewardsMinOracles());
            return null;
        });
    }

    @Override
    public void addOracle(Address oracle) {
        executor.execute(tx -> {
            add(tx, oracle);
            return null;
        });
    }

    @Override
    public void removeOracle(Address oracle) {
        executor.execute(tx -> {
            if (!isOracle(tx, oracle)) {
                throw new VaultException(ErrorType.INVALID_ORACLES, "预言机不存在: " + oracle);
            }
            int total = readInt(tx, TOTAL_ORACLES_KEY) - 1;
            if (total < readInt(tx, MIN_ORACLES_KEY)) {
                throw new VaultException(ErrorType.INVALID_ORACLES, "移除后预言机数量低于最少签名数");
            }
            tx.delete(TableEnum.ORACLE, oracle.getBytes());
            writeInt(tx, TOTAL_ORACLES_KEY, total);
            tx.emit(new OracleRemoved(oracle));
            log.info("移除预言机: {}", oracle);
            return null;
        });
    }

    @Override
    public void setRewardsMinOracles(int rewardsMinOracles) {
        executor.execute(tx -> {
            updateMinOracles(tx, rewardsMinOracles);
            return null;
        });
    }

    @Override
    public boolean isOracle(Address oracle) {
        return executor.query(tx -> isOracle(tx, oracle));
    }

    @Override
    public int getTotalOracles() {
        return executor.query(tx -> readInt(tx, TOTAL_ORACLES_KEY));
    }

    @Override
    public int getRewardsMinOracles() {
        return executor.query(this::getRewardsMinOracles);
    }

    @Override
    public List<Address> getOracles() {
        return executor.query(tx -> {
            List<Address> oracles = new ArrayList<>();
            tx.iterate(TableEnum.ORACLE, (key, value) -> {
                oracles.add(Address.fromBytes(key));
                return true;
            });
            return oracles;
        });
    }

    @Override
    public boolean isOracle(StateTransaction tx, Address oracle) {
        return oracle != null && tx.isExist(TableEnum.ORACLE, oracle.getBytes());
    }

    @Override
    public int getRewardsMinOracles(StateTransaction tx) {
        return readInt(tx, MIN_ORACLES_KEY);
    }

    private void add(StateTransaction tx, Address oracle) {
        if (oracle.isZero() || isOracle(tx, oracle)) {
            throw new VaultException(ErrorType.INVALID_ORACLES, "预言机地址无效或已存在: " + oracle);
        }
        tx.put(TableEnum.ORACLE, oracle.getBytes(), PRESENT);
        writeInt(tx, TOTAL_ORACLES_KEY, readInt(tx, TOTAL_ORACLES_KEY) + 1);
        tx.emit(new OracleAdded(oracle));
        log.info("添加预言机: {}", oracle);
    }

    private void updateMinOracles(StateTransaction tx, int rewardsMinOracles) {
        int total = readInt(tx, TOTAL_ORACLES_KEY);
        if (rewardsMinOracles <= 0 || rewardsMinOracles > total) {
            throw new VaultException(ErrorType.INVALID_ORACLES,
                    "最少签名数必须在 1 到 " + total + " 之间，实际为 " + rewardsMinOracles);
        }
        writeInt(tx, MIN_ORACLES_KEY, rewardsMinOracles);
        tx.emit(new RewardsMinOraclesUpdated(rewardsMinOracles));
    }

    private static int readInt(StateTransaction tx, byte[] key) {
        byte[] value = tx.get(TableEnum.KEEPER, key);
        return value == null ? 0 : ByteBuffer.wrap(value).getInt();
    }

    private static void writeInt(StateTransaction tx, byte[] key, int value) {
        tx.put(TableEnum.KEEPER, key, ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
    }
}
