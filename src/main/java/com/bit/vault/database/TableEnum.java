package com.bit.vault.database;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 表枚举（集中管理所有表的元信息，RocksDB 中每张表对应一个列族）
 */
public enum TableEnum {
    // 预言机注册表：地址 -> 标记
    ORACLE((short) 1, "oracle"),
    // 共识全局状态：快照、法定人数
    KEEPER((short) 2, "keeper"),
    // 金库主奖励流：金库地址 -> 累计奖励与同步nonce
    REWARD((short) 3, "reward"),
    // 金库共享MEV奖励流：金库地址 -> 累计已解锁MEV与同步nonce
    MEV_REWARD((short) 4, "mev_reward"),
    // 金库状态：金库地址 -> 总份额/总资产/队列合计
    VAULT((short) 5, "vault"),
    // 份额余额：金库地址 + 账户地址 -> 份额
    SHARES((short) 6, "shares"),
    // 退出队列头：金库地址 -> 检查点数量与最新累计值
    EXIT_QUEUE((short) 7, "exit_queue"),
    // 检查点：金库地址 + 8字节大端索引 -> 检查点（只追加）
    CHECKPOINT((short) 8, "checkpoint"),
    // 退出请求：请求ID -> 持仓
    EXIT_REQUEST((short) 9, "exit_request"),
    // 共享MEV托管余额
    ESCROW((short) 10, "escrow"),
    // 已支付资产：接收方地址 -> 累计到账
    PAYOUT((short) 11, "payout");

    @Getter private final short code;  // 表唯一标识
    @Getter private final String columnFamilyName;  // 列族实际存储名称

    TableEnum(short code, String columnFamilyName) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
    }

    // 缓存：标识 -> 枚举实例
    private static final Map<Short, TableEnum> CODE_TO_ENUM = new HashMap<>();

    static {
        for (TableEnum table : values()) {
            CODE_TO_ENUM.put(table.code, table);
        }
    }

    public static TableEnum getByCode(short code) {
        return CODE_TO_ENUM.get(code);
    }
}
