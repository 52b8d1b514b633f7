package com.bit.vault.database;

import com.bit.vault.config.SystemConfig;

import java.util.List;

//KV数据库操作
public interface DataBase {

    /**
     * 创建数据库
     * @param config
     * @return
     */
    boolean createDatabase(SystemConfig config);

    /**
     * 关闭数据库
     * @return
     */
    boolean closeDatabase();

    /**
     * 判断是否存在
     * @param table
     * @param key
     * @return
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据
     * @return 不存在时返回 null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 事务完成：所有操作要么全部写入，要么全部不写入
     */
    boolean dataTransaction(List<DbOperation> operations);

    /**
     * 迭代器遍历（按键的无符号字节序）
     * @param table 表名
     * @param handler 迭代器处理器（处理每条键值对）
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    void close();
}
