package com.bit.vault.database;

import com.google.common.primitives.UnsignedBytes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一次业务操作的状态事务
 * 写入先缓存在本地（同一事务内可读到自己的写入），成功结束后整体提交；
 * 事件在提交之后才对外发布，失败时写入与事件一起丢弃
 */
public class StateTransaction {

    private final DataBase dataBase;
    private final long timestamp;
    private final boolean readOnly;

    private final Map<TableEnum, TreeMap<byte[], DbOperation>> pending = new EnumMap<>(TableEnum.class);
    private final List<Object> events = new ArrayList<>();

    public StateTransaction(DataBase dataBase, long timestamp, boolean readOnly) {
        this.dataBase = dataBase;
        this.timestamp = timestamp;
        this.readOnly = readOnly;
    }

    /**
     * 事务时间（秒），同一事务内所有时间判断使用同一个值
     */
    public long getTimestamp() {
        return timestamp;
    }

    public byte[] get(TableEnum table, byte[] key) {
        TreeMap<byte[], DbOperation> writes = pending.get(table);
        if (writes != null) {
            DbOperation op = writes.get(key);
            if (op != null) {
                return op.type == DbOperation.OpType.DELETE ? null : op.value.clone();
            }
        }
        return dataBase.get(table, key);
    }

    /**
     * 只读取已提交的数据，忽略本事务的写入
     */
    public byte[] getCommitted(TableEnum table, byte[] key) {
        return dataBase.get(table, key);
    }

    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    public void put(TableEnum table, byte[] key, byte[] value) {
        byte[] copy = key.clone();
        writes(table).put(copy, DbOperation.put(table, copy, value.clone()));
    }

    public void delete(TableEnum table, byte[] key) {
        byte[] copy = key.clone();
        writes(table).put(copy, DbOperation.delete(table, copy));
    }

    public void emit(Object event) {
        checkWritable();
        events.add(event);
    }

    /**
     * 只读遍历已提交数据（不包含本事务未提交的写入）
     */
    public void iterate(TableEnum table, KeyValueHandler handler) {
        dataBase.iterate(table, handler);
    }

    public List<DbOperation> getOperations() {
        List<DbOperation> operations = new ArrayList<>();
        pending.values().forEach(writes -> operations.addAll(writes.values()));
        return operations;
    }

    public List<Object> getEvents() {
        return Collections.unmodifiableList(events);
    }

    private TreeMap<byte[], DbOperation> writes(TableEnum table) {
        checkWritable();
        return pending.computeIfAbsent(table, t -> new TreeMap<>(UnsignedBytes.lexicographicalComparator()));
    }

    private void checkWritable() {
        if (readOnly) {
            throw new IllegalStateException("只读事务不允许写入");
        }
    }
}
