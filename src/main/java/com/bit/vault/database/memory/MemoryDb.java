package com.bit.vault.database.memory;

import com.bit.vault.config.SystemConfig;
import com.bit.vault.database.DataBase;
import com.bit.vault.database.DbOperation;
import com.bit.vault.database.KeyValueHandler;
import com.bit.vault.database.TableEnum;
import com.google.common.primitives.UnsignedBytes;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存数据库：测试与单机演示使用，进程退出即丢失
 */
@Slf4j
public class MemoryDb implements DataBase {

    private final Map<TableEnum, ConcurrentSkipListMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new ConcurrentSkipListMap<>(UnsignedBytes.lexicographicalComparator()));
        }
    }

    @Override
    public boolean createDatabase(SystemConfig config) {
        log.info("使用内存数据库，表数量: {}", tables.size());
        return true;
    }

    @Override
    public boolean closeDatabase() {
        close();
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).put(key.clone(), value.clone());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            byte[] value = tables.get(table).get(key);
            return value == null ? null : value.clone();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        return tables.get(table).size();
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return true;
        }
        rwLock.writeLock().lock();
        try {
            for (DbOperation op : operations) {
                ConcurrentSkipListMap<byte[], byte[]> data = tables.get(op.table);
                if (op.type == DbOperation.OpType.DELETE) {
                    data.remove(op.key);
                } else {
                    data.put(op.key.clone(), op.value.clone());
                }
            }
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try {
            for (Map.Entry<byte[], byte[]> entry : tables.get(table).entrySet()) {
                if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                    break;
                }
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        tables.values().forEach(Map::clear);
    }
}
