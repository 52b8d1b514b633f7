package com.bit.vault.database.rocksDb;

import com.bit.vault.config.SystemConfig;
import com.bit.vault.database.DataBase;
import com.bit.vault.database.DbOperation;
import com.bit.vault.database.KeyValueHandler;
import com.bit.vault.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * RocksDB 持久化实现
 * 检查点只追加、从不修改；金库状态按键覆盖写入；一个业务操作对应一个 WriteBatch，保证原子性
 */
@Slf4j
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    private final Map<TableEnum, ColumnFamilyHandle> handles = new EnumMap<>(TableEnum.class);
    private final List<ColumnFamilyHandle> allHandles = new ArrayList<>();
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    private RocksDB db;
    private DBOptions options;
    private String dbPath;

    @Override
    public boolean createDatabase(SystemConfig config) {
        String path = config.getPath();
        if (path == null) {
            return false;
        }
        dbPath = path;
        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            // 1. 默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));
            // 2. 每张表一个列族，顺序与 TableEnum 一致
            TableEnum[] tables = TableEnum.values();
            for (TableEnum table : tables) {
                cfDescriptors.add(new ColumnFamilyDescriptor(
                        table.getColumnFamilyName().getBytes(StandardCharsets.UTF_8),
                        columnFamilyOptions(table)));
            }

            options = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(options, dbPath, cfDescriptors, allHandles);
            if (allHandles.size() != cfDescriptors.size()) {
                throw new IllegalStateException("列族句柄数量与描述符不匹配，初始化失败");
            }
            // 自定义列族从索引1开始绑定
            for (int i = 0; i < tables.length; i++) {
                handles.put(tables[i], allHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", tables[i], i + 1);
            }
            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    private ColumnFamilyOptions columnFamilyOptions(TableEnum table) {
        ColumnFamilyOptions cfOptions = new ColumnFamilyOptions();
        if (table == TableEnum.CHECKPOINT) {
            // 检查点二分查找读取频繁，缓存索引与过滤块
            cfOptions.setTableFormatConfig(new BlockBasedTableConfig().setCacheIndexAndFilterBlocks(true));
        }
        return cfOptions;
    }

    @Override
    public boolean closeDatabase() {
        try {
            close();
            log.info("数据库已关闭");
            return true;
        } catch (Exception e) {
            log.error("关闭数据库失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(handle(table), key, value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new RuntimeException("插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            return db.get(handle(table), key);
        } catch (RocksDBException e) {
            log.error("查询数据失败, table={}", table, e);
            throw new RuntimeException("查询数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        int[] count = {0};
        iterate(table, (key, value) -> {
            count[0]++;
            return true;
        });
        return count[0];
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return true;
        }
        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions().setSync(true)) {
            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = handle(op.table);
                switch (op.type) {
                    case INSERT:
                    case UPDATE:
                        writeBatch.put(cfHandle, op.key, op.value);
                        break;
                    case DELETE:
                        writeBatch.delete(cfHandle, op.key);
                        break;
                    default:
                        throw new IllegalArgumentException("未知操作类型: " + op.type);
                }
            }
            db.write(writeOptions, writeBatch);
            return true;
        } catch (RocksDBException e) {
            // WriteBatch 要么全成功，要么全失败
            log.error("事务提交失败，操作数: {}", operations.size(), e);
            return false;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(table))) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db == null) {
                return;
            }
            for (ColumnFamilyHandle handle : allHandles) {
                handle.close();
            }
            allHandles.clear();
            handles.clear();
            db.close();
            db = null;
            if (options != null) {
                options.close();
            }
            log.info("RocksDB已关闭: {}", dbPath);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private ColumnFamilyHandle handle(TableEnum table) {
        ColumnFamilyHandle cfHandle = handles.get(table);
        if (cfHandle == null) {
            throw new IllegalArgumentException("表不存在: " + table);
        }
        return cfHandle;
    }
}
