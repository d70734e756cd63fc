package com.bit.attest.database.memory;

import com.bit.attest.config.SystemConfig;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.DbOperation;
import com.bit.attest.database.KeyValueHandler;
import com.bit.attest.database.TableEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存数据库：测试与开发环境使用，键序与RocksDB默认比较器一致
 */
@Slf4j
public class MemoryDb implements DataBase {

    private final Map<TableEnum, ConcurrentSkipListMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new ConcurrentSkipListMap<>(Arrays::compareUnsigned));
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
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).put(key.clone(), value.clone());
        } finally {
            rwLock.writeLock().unlock();
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
                if (op.value == null) {
                    throw new IllegalArgumentException("写操作的值不能为空, table=" + op.table);
                }
            }
            for (DbOperation op : operations) {
                tables.get(op.table).put(op.key.clone(), op.value.clone());
            }
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        List<Map.Entry<byte[], byte[]>> snapshot;
        rwLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(tables.get(table).entrySet());
        } finally {
            rwLock.readLock().unlock();
        }
        for (Map.Entry<byte[], byte[]> entry : snapshot) {
            if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                break;
            }
        }
    }

    @Override
    public void close() {
        log.debug("内存数据库关闭");
    }
}
