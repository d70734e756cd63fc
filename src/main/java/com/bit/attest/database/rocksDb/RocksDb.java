package com.bit.attest.database.rocksDb;

import com.bit.attest.config.SystemConfig;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.DbOperation;
import com.bit.attest.database.KeyValueHandler;
import com.bit.attest.database.TableEnum;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
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
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * RocksDB存储：每张表一个列族，每张表一个Caffeine读缓存
 * 协议状态只追加/覆盖，从不物理删除
 */
@Slf4j
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    // 按表隔离的读缓存，键为 ByteBuffer 包装（按内容比较）
    private final Map<TableEnum, Cache<ByteBuffer, byte[]>> tableCaches = new ConcurrentHashMap<>();

    private final RTable rTable = new RTable();
    private RocksDB db;
    private DBOptions dbOptions;
    private ColumnFamilyHandle defaultHandle;
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(SystemConfig config) {
        String path = config.getPath();
        if (path == null) {
            return false;
        }
        dbPath = path;

        for (TableEnum table : TableEnum.values()) {
            Cache<ByteBuffer, byte[]> cache = Caffeine.newBuilder()
                    .maximumSize(table.getCacheSize() * 1000L)
                    .expireAfterAccess(config.getCacheTtlMinutes(), TimeUnit.MINUTES)
                    .build();
            tableCaches.put(table, cache);
        }

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 1. 添加默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));

            // 2. 自定义列族描述符（LinkedHashMap保证顺序）
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            // 3. 打开数据库
            dbOptions = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);
            db = RocksDB.open(dbOptions, dbPath, cfDescriptors, cfHandles);

            // 4. 绑定列族句柄（cfHandles顺序与cfDescriptors严格一致）
            if (cfHandles.size() != cfDescriptors.size()) {
                throw new IllegalStateException("列族句柄数量与描述符不匹配，初始化失败");
            }
            // 默认列族句柄不绑定到表
            defaultHandle = cfHandles.get(0);
            for (int i = 0; i < tableEnums.size(); i++) {
                rTable.setColumnFamilyHandle(tableEnums.get(i), cfHandles.get(i + 1));
            }

            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
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
    public byte[] get(TableEnum table, byte[] key) {
        Cache<ByteBuffer, byte[]> cache = tableCaches.get(table);
        ByteBuffer cacheKey = ByteBuffer.wrap(key.clone());
        byte[] cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached.clone();
        }
        rwLock.readLock().lock();
        try {
            ColumnFamilyHandle cfHandle = getColumnFamilyHandle(table);
            byte[] value = db.get(cfHandle, key);
            if (value != null) {
                cache.put(cacheKey, value.clone());
            }
            return value;
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new IllegalStateException("获取数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        dataTransaction(List.of(DbOperation.put(table, key, value)));
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(getColumnFamilyHandle(table))) {
            iterator.seekToFirst();
            int count = 0;
            while (iterator.isValid()) {
                count++;
                iterator.next();
            }
            return count;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 执行跨列族事务（WriteBatch 原子提交）
     */
    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return true;
        }

        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions()) {
            writeOptions.setSync(true); // 协议状态要求落盘后才返回

            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = getColumnFamilyHandle(op.table);
                if (cfHandle == null) {
                    throw new IllegalArgumentException("事务中存在不存在的表: " + op.table);
                }
                if (op.value == null) {
                    throw new IllegalArgumentException("写操作的值不能为空, table=" + op.table);
                }
                writeBatch.put(cfHandle, op.key, op.value);
            }

            db.write(writeOptions, writeBatch);

            // 提交成功后再刷新缓存
            for (DbOperation op : operations) {
                Cache<ByteBuffer, byte[]> cache = tableCaches.get(op.table);
                ByteBuffer cacheKey = ByteBuffer.wrap(op.key.clone());
                cache.put(cacheKey, op.value.clone());
            }
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } catch (RocksDBException e) {
            log.error("事务执行失败", e);
            return false; // WriteBatch 要么全成功，要么全失败
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        if (table == null || handler == null) {
            log.warn("迭代表失败：表名或处理器不能为空");
            return;
        }
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(getColumnFamilyHandle(table))) {
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
            if (db != null) {
                rTable.closeAll();
                if (defaultHandle != null) {
                    defaultHandle.close();
                    defaultHandle = null;
                }
                db.close();
                db = null;
                if (dbOptions != null) {
                    dbOptions.close();
                    dbOptions = null;
                }
                tableCaches.values().forEach(Cache::invalidateAll);
                log.info("RocksDB连接已关闭: {}", dbPath);
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private ColumnFamilyHandle getColumnFamilyHandle(TableEnum table) {
        ColumnFamilyHandle handle = rTable.getColumnFamilyHandle(table);
        if (handle == null) {
            throw new IllegalStateException("数据库未初始化或表不存在: " + table);
        }
        return handle;
    }
}
