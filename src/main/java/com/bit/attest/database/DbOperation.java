package com.bit.attest.database;

/**
 * 事务中的单个写操作，协议状态只追加和覆盖，不做物理删除
 */
public class DbOperation {

    public final TableEnum table; // 表枚举
    public final byte[] key;      // 键
    public final byte[] value;    // 值

    public DbOperation(TableEnum table, byte[] key, byte[] value) {
        this.table = table;
        this.key = key;
        this.value = value;
    }

    public static DbOperation put(TableEnum table, byte[] key, byte[] value) {
        return new DbOperation(table, key, value);
    }
}
