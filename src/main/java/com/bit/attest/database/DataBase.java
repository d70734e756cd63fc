package com.bit.attest.database;

import com.bit.attest.config.SystemConfig;

import java.util.List;

//KV数据库操作 按表隔离
public interface DataBase {

    /**
     * 创建数据库
     */
    boolean createDatabase(SystemConfig config);

    /**
     * 关闭数据库
     */
    boolean closeDatabase();

    /**
     * 判断是否存在
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 获取一条数据，不存在返回null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 原子写入一批操作（跨表），要么全部成功要么全部失败
     * @return 事务是否成功
     */
    boolean dataTransaction(List<DbOperation> operations);

    /**
     * 迭代器遍历（按键的无符号字典序）
     * @param handler 返回false则停止迭代
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    void close();
}
