package com.bit.attest.database;

import com.bit.attest.config.SystemConfig;
import com.bit.attest.database.memory.MemoryDb;
import com.bit.attest.database.rocksDb.RocksDb;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DbConfig {

    /**
     * 按 system.storage 选择存储引擎并建库，容器关闭时关库
     */
    @Bean(destroyMethod = "closeDatabase")
    public DataBase dataBase(SystemConfig config) {
        log.info("系统数据路径:{}，存储引擎:{}", config.getPath(), config.getStorage());
        DataBase dataBase = config.getStorage() == SystemConfig.StorageType.MEMORY
                ? new MemoryDb()
                : new RocksDb();
        if (!dataBase.createDatabase(config)) {
            throw new IllegalStateException("数据库创建失败: " + config.getPath());
        }
        return dataBase;
    }
}
