package com.bit.attest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 节点系统配置（数据路径、存储引擎）
 */
@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {

    public enum StorageType { ROCKSDB, MEMORY }

    private String path = "./data/attest"; //保存路径
    private StorageType storage = StorageType.ROCKSDB;
    private Integer maxSize = 64; //每张表最大内存缓存条数（千条）
    private long cacheTtlMinutes = 60;
}
