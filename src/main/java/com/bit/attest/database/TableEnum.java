package com.bit.attest.database;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 表枚举（集中管理所有表的元信息，作为唯一数据源）
 */
public enum TableEnum {
    // 验证者质押账户：验证者公钥 -> StakeAccount
    STAKE_ACCOUNT((short) 1, "stake_account", 16),
    // 贡献记录：贡献键 -> ContributionRecord
    CONTRIBUTION((short) 2, "contribution", 64),
    // 已消费证明：SHA-256(证明+签名) -> ConsumedProof（集合语义）
    CONSUMED_PROOF((short) 3, "consumed_proof", 64),
    // 争议：贡献键 -> Dispute
    DISPUTE((short) 4, "dispute", 16);

    @Getter private final short code;  // 表唯一标识
    @Getter private final String columnFamilyName;  // 列族实际存储名称
    @Getter private final long cacheSize;  // 缓存条数（千条）

    TableEnum(short code, String columnFamilyName, long cacheSize) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
        this.cacheSize = cacheSize;
    }

    // 缓存：标识 -> 枚举实例
    private static final Map<Short, TableEnum> CODE_TO_ENUM = new HashMap<>();

    static {
        for (TableEnum table : values()) {
            CODE_TO_ENUM.put(table.code, table);
        }
    }

    public static TableEnum getByCode(short code) {
        return CODE_TO_ENUM.get(code);
    }
}
