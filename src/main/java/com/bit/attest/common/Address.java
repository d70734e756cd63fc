package com.bit.attest.common;

import com.bit.attest.util.Sha;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 账户地址（32字节 Ed25519 公钥），统一验证者/工人/钱包/系统账户的地址表示
 * 文本形式为 Base58 编码
 */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 32;

    // 系统账户派生前缀，派生地址不对应任何私钥
    private static final byte[] DERIVE_PREFIX = "attest:system-account:".getBytes(StandardCharsets.UTF_8);

    private final byte[] value;

    private Address(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为32字节");
        }
        this.value = Arrays.copyOf(value, LENGTH);
    }

    public static Address fromBytes(byte[] bytes) {
        return new Address(bytes);
    }

    @JsonCreator
    public static Address fromBase58(String base58) {
        if (base58 == null || base58.isBlank()) {
            throw new IllegalArgumentException("地址不能为空");
        }
        try {
            return new Address(Base58.decode(base58.trim()));
        } catch (AddressFormatException e) {
            throw new IllegalArgumentException("非法的Base58地址: " + base58, e);
        }
    }

    /**
     * 由种子派生系统账户地址（托管账户、国库、维护者池）
     */
    public static Address derive(String seed) {
        byte[] seedBytes = seed.getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[DERIVE_PREFIX.length + seedBytes.length];
        System.arraycopy(DERIVE_PREFIX, 0, data, 0, DERIVE_PREFIX.length);
        System.arraycopy(seedBytes, 0, data, DERIVE_PREFIX.length, seedBytes.length);
        return new Address(Sha.applySHA256(data));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @JsonValue
    public String toBase58() {
        return Base58.encode(value);
    }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        return Arrays.equals(value, ((Address) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    // Map 的 key 序列化同样走 Base58
    @Override
    public String toString() {
        return toBase58();
    }
}
