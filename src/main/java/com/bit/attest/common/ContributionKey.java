package com.bit.attest.common;

import com.bit.attest.util.Sha;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 贡献记录键 = SHA-256(建筑ID + 工人公钥 + 金额)
 * 同一个 (建筑, 工人, 金额) 三元组只对应一条贡献记录
 */
public final class ContributionKey extends ByteHash32 {

    private ContributionKey(byte[] value) {
        super(value);
    }

    public static ContributionKey fromBytes(byte[] bytes) {
        return new ContributionKey(bytes);
    }

    @JsonCreator
    public static ContributionKey fromHex(String hex) {
        return new ContributionKey(hexToBytes(hex));
    }

    /**
     * 计算贡献记录键
     * 编码：[建筑ID长度(4字节)] + [建筑ID UTF-8] + [工人公钥(32字节)] + [金额(8字节大端)]
     */
    public static ContributionKey of(String buildingId, Address workerId, long amount) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream dos = new DataOutputStream(baos)) {
            byte[] building = buildingId.getBytes(StandardCharsets.UTF_8);
            dos.writeInt(building.length);
            dos.write(building);
            dos.write(workerId.toBytes());
            dos.writeLong(amount);
            dos.flush();
            return new ContributionKey(Sha.applySHA256(baos.toByteArray()));
        } catch (IOException e) {
            throw new IllegalStateException("计算贡献记录键失败", e);
        }
    }

    @JsonValue
    @Override
    public String toHex() {
        return super.toHex();
    }
}
