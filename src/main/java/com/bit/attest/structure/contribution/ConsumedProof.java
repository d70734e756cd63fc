package com.bit.attest.structure.contribution;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.util.BinaryCodec;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已消费的 (证明, 签名) 对，全局唯一，与其挂靠的贡献记录无关
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConsumedProof {

    /**
     * SHA-256(证明编码 + 签名)，即表键
     */
    private byte[] digest;

    private Address consumedBy;

    private ContributionKey contributionKey;

    private long consumedAt;

    public byte[] serialize() {
        return BinaryCodec.encode(dos -> {
            BinaryCodec.writeBytes(dos, digest);
            BinaryCodec.writeAddress(dos, consumedBy);
            BinaryCodec.writeKey(dos, contributionKey);
            dos.writeLong(consumedAt);
        });
    }

    public static ConsumedProof deserialize(byte[] data) {
        return BinaryCodec.decode(data, dis -> new ConsumedProof(
                BinaryCodec.readBytes(dis),
                BinaryCodec.readAddress(dis),
                BinaryCodec.readKey(dis),
                dis.readLong()));
    }
}
