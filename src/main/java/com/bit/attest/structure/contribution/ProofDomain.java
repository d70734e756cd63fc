package com.bit.attest.structure.contribution;

import com.bit.attest.common.Address;
import com.bit.attest.util.BinaryCodec;
import com.bit.attest.util.Sha;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * 签名域：把签名绑定到具体的协议名、版本、链ID和预言机地址
 * 同一份证明在别的部署上签名无效
 */
@Getter
public class ProofDomain {

    // 域类型标签，参与域分隔符计算
    private static final byte[] DOMAIN_TYPE =
            "ProofDomain(string name,string version,uint64 chainId,bytes32 verifyingContract)"
                    .getBytes(StandardCharsets.UTF_8);

    private final String name;
    private final String version;
    private final long chainId;
    private final Address verifyingContract;
    private final byte[] separator;

    public ProofDomain(String name, String version, long chainId, Address verifyingContract) {
        this.name = name;
        this.version = version;
        this.chainId = chainId;
        this.verifyingContract = verifyingContract;
        this.separator = computeSeparator();
    }

    /**
     * 域分隔符 = SHA-256(类型标签 + 名称 + 版本 + 链ID + 预言机地址)
     */
    private byte[] computeSeparator() {
        byte[] encoded = BinaryCodec.encode(dos -> {
            BinaryCodec.writeBytes(dos, DOMAIN_TYPE);
            BinaryCodec.writeBytes(dos, name.getBytes(StandardCharsets.UTF_8));
            BinaryCodec.writeBytes(dos, version.getBytes(StandardCharsets.UTF_8));
            dos.writeLong(chainId);
            BinaryCodec.writeAddress(dos, verifyingContract);
        });
        return Sha.applySHA256(encoded);
    }

    public byte[] getSeparator() {
        return separator.clone();
    }
}
