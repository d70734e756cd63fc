package com.bit.attest.structure.contribution;

import com.bit.attest.common.Address;
import com.bit.attest.util.BinaryCodec;
import com.bit.attest.util.Sha;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 工人对一次现场工作的签名证明（结构化数据）
 * 签名对象 = SHA-256(域分隔符 + SHA-256(类型标签 + 证明字段编码))
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ContributionProof {

    private static final byte[] PROOF_TYPE =
            "ContributionProof(string buildingId,bytes32 workerId,uint64 amount,bytes32 evidenceRoot,uint64 capturedAt,uint64 nonce)"
                    .getBytes(StandardCharsets.UTF_8);

    public static final int EVIDENCE_ROOT_LENGTH = 32;

    private String buildingId;

    private Address workerId;

    private long amount;

    /**
     * 现场采集数据的默克尔根（由采集端产生，节点只做签名覆盖）
     */
    private byte[] evidenceRoot;

    /**
     * 采集时间（毫秒）
     */
    private long capturedAt;

    /**
     * 工人侧随机数，区分同一工人对同一声明的多次采集
     */
    private long nonce;

    /**
     * 证明字段的确定性编码
     * 格式：[类型标签] [建筑ID] [工人32] [金额8] [证据根32] [采集时间8] [随机数8]
     */
    public byte[] encode() {
        Objects.requireNonNull(buildingId, "建筑ID不能为空");
        Objects.requireNonNull(workerId, "工人公钥不能为空");
        Objects.requireNonNull(evidenceRoot, "证据根不能为空");
        if (evidenceRoot.length != EVIDENCE_ROOT_LENGTH) {
            throw new IllegalArgumentException("证据根必须为32字节，实际为" + evidenceRoot.length + "字节");
        }
        return BinaryCodec.encode(dos -> {
            BinaryCodec.writeBytes(dos, PROOF_TYPE);
            BinaryCodec.writeBytes(dos, buildingId.getBytes(StandardCharsets.UTF_8));
            BinaryCodec.writeAddress(dos, workerId);
            dos.writeLong(amount);
            dos.write(evidenceRoot);
            dos.writeLong(capturedAt);
            dos.writeLong(nonce);
        });
    }

    /**
     * 构建待签名的原始数据
     */
    public byte[] buildSignData(ProofDomain domain) {
        return Sha.applySHA256(domain.getSeparator(), Sha.applySHA256(encode()));
    }

    /**
     * (证明, 签名) 对的消费摘要
     */
    public byte[] consumptionDigest(byte[] signature) {
        return Sha.applySHA256(encode(), signature);
    }
}
