package com.bit.attest.structure.dto;

import com.bit.attest.common.Address;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.util.ByteUtils;
import lombok.Data;

/**
 * 证明的JSON形式：公钥为Base58，证据根为十六进制
 */
@Data
public class ProofDTO {
    private String buildingId;
    private String workerId;
    private long amount;
    private String evidenceRoot;
    private long capturedAt;
    private long nonce;

    public ContributionProof toProof() {
        return new ContributionProof(buildingId, Address.fromBase58(workerId), amount,
                ByteUtils.hexToBytes(evidenceRoot), capturedAt, nonce);
    }

    public static ProofDTO from(ContributionProof proof) {
        ProofDTO dto = new ProofDTO();
        dto.setBuildingId(proof.getBuildingId());
        dto.setWorkerId(proof.getWorkerId().toBase58());
        dto.setAmount(proof.getAmount());
        dto.setEvidenceRoot(ByteUtils.bytesToHex(proof.getEvidenceRoot()));
        dto.setCapturedAt(proof.getCapturedAt());
        dto.setNonce(proof.getNonce());
        return dto;
    }
}
