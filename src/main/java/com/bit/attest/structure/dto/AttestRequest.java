package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 验证者提交证明：声明（建筑、工人、金额）+ 工人签名的证明
 */
@Data
public class AttestRequest {
    private String buildingId;
    private String workerId;
    private long amount;
    private ProofDTO proof;
    // 64字节签名，十六进制
    private String signature;
}
