package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 金额请求（质押/申请提取）
 */
@Data
public class AmountRequest {
    private long amount;
}
