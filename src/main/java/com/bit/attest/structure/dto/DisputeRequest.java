package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 发起带保证金争议的请求
 */
@Data
public class DisputeRequest {
    private String key;
    private String reason;
}
