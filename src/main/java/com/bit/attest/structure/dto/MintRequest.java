package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 开发环境账户注资
 */
@Data
public class MintRequest {
    private String account;
    private long amount;
}
