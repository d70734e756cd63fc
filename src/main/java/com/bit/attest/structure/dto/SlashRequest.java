package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 管理员罚没请求
 */
@Data
public class SlashRequest {
    private String validator;
    private long amount;
    private String reason;
}
