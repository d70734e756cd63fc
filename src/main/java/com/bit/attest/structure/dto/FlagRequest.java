package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 轻量争议标记请求
 */
@Data
public class FlagRequest {
    private String key;
    private String reason;
}
