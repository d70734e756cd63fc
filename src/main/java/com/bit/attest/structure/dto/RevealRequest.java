package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 投票揭示请求，盐为十六进制
 */
@Data
public class RevealRequest {
    private String key;
    private boolean vote;
    private String salt;
}
