package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 投票承诺请求，承诺为32字节十六进制
 */
@Data
public class CommitRequest {
    private String key;
    private String commitment;
}
