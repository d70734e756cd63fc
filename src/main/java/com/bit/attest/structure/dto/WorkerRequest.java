package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 激活/停用工人
 */
@Data
public class WorkerRequest {
    private String worker;
}
