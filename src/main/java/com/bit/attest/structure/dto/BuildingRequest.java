package com.bit.attest.structure.dto;

import lombok.Data;

/**
 * 注册建筑 / 改绑收款钱包
 */
@Data
public class BuildingRequest {
    private String buildingId;
    private String wallet;
}
