package com.bit.attest.identity;

import com.bit.attest.common.Address;

/**
 * 身份注册表（外部协作方），协议核心只读
 */
public interface IdentityRegistry {

    boolean isWorkerActive(Address worker);

    boolean isBuildingRegistered(String buildingId);

    /**
     * 建筑当前的收款钱包，未注册返回 null
     */
    Address getBuildingWallet(String buildingId);
}
