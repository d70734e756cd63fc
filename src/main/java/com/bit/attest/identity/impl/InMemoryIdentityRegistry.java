package com.bit.attest.identity.impl;

import com.bit.attest.common.Address;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.identity.IdentityRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 开发/测试用的内存身份注册表
 */
@Slf4j
@Component
public class InMemoryIdentityRegistry implements IdentityRegistry {

    // 建筑ID -> 收款钱包
    private final Map<String, Address> buildings = new ConcurrentHashMap<>();

    private final Set<Address> activeWorkers = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isWorkerActive(Address worker) {
        return worker != null && activeWorkers.contains(worker);
    }

    @Override
    public boolean isBuildingRegistered(String buildingId) {
        return buildingId != null && buildings.containsKey(buildingId);
    }

    @Override
    public Address getBuildingWallet(String buildingId) {
        return buildingId == null ? null : buildings.get(buildingId);
    }

    public void registerBuilding(String buildingId, Address wallet) {
        if (buildingId == null || buildingId.isBlank()) {
            throw ProtocolException.invalid("建筑ID不能为空");
        }
        if (wallet == null) {
            throw ProtocolException.invalid("建筑收款钱包不能为空");
        }
        if (buildings.putIfAbsent(buildingId, wallet) != null) {
            throw ProtocolException.duplicate("建筑已注册: " + buildingId);
        }
        log.info("注册建筑: {}, 收款钱包: {}", buildingId, wallet);
    }

    /**
     * 改绑收款钱包，已创建的贡献记录仍使用创建时的钱包快照
     */
    public void setBuildingWallet(String buildingId, Address wallet) {
        if (wallet == null) {
            throw ProtocolException.invalid("建筑收款钱包不能为空");
        }
        if (buildings.replace(buildingId, wallet) == null) {
            throw ProtocolException.notFound("建筑未注册: " + buildingId);
        }
        log.info("建筑 {} 改绑收款钱包: {}", buildingId, wallet);
    }

    public void activateWorker(Address worker) {
        activeWorkers.add(worker);
        log.info("激活工人: {}", worker);
    }

    public void deactivateWorker(Address worker) {
        activeWorkers.remove(worker);
        log.info("停用工人: {}", worker);
    }
}
