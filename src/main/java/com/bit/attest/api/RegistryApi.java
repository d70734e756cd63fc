package com.bit.attest.api;

import com.bit.attest.common.Address;
import com.bit.attest.config.ProtocolConfig;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.identity.impl.InMemoryIdentityRegistry;
import com.bit.attest.ledger.ValueLedger;
import com.bit.attest.result.Result;
import com.bit.attest.structure.dto.BuildingRequest;
import com.bit.attest.structure.dto.MintRequest;
import com.bit.attest.structure.dto.WorkerRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * 身份注册表与账本的管理接口（内存实现，开发/测试环境使用），写操作仅限管理员
 */
@Slf4j
@RestController
@RequestMapping("/registry")
public class RegistryApi {

    @Autowired
    private InMemoryIdentityRegistry identityRegistry;

    @Autowired
    private ValueLedger valueLedger;

    @Autowired
    private ProtocolConfig protocolConfig;

    @PostMapping("/building")
    public Result<Void> registerBuilding(@RequestHeader("X-Caller") String caller,
                                         @RequestBody BuildingRequest request) {
        requireAdmin(caller);
        identityRegistry.registerBuilding(request.getBuildingId(), Address.fromBase58(request.getWallet()));
        return Result.OK();
    }

    @PostMapping("/building/wallet")
    public Result<Void> setBuildingWallet(@RequestHeader("X-Caller") String caller,
                                          @RequestBody BuildingRequest request) {
        requireAdmin(caller);
        identityRegistry.setBuildingWallet(request.getBuildingId(), Address.fromBase58(request.getWallet()));
        return Result.OK();
    }

    @GetMapping("/building")
    public Result<Address> getBuildingWallet(@RequestParam String buildingId) {
        Address wallet = identityRegistry.getBuildingWallet(buildingId);
        if (wallet == null) {
            throw ProtocolException.notFound("建筑未注册: " + buildingId);
        }
        return Result.OK(wallet);
    }

    @PostMapping("/worker/activate")
    public Result<Void> activateWorker(@RequestHeader("X-Caller") String caller,
                                       @RequestBody WorkerRequest request) {
        requireAdmin(caller);
        identityRegistry.activateWorker(Address.fromBase58(request.getWorker()));
        return Result.OK();
    }

    @PostMapping("/worker/deactivate")
    public Result<Void> deactivateWorker(@RequestHeader("X-Caller") String caller,
                                         @RequestBody WorkerRequest request) {
        requireAdmin(caller);
        identityRegistry.deactivateWorker(Address.fromBase58(request.getWorker()));
        return Result.OK();
    }

    @GetMapping("/worker")
    public Result<Boolean> isWorkerActive(@RequestParam String worker) {
        return Result.OK(identityRegistry.isWorkerActive(Address.fromBase58(worker)));
    }

    // 账户余额
    @GetMapping("/balance")
    public Result<Long> balanceOf(@RequestParam String account) {
        return Result.OK(valueLedger.balanceOf(Address.fromBase58(account)));
    }

    // 开发环境注资
    @PostMapping("/mint")
    public Result<Long> mint(@RequestHeader("X-Caller") String caller, @RequestBody MintRequest request) {
        requireAdmin(caller);
        Address account = Address.fromBase58(request.getAccount());
        valueLedger.mint(account, request.getAmount());
        return Result.OK(valueLedger.balanceOf(account));
    }

    private void requireAdmin(String caller) {
        if (!protocolConfig.isAdmin(Address.fromBase58(caller))) {
            throw ProtocolException.unauthorized("只有管理员可以修改注册表: " + caller);
        }
    }
}
