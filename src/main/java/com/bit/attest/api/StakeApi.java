package com.bit.attest.api;

import com.bit.attest.common.Address;
import com.bit.attest.result.Result;
import com.bit.attest.staking.StakingService;
import com.bit.attest.structure.dto.AmountRequest;
import com.bit.attest.structure.dto.SlashRequest;
import com.bit.attest.structure.stake.StakeAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/stake")
public class StakeApi {

    @Autowired
    private StakingService stakingService;

    // 质押
    @PostMapping("/deposit")
    public Result<StakeAccount> deposit(@RequestHeader("X-Caller") String caller,
                                        @RequestBody AmountRequest request) {
        return Result.OK(stakingService.deposit(Address.fromBase58(caller), request.getAmount()));
    }

    // 申请提取
    @PostMapping("/requestWithdrawal")
    public Result<StakeAccount> requestWithdrawal(@RequestHeader("X-Caller") String caller,
                                                  @RequestBody AmountRequest request) {
        return Result.OK(stakingService.requestWithdrawal(Address.fromBase58(caller), request.getAmount()));
    }

    // 解锁后提取
    @PostMapping("/completeWithdrawal")
    public Result<Long> completeWithdrawal(@RequestHeader("X-Caller") String caller) {
        return Result.OK(stakingService.completeWithdrawal(Address.fromBase58(caller)));
    }

    // 管理员罚没
    @PostMapping("/slash")
    public Result<Long> slash(@RequestHeader("X-Caller") String caller, @RequestBody SlashRequest request) {
        return Result.OK(stakingService.slash(Address.fromBase58(caller),
                Address.fromBase58(request.getValidator()), request.getAmount(), request.getReason()));
    }

    @GetMapping("/account")
    public Result<StakeAccount> getStakeAccount(@RequestParam String validator) {
        return Result.OK(stakingService.getStakeAccount(Address.fromBase58(validator)));
    }

    @GetMapping("/qualified")
    public Result<Boolean> isQualified(@RequestParam String validator) {
        return Result.OK(stakingService.isQualified(Address.fromBase58(validator)));
    }

    @GetMapping("/list")
    public Result<List<StakeAccount>> list(@RequestParam(defaultValue = "100") int limit) {
        return Result.OK(stakingService.listStakeAccounts(limit));
    }
}
