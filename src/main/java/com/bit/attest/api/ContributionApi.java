package com.bit.attest.api;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.oracle.ContributionOracle;
import com.bit.attest.result.Result;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.contribution.PayoutSplit;
import com.bit.attest.structure.dto.AttestRequest;
import com.bit.attest.structure.dto.FlagRequest;
import com.bit.attest.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/contribution")
public class ContributionApi {

    @Autowired
    private ContributionOracle contributionOracle;

    // 验证者提交工人签名的证明
    @PostMapping("/attest")
    public Result<ContributionRecord> attest(@RequestHeader("X-Caller") String caller,
                                             @RequestBody AttestRequest request) {
        if (request.getProof() == null) {
            throw new IllegalArgumentException("证明不能为空");
        }
        return Result.OK(contributionOracle.attest(
                Address.fromBase58(caller),
                request.getBuildingId(),
                Address.fromBase58(request.getWorkerId()),
                request.getAmount(),
                request.getProof().toProof(),
                ByteUtils.hexToBytes(request.getSignature())));
    }

    // 轻量争议标记
    @PostMapping("/flag")
    public Result<ContributionRecord> raiseFlag(@RequestHeader("X-Caller") String caller,
                                                @RequestBody FlagRequest request) {
        return Result.OK(contributionOracle.raiseFlag(Address.fromBase58(caller),
                ContributionKey.fromHex(request.getKey()), request.getReason()));
    }

    @PostMapping("/clearFlag")
    public Result<ContributionRecord> clearFlag(@RequestHeader("X-Caller") String caller,
                                                @RequestParam String key) {
        return Result.OK(contributionOracle.clearFlag(Address.fromBase58(caller), ContributionKey.fromHex(key)));
    }

    // 任何人都可以触发终结
    @PostMapping("/finalize")
    public Result<ContributionRecord> finalizeContribution(@RequestParam String key) {
        return Result.OK(contributionOracle.finalizeContribution(ContributionKey.fromHex(key)));
    }

    @GetMapping("/detail")
    public Result<ContributionRecord> getContribution(@RequestParam String key) {
        return Result.OK(contributionOracle.getContribution(ContributionKey.fromHex(key)));
    }

    @GetMapping("/key")
    public Result<ContributionKey> computeKey(@RequestParam String buildingId,
                                              @RequestParam String workerId,
                                              @RequestParam long amount) {
        return Result.OK(contributionOracle.computeKey(buildingId, Address.fromBase58(workerId), amount));
    }

    @GetMapping("/finalizable")
    public Result<Boolean> isFinalizable(@RequestParam String key) {
        return Result.OK(contributionOracle.isFinalizable(ContributionKey.fromHex(key)));
    }

    @GetMapping("/split")
    public Result<PayoutSplit> previewSplit(@RequestParam long amount) {
        return Result.OK(contributionOracle.previewSplit(amount));
    }

    // 查询 (证明, 签名) 是否已被消费
    @PostMapping("/consumed")
    public Result<Boolean> isProofConsumed(@RequestBody AttestRequest request) {
        if (request.getProof() == null) {
            throw new IllegalArgumentException("证明不能为空");
        }
        return Result.OK(contributionOracle.isProofConsumed(request.getProof().toProof(),
                ByteUtils.hexToBytes(request.getSignature())));
    }

    @GetMapping("/list")
    public Result<List<ContributionRecord>> list(@RequestParam(defaultValue = "100") int limit) {
        return Result.OK(contributionOracle.listContributions(limit));
    }
}
