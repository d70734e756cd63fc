package com.bit.attest.api;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.dispute.DisputeResolver;
import com.bit.attest.result.Result;
import com.bit.attest.structure.dispute.Dispute;
import com.bit.attest.structure.dto.CommitRequest;
import com.bit.attest.structure.dto.DisputeRequest;
import com.bit.attest.structure.dto.RevealRequest;
import com.bit.attest.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/dispute")
public class DisputeApi {

    @Autowired
    private DisputeResolver disputeResolver;

    // 缴纳保证金发起争议
    @PostMapping("/raise")
    public Result<Dispute> raiseDispute(@RequestHeader("X-Caller") String caller,
                                        @RequestBody DisputeRequest request) {
        return Result.OK(disputeResolver.raiseDispute(Address.fromBase58(caller),
                ContributionKey.fromHex(request.getKey()), request.getReason()));
    }

    @PostMapping("/commit")
    public Result<Dispute> commitVote(@RequestHeader("X-Caller") String caller,
                                      @RequestBody CommitRequest request) {
        return Result.OK(disputeResolver.commitVote(Address.fromBase58(caller),
                ContributionKey.fromHex(request.getKey()), ByteUtils.hexToBytes(request.getCommitment())));
    }

    @PostMapping("/reveal")
    public Result<Dispute> revealVote(@RequestHeader("X-Caller") String caller,
                                      @RequestBody RevealRequest request) {
        return Result.OK(disputeResolver.revealVote(Address.fromBase58(caller),
                ContributionKey.fromHex(request.getKey()), request.isVote(), ByteUtils.hexToBytes(request.getSalt())));
    }

    @PostMapping("/resolve")
    public Result<Dispute> resolveDispute(@RequestHeader("X-Caller") String caller, @RequestParam String key) {
        return Result.OK(disputeResolver.resolveDispute(Address.fromBase58(caller), ContributionKey.fromHex(key)));
    }

    @GetMapping("/detail")
    public Result<Dispute> getDispute(@RequestParam String key) {
        return Result.OK(disputeResolver.getDispute(ContributionKey.fromHex(key)));
    }

    @GetMapping("/unresolved")
    public Result<Boolean> hasUnresolvedDispute(@RequestParam String key) {
        return Result.OK(disputeResolver.hasUnresolvedDispute(ContributionKey.fromHex(key)));
    }

    // 本地计算承诺哈希，方便客户端构造承诺
    @GetMapping("/commitment")
    public Result<String> computeCommitment(@RequestParam String key, @RequestParam String voter,
                                            @RequestParam boolean vote, @RequestParam String salt) {
        byte[] commitment = disputeResolver.computeCommitment(ContributionKey.fromHex(key),
                Address.fromBase58(voter), vote, ByteUtils.hexToBytes(salt));
        return Result.OK(ByteUtils.bytesToHex(commitment));
    }

    @GetMapping("/list")
    public Result<List<Dispute>> list(@RequestParam(defaultValue = "100") int limit) {
        return Result.OK(disputeResolver.listDisputes(limit));
    }
}
