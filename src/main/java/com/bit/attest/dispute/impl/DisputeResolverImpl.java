package com.bit.attest.dispute.impl;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.config.ProtocolConfig;
import com.bit.attest.dispute.DisputeResolver;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.oracle.ContributionSettlement;
import com.bit.attest.staking.StakingService;
import com.bit.attest.state.ContributionRepository;
import com.bit.attest.state.DisputeRepository;
import com.bit.attest.state.StakeAccountRepository;
import com.bit.attest.state.StateExecutor;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.dispute.Dispute;
import com.bit.attest.structure.dispute.Ruling;
import com.bit.attest.util.Sha;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
public class DisputeResolverImpl implements DisputeResolver {

    private static final int COMMITMENT_LENGTH = 32;

    @Autowired
    private StateExecutor stateExecutor;

    @Autowired
    private DisputeRepository disputeRepository;

    @Autowired
    private ContributionRepository contributionRepository;

    @Autowired
    private StakeAccountRepository stakeAccountRepository;

    @Autowired
    private ContributionSettlement contributionSettlement;

    @Autowired
    private StakingService stakingService;

    @Autowired
    private ProtocolConfig protocolConfig;

    @Autowired
    private Clock clock;

    @Override
    public Dispute raiseDispute(Address caller, ContributionKey key, String reason) {
        return stateExecutor.execute(() -> {
            ContributionRecord record = contributionRepository.find(key)
                    .orElseThrow(() -> ProtocolException.notFound("贡献记录不存在: " + key));
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结，不能发起争议: " + key);
            }
            Dispute existing = disputeRepository.find(key).orElse(null);
            if (existing != null) {
                if (existing.isResolved()) {
                    throw ProtocolException.state("该贡献记录的争议已裁决: " + key);
                }
                throw ProtocolException.duplicate("该贡献记录已存在进行中的争议: " + key);
            }
            long now = clock.millis();
            long commitDeadline = now + protocolConfig.getCommitWindow().toMillis();
            long revealDeadline = commitDeadline + protocolConfig.getRevealWindow().toMillis();
            long bond = protocolConfig.getDisputeBond();
            Dispute dispute = new Dispute(key, caller, bond, reason, now, commitDeadline, revealDeadline);
            disputeRepository.save(dispute);
            StateExecutor.current().transfer(caller, protocolConfig.getDisputeCustodyAddress(), bond);
            log.info("{} 对贡献记录 {} 发起争议，保证金 {}，承诺截止 {}，揭示截止 {}",
                    caller, key, bond, commitDeadline, revealDeadline);
            return dispute;
        });
    }

    @Override
    public Dispute commitVote(Address caller, ContributionKey key, byte[] commitment) {
        return stateExecutor.execute(() -> {
            if (!stakingService.isQualified(caller)) {
                throw ProtocolException.unauthorized("调用者不是合格验证者: " + caller);
            }
            Dispute dispute = requireDispute(key);
            if (dispute.isResolved()) {
                throw ProtocolException.state("争议已裁决: " + key);
            }
            long now = clock.millis();
            if (now >= dispute.getCommitDeadline()) {
                throw ProtocolException.timing("承诺阶段已结束，截止 " + dispute.getCommitDeadline());
            }
            if (commitment == null || commitment.length != COMMITMENT_LENGTH) {
                throw ProtocolException.invalid("承诺必须为32字节");
            }
            if (dispute.hasCommitted(caller)) {
                throw ProtocolException.duplicate("验证者已提交过承诺: " + caller);
            }
            if (dispute.containsCommitment(commitment)) {
                log.warn("验证者 {} 提交了与他人相同的承诺哈希", caller);
                throw ProtocolException.replay("相同的承诺哈希已被提交");
            }
            dispute.getCommitments().put(caller, commitment.clone());
            disputeRepository.save(dispute);
            log.info("验证者 {} 对争议 {} 提交承诺，承诺数 {}", caller, key, dispute.getCommitCount());
            return dispute;
        });
    }

    @Override
    public Dispute revealVote(Address caller, ContributionKey key, boolean vote, byte[] salt) {
        return stateExecutor.execute(() -> {
            Dispute dispute = requireDispute(key);
            byte[] commitment = dispute.getCommitments().get(caller);
            if (commitment == null) {
                throw ProtocolException.notFound("验证者没有提交过承诺: " + caller);
            }
            if (dispute.isResolved()) {
                throw ProtocolException.state("争议已裁决: " + key);
            }
            if (dispute.hasRevealed(caller)) {
                throw ProtocolException.duplicate("验证者已揭示过投票: " + caller);
            }
            long now = clock.millis();
            if (now < dispute.getCommitDeadline() || now >= dispute.getRevealDeadline()) {
                throw ProtocolException.timing("不在揭示阶段 [" + dispute.getCommitDeadline() + ", "
                        + dispute.getRevealDeadline() + ")，当前 " + now);
            }
            if (salt == null || !Arrays.equals(commitment, computeCommitment(key, caller, vote, salt))) {
                log.warn("验证者 {} 揭示的投票与承诺不匹配", caller);
                throw ProtocolException.invalid("揭示内容与承诺不匹配");
            }
            dispute.getReveals().put(caller, vote);
            disputeRepository.save(dispute);
            log.info("验证者 {} 揭示争议 {} 的投票: {}", caller, key, vote ? "有效" : "无效");
            return dispute;
        });
    }

    @Override
    public Dispute resolveDispute(Address caller, ContributionKey key) {
        return stateExecutor.execute(() -> {
            Dispute dispute = requireDispute(key);
            if (dispute.isResolved()) {
                throw ProtocolException.state("争议已裁决: " + key);
            }
            long now = clock.millis();
            if (now < dispute.getRevealDeadline()) {
                throw ProtocolException.timing("揭示阶段未结束，截止 " + dispute.getRevealDeadline());
            }
            int valid = dispute.getValidVotes();
            int invalid = dispute.getInvalidVotes();
            Ruling ruling;
            if (valid > invalid) {
                ruling = Ruling.UPHELD;
            } else if (invalid > valid) {
                ruling = Ruling.OVERTURNED;
            } else {
                ruling = protocolConfig.getTieRuling();
            }
            if (ruling == Ruling.UNRESOLVED) {
                throw new IllegalStateException("平票裁决配置非法: " + ruling);
            }
            dispute.setRuling(ruling);
            dispute.setResolved(true);
            dispute.setResolvedAt(now);
            disputeRepository.save(dispute);
            log.info("{} 裁决争议 {}：有效 {} 票，无效 {} 票，结果 {}", caller, key, valid, invalid, ruling);

            if (ruling == Ruling.OVERTURNED) {
                StateExecutor.current().transfer(protocolConfig.getDisputeCustodyAddress(),
                        dispute.getChallenger(), dispute.getBond());
                ContributionRecord record = contributionRepository.find(key)
                        .orElseThrow(() -> ProtocolException.notFound("贡献记录不存在: " + key));
                contributionSettlement.cancel(key);
                if (protocolConfig.isSlashOnOverturn() && protocolConfig.getOverturnSlashAmount() > 0) {
                    slashConfirmingValidators(record);
                }
            } else {
                StateExecutor.current().transfer(protocolConfig.getDisputeCustodyAddress(),
                        protocolConfig.getTreasuryAddress(), dispute.getBond());
                contributionSettlement.finalizeUpheld(key);
            }
            return dispute;
        });
    }

    private void slashConfirmingValidators(ContributionRecord record) {
        for (Address validator : record.getConfirmingValidators()) {
            if (stakeAccountRepository.find(validator).isPresent()) {
                stakingService.penalize(validator, protocolConfig.getOverturnSlashAmount(),
                        "确认的贡献记录被裁决推翻: " + record.getKey());
            }
        }
    }

    private Dispute requireDispute(ContributionKey key) {
        return disputeRepository.find(key)
                .orElseThrow(() -> ProtocolException.notFound("争议不存在: " + key));
    }

    // ==================== 查询 ====================

    @Override
    public Dispute getDispute(ContributionKey key) {
        return requireDispute(key);
    }

    @Override
    public boolean hasUnresolvedDispute(ContributionKey key) {
        return disputeRepository.hasUnresolvedDispute(key);
    }

    /**
     * 承诺 = SHA-256(贡献键32 + 投票者32 + 投票1 + 盐)
     */
    @Override
    public byte[] computeCommitment(ContributionKey key, Address voter, boolean vote, byte[] salt) {
        return Sha.applySHA256(key.getBytes(), voter.toBytes(), new byte[]{(byte) (vote ? 1 : 0)}, salt);
    }

    @Override
    public List<Dispute> listDisputes(int limit) {
        return disputeRepository.list(limit);
    }
}
