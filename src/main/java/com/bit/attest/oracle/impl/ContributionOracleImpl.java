package com.bit.attest.oracle.impl;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.config.ProtocolConfig;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.identity.IdentityRegistry;
import com.bit.attest.oracle.ContributionOracle;
import com.bit.attest.oracle.ContributionSettlement;
import com.bit.attest.oracle.ProofVerifier;
import com.bit.attest.staking.StakingService;
import com.bit.attest.state.ConsumedProofRepository;
import com.bit.attest.state.ContributionRepository;
import com.bit.attest.state.DisputeRepository;
import com.bit.attest.state.StateExecutor;
import com.bit.attest.state.StateTransaction;
import com.bit.attest.structure.contribution.ConsumedProof;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.contribution.PayoutSplit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * 状态机：Proposed -> (确认) -> 可终结 -> Finalized
 * 分支：Disputed -> {维持 -> Finalized, 推翻 -> Cancelled}
 */
@Slf4j
@Component
public class ContributionOracleImpl implements ContributionOracle, ContributionSettlement {

    @Autowired
    private StateExecutor stateExecutor;

    @Autowired
    private ContributionRepository contributionRepository;

    @Autowired
    private ConsumedProofRepository consumedProofRepository;

    @Autowired
    private DisputeRepository disputeRepository;

    @Autowired
    private StakingService stakingService;

    @Autowired
    private IdentityRegistry identityRegistry;

    @Autowired
    private ProofVerifier proofVerifier;

    @Autowired
    private ProtocolConfig protocolConfig;

    @Autowired
    private Clock clock;

    @Override
    public ContributionRecord attest(Address caller, String buildingId, Address workerId, long amount,
                                     ContributionProof proof, byte[] signature) {
        return stateExecutor.execute(() -> {
            if (!stakingService.isQualified(caller)) {
                log.warn("非合格验证者 {} 提交证明被拒绝", caller);
                throw ProtocolException.unauthorized("调用者不是合格验证者: " + caller);
            }
            checkProofWellFormed(proof, signature);
            // 已消费的证明无论挂到哪个三元组上都按重放处理
            byte[] digest = proof.consumptionDigest(signature);
            if (consumedProofRepository.isConsumed(digest)) {
                log.warn("验证者 {} 重放已消费的证明", caller);
                throw ProtocolException.replay("证明已被消费");
            }
            if (amount <= 0) {
                throw ProtocolException.invalid("贡献金额必须为正数: " + amount);
            }
            if (!identityRegistry.isBuildingRegistered(buildingId)) {
                throw ProtocolException.notFound("建筑未注册: " + buildingId);
            }
            if (!identityRegistry.isWorkerActive(workerId)) {
                throw ProtocolException.invalid("工人未激活: " + workerId);
            }
            long now = clock.millis();
            checkProofMatchesClaim(proof, buildingId, workerId, amount, now);
            if (!proofVerifier.verify(proof, signature)) {
                log.warn("验证者 {} 提交的证明签名无效，工人 {}", caller, workerId);
                throw ProtocolException.invalid("证明签名无效");
            }

            ContributionKey key = ContributionKey.of(buildingId, workerId, amount);
            ContributionRecord record = contributionRepository.find(key).orElse(null);
            if (record == null) {
                record = new ContributionRecord(key, buildingId, workerId,
                        identityRegistry.getBuildingWallet(buildingId), amount, now);
                log.info("创建贡献记录 {}，建筑 {}，工人 {}，金额 {}", key, buildingId, workerId, amount);
            } else if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            } else if (record.hasConfirmed(caller)) {
                throw ProtocolException.duplicate("验证者 " + caller + " 已确认过贡献记录 " + key);
            }
            record.getConfirmingValidators().add(caller);
            contributionRepository.save(record);
            consumedProofRepository.save(new ConsumedProof(digest, caller, key, now));
            log.info("验证者 {} 确认贡献记录 {}，确认数 {}", caller, key, record.getConfirmationCount());
            return record;
        });
    }

    /**
     * 证明结构校验，通过后才能计算消费摘要
     */
    static void checkProofWellFormed(ContributionProof proof, byte[] signature) {
        if (proof == null) {
            throw ProtocolException.invalid("证明不能为空");
        }
        if (signature == null || signature.length == 0) {
            throw ProtocolException.invalid("签名不能为空");
        }
        if (proof.getBuildingId() == null || proof.getWorkerId() == null) {
            throw ProtocolException.invalid("证明缺少建筑ID或工人公钥");
        }
        if (proof.getEvidenceRoot() == null || proof.getEvidenceRoot().length != ContributionProof.EVIDENCE_ROOT_LENGTH) {
            throw ProtocolException.invalid("证据根必须为32字节");
        }
    }

    private void checkProofMatchesClaim(ContributionProof proof, String buildingId, Address workerId,
                                        long amount, long now) {
        if (!proof.getBuildingId().equals(buildingId)
                || !proof.getWorkerId().equals(workerId)
                || amount != proof.getAmount()) {
            throw ProtocolException.invalid("证明内容与声明不一致");
        }
        if (proof.getCapturedAt() > now) {
            throw ProtocolException.invalid("证明采集时间晚于当前时间: " + proof.getCapturedAt());
        }
    }

    @Override
    public ContributionRecord raiseFlag(Address caller, ContributionKey key, String reason) {
        return stateExecutor.execute(() -> {
            if (!stakingService.isQualified(caller)) {
                throw ProtocolException.unauthorized("调用者不是合格验证者: " + caller);
            }
            if (reason == null || reason.isBlank()) {
                throw ProtocolException.invalid("争议原因不能为空");
            }
            ContributionRecord record = requireRecord(key);
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            }
            if (record.isDisputed()) {
                throw ProtocolException.duplicate("贡献记录已被标记争议: " + key);
            }
            record.setDisputed(true);
            record.setFlaggedBy(caller);
            record.setFlagReason(reason);
            contributionRepository.save(record);
            log.info("验证者 {} 标记贡献记录 {} 争议，原因: {}", caller, key, reason);
            return record;
        });
    }

    @Override
    public ContributionRecord clearFlag(Address admin, ContributionKey key) {
        return stateExecutor.execute(() -> {
            if (!protocolConfig.isAdmin(admin)) {
                throw ProtocolException.unauthorized("只有管理员可以清除争议标记");
            }
            ContributionRecord record = requireRecord(key);
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            }
            if (!record.isDisputed()) {
                throw ProtocolException.state("贡献记录没有争议标记: " + key);
            }
            clearFlag(record);
            contributionRepository.save(record);
            log.info("管理员 {} 清除贡献记录 {} 的争议标记", admin, key);
            return record;
        });
    }

    @Override
    public ContributionRecord finalizeContribution(ContributionKey key) {
        return stateExecutor.execute(() -> {
            ContributionRecord record = requireRecord(key);
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            }
            long now = clock.millis();
            if (!delayElapsed(record, now)) {
                throw ProtocolException.timing("终结延迟未到，提议时间 " + record.getProposedAt() + "，当前 " + now);
            }
            if (!quorumReached(record)) {
                throw ProtocolException.consensus("确认数不足: " + record.getConfirmationCount()
                        + " < " + protocolConfig.getMinConfirmations());
            }
            if (record.isDisputed() || disputeRepository.hasUnresolvedDispute(key)) {
                throw ProtocolException.disputed("贡献记录存在争议，不能终结: " + key);
            }
            payout(record, now);
            return record;
        });
    }

    @Override
    public boolean finalizeUpheld(ContributionKey key) {
        return stateExecutor.execute(() -> {
            ContributionRecord record = requireRecord(key);
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            }
            clearFlag(record);
            long now = clock.millis();
            if (delayElapsed(record, now) && quorumReached(record)) {
                payout(record, now);
                return true;
            }
            contributionRepository.save(record);
            log.info("贡献记录 {} 争议维持，但确认数或终结延迟未满足，等待后续终结", key);
            return false;
        });
    }

    @Override
    public void cancel(ContributionKey key) {
        stateExecutor.run(() -> {
            ContributionRecord record = requireRecord(key);
            if (record.isTerminal()) {
                throw ProtocolException.state("贡献记录已终结: " + key);
            }
            record.setFinalized(true);
            record.setCancelled(true);
            record.setFinalizedAt(clock.millis());
            contributionRepository.save(record);
            log.info("贡献记录 {} 被裁决推翻，已取消", key);
        });
    }

    private void payout(ContributionRecord record, long now) {
        PayoutSplit split = previewSplit(record.getAmount());
        StateTransaction tx = StateExecutor.current();
        tx.mint(record.getWorkerId(), split.getWorker());
        tx.mint(record.getBuildingWallet(), split.getBuilding());
        tx.mint(protocolConfig.getMaintainerPoolAddress(), split.getMaintainer());
        tx.mint(protocolConfig.getTreasuryAddress(), split.getTreasury());
        record.setFinalized(true);
        record.setFinalizedAt(now);
        contributionRepository.save(record);
        log.info("贡献记录 {} 终结分账：工人 {}，建筑 {}，维护者 {}，国库 {}", record.getKey(),
                split.getWorker(), split.getBuilding(), split.getMaintainer(), split.getTreasury());
    }

    private static void clearFlag(ContributionRecord record) {
        record.setDisputed(false);
        record.setFlaggedBy(null);
        record.setFlagReason(null);
    }

    private boolean delayElapsed(ContributionRecord record, long now) {
        return now - record.getProposedAt() >= protocolConfig.getFinalizationDelay().toMillis();
    }

    private boolean quorumReached(ContributionRecord record) {
        return record.getConfirmationCount() >= protocolConfig.getMinConfirmations();
    }

    private ContributionRecord requireRecord(ContributionKey key) {
        return contributionRepository.find(key)
                .orElseThrow(() -> ProtocolException.notFound("贡献记录不存在: " + key));
    }

    // ==================== 查询 ====================

    @Override
    public ContributionRecord getContribution(ContributionKey key) {
        return requireRecord(key);
    }

    @Override
    public ContributionKey computeKey(String buildingId, Address workerId, long amount) {
        return ContributionKey.of(buildingId, workerId, amount);
    }

    @Override
    public boolean isFinalizable(ContributionKey key) {
        return contributionRepository.find(key)
                .map(record -> !record.isTerminal()
                        && delayElapsed(record, clock.millis())
                        && quorumReached(record)
                        && !record.isDisputed()
                        && !disputeRepository.hasUnresolvedDispute(key))
                .orElse(false);
    }

    @Override
    public PayoutSplit previewSplit(long amount) {
        if (amount <= 0) {
            throw ProtocolException.invalid("分账金额必须为正数: " + amount);
        }
        return PayoutSplit.of(amount, protocolConfig.getWorkerSharePercent(),
                protocolConfig.getBuildingSharePercent(), protocolConfig.getMaintainerSharePercent());
    }

    @Override
    public boolean isProofConsumed(ContributionProof proof, byte[] signature) {
        checkProofWellFormed(proof, signature);
        return consumedProofRepository.isConsumed(proof.consumptionDigest(signature));
    }

    @Override
    public List<ContributionRecord> listContributions(int limit) {
        return contributionRepository.list(limit);
    }
}
