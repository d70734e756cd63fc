package com.bit.attest.oracle;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.structure.contribution.ContributionProof;
import com.bit.attest.structure.contribution.ContributionRecord;
import com.bit.attest.structure.contribution.PayoutSplit;

import java.util.List;

/**
 * 贡献预言机
 * 职责：
 * 接收验证者提交的工人签名证明（域绑定、防重放）；
 * 统计不同验证者的确认数；
 * 终结延迟到期且无争议时按固定比例分账。
 * 关键依赖：
 * 质押注册表（验证者资格）；身份注册表（建筑/工人）；争议仓库（是否存在未决争议）。
 */
public interface ContributionOracle {

    ContributionRecord attest(Address caller, String buildingId, Address workerId, long amount,
                              ContributionProof proof, byte[] signature);

    // 验证者的轻量争议标记：无保证金、无投票，只阻止终结
    ContributionRecord raiseFlag(Address caller, ContributionKey key, String reason);

    ContributionRecord clearFlag(Address admin, ContributionKey key);

    ContributionRecord finalizeContribution(ContributionKey key);

    // ---------------- 查询 ----------------

    ContributionRecord getContribution(ContributionKey key);

    ContributionKey computeKey(String buildingId, Address workerId, long amount);

    boolean isFinalizable(ContributionKey key);

    PayoutSplit previewSplit(long amount);

    boolean isProofConsumed(ContributionProof proof, byte[] signature);

    List<ContributionRecord> listContributions(int limit);
}
