package com.bit.attest.dispute;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.structure.dispute.Dispute;

import java.util.List;

/**
 * 争议仲裁器
 * 职责：
 * 任何人缴纳保证金对未终结的贡献记录发起争议，争议期间阻止终结；
 * 合格验证者承诺-揭示投票（承诺 = SHA-256(键 + 投票者 + 投票 + 盐)）；
 * 揭示截止后按简单多数裁决，驱动预言机终结或取消。
 */
public interface DisputeResolver {

    Dispute raiseDispute(Address caller, ContributionKey key, String reason);

    Dispute commitVote(Address caller, ContributionKey key, byte[] commitment);

    Dispute revealVote(Address caller, ContributionKey key, boolean vote, byte[] salt);

    Dispute resolveDispute(Address caller, ContributionKey key);

    Dispute getDispute(ContributionKey key);

    boolean hasUnresolvedDispute(ContributionKey key);

    byte[] computeCommitment(ContributionKey key, Address voter, boolean vote, byte[] salt);

    List<Dispute> listDisputes(int limit);
}
