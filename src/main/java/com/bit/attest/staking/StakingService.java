package com.bit.attest.staking;

import com.bit.attest.common.Address;
import com.bit.attest.structure.stake.StakeAccount;

import java.util.List;

/**
 * 质押注册表
 * 职责：
 * 验证者质押 / 申请提取 / 延迟到期后提取；
 * 最低质押门槛判断（验证者资格）；
 * 管理员罚没，罚没金额进入国库。
 * 关键依赖：
 * 价值账本（质押资金托管在 stake custody 账户）；
 * 可信时钟（提取延迟）。
 */
public interface StakingService {

    // 质押，首次质押时创建账户
    StakeAccount deposit(Address validator, long amount);

    // 申请提取：从有效质押移入待提取，并重新开始计算提取延迟
    StakeAccount requestWithdrawal(Address validator, long amount);

    // 延迟到期后一次性提取全部待提取金额，返回提取金额
    long completeWithdrawal(Address validator);

    // 管理员罚没有效质押（不触及待提取部分），返回实际罚没金额
    long slash(Address admin, Address validator, long amount, String reason);

    // 协议内部触发的罚没（裁决推翻时），无管理员校验
    long penalize(Address validator, long amount, String reason);

    boolean isQualified(Address validator);

    StakeAccount getStakeAccount(Address validator);

    List<StakeAccount> listStakeAccounts(int limit);
}
