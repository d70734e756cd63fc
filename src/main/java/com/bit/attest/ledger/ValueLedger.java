package com.bit.attest.ledger;

import com.bit.attest.common.Address;

import java.util.List;

/**
 * 价值代币账本（外部协作方）
 * 协议内部的资金移动统一通过 settle 批量原子提交
 */
public interface ValueLedger {

    /**
     * 单笔转账，余额不足时抛出 VALIDATION 错误
     */
    void transfer(Address from, Address to, long amount);

    /**
     * 增发（开发/测试环境给账户注资）
     */
    void mint(Address to, long amount);

    long balanceOf(Address account);

    /**
     * 原子执行一批指令：任一条失败则整批不生效
     */
    void settle(List<LedgerInstruction> instructions);
}
