package com.bit.attest.ledger.impl;

import com.bit.attest.common.Address;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.ledger.LedgerInstruction;
import com.bit.attest.ledger.ValueLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存账本：余额非负，批量指令先在副本上演算，全部通过后再整体替换
 */
@Slf4j
@Component
public class InMemoryValueLedger implements ValueLedger {

    private final Map<Address, Long> balances = new HashMap<>();

    @Override
    public void transfer(Address from, Address to, long amount) {
        settle(List.of(LedgerInstruction.transfer(from, to, amount)));
    }

    @Override
    public void mint(Address to, long amount) {
        settle(List.of(LedgerInstruction.mint(to, amount)));
    }

    @Override
    public synchronized long balanceOf(Address account) {
        return balances.getOrDefault(account, 0L);
    }

    @Override
    public synchronized void settle(List<LedgerInstruction> instructions) {
        if (instructions.isEmpty()) {
            return;
        }
        Map<Address, Long> working = new HashMap<>();
        for (LedgerInstruction instruction : instructions) {
            apply(working, instruction);
        }
        balances.putAll(working);
        log.debug("账本批量结算完成，指令数: {}", instructions.size());
    }

    private void apply(Map<Address, Long> working, LedgerInstruction instruction) {
        long amount = instruction.getAmount();
        if (amount <= 0) {
            throw ProtocolException.invalid("账本金额必须为正数: " + amount);
        }
        Address from = instruction.getFrom();
        Address to = instruction.getTo();
        if (from != null) {
            long fromBalance = working.getOrDefault(from, balances.getOrDefault(from, 0L));
            if (fromBalance < amount) {
                throw ProtocolException.invalid("账户余额不足: " + from + "，余额 " + fromBalance + "，需要 " + amount);
            }
            working.put(from, fromBalance - amount);
        }
        if (to != null) {
            long toBalance = working.getOrDefault(to, balances.getOrDefault(to, 0L));
            working.put(to, Math.addExact(toBalance, amount));
        }
    }
}
