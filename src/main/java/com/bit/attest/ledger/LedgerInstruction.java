package com.bit.attest.ledger;

import com.bit.attest.common.Address;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 账本指令：一次转账或一次增发
 */
@Getter
@ToString
@AllArgsConstructor
public class LedgerInstruction {

    public enum Type { TRANSFER, MINT }

    private final Type type;
    // MINT 时为 null
    private final Address from;
    private final Address to;
    private final long amount;

    public static LedgerInstruction transfer(Address from, Address to, long amount) {
        return new LedgerInstruction(Type.TRANSFER, from, to, amount);
    }

    public static LedgerInstruction mint(Address to, long amount) {
        return new LedgerInstruction(Type.MINT, null, to, amount);
    }

    /**
     * 冲正指令（用于状态落盘失败后的账本回滚）
     */
    public LedgerInstruction reverse() {
        if (type == Type.MINT) {
            return new LedgerInstruction(Type.TRANSFER, to, null, amount);
        }
        return transfer(to, from, amount);
    }
}
