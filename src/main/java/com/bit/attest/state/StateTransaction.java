package com.bit.attest.state;

import com.bit.attest.common.Address;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.DbOperation;
import com.bit.attest.database.TableEnum;
import com.bit.attest.ledger.LedgerInstruction;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次协议操作的暂存区：表写入与账本指令都先暂存，操作成功后一次性提交
 * 读操作先查暂存区再查数据库（读己之写）
 */
public class StateTransaction {

    private final DataBase dataBase;

    private final Map<TableEnum, Map<ByteBuffer, byte[]>> staged = new EnumMap<>(TableEnum.class);

    private final List<LedgerInstruction> ledgerInstructions = new ArrayList<>();

    StateTransaction(DataBase dataBase) {
        this.dataBase = dataBase;
    }

    public byte[] get(TableEnum table, byte[] key) {
        Map<ByteBuffer, byte[]> tableWrites = staged.get(table);
        if (tableWrites != null) {
            byte[] value = tableWrites.get(ByteBuffer.wrap(key));
            if (value != null) {
                return value;
            }
        }
        return dataBase.get(table, key);
    }

    public void put(TableEnum table, byte[] key, byte[] value) {
        staged.computeIfAbsent(table, t -> new LinkedHashMap<>())
                .put(ByteBuffer.wrap(key.clone()), value);
    }

    public void transfer(Address from, Address to, long amount) {
        if (amount > 0) {
            ledgerInstructions.add(LedgerInstruction.transfer(from, to, amount));
        }
    }

    public void mint(Address to, long amount) {
        if (amount > 0) {
            ledgerInstructions.add(LedgerInstruction.mint(to, amount));
        }
    }

    public List<LedgerInstruction> getLedgerInstructions() {
        return Collections.unmodifiableList(ledgerInstructions);
    }

    List<DbOperation> toDbOperations() {
        List<DbOperation> operations = new ArrayList<>();
        staged.forEach((table, writes) -> writes.forEach((key, value) ->
                operations.add(DbOperation.put(table, key.array(), value))));
        return operations;
    }

    public boolean isEmpty() {
        return ledgerInstructions.isEmpty() && staged.values().stream().allMatch(Map::isEmpty);
    }
}
