package com.bit.attest.state;

import com.bit.attest.database.DataBase;
import com.bit.attest.database.DbOperation;
import com.bit.attest.exception.ErrorType;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.ledger.LedgerInstruction;
import com.bit.attest.ledger.ValueLedger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 单写者定序器：所有修改状态的协议操作在同一线程上串行执行
 * 每个操作对应一个 StateTransaction，成功后先结算账本再原子写库，失败则丢弃暂存
 * 嵌套调用（仲裁器驱动预言机终结/取消）直接加入外层事务
 */
@Slf4j
@Component
public class StateExecutor {

    private static final ThreadLocal<StateTransaction> CURRENT = new ThreadLocal<>();

    private final DataBase dataBase;

    private final ValueLedger valueLedger;

    private final ExecutorService sequencer = Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                    .setNameFormat("state-sequencer-%d")
                    .setDaemon(true)
                    .build());

    @Autowired
    public StateExecutor(DataBase dataBase, ValueLedger valueLedger) {
        this.dataBase = dataBase;
        this.valueLedger = valueLedger;
    }

    /**
     * 当前线程上的活动事务，没有则返回 null
     */
    public static StateTransaction current() {
        return CURRENT.get();
    }

    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public <T> T execute(Supplier<T> operation) {
        if (CURRENT.get() != null) {
            // 嵌套操作加入外层事务
            return operation.get();
        }
        Future<T> future = sequencer.submit(() -> runInTransaction(operation));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProtocolException(ErrorType.STORAGE, "等待定序器执行时被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new ProtocolException(ErrorType.STORAGE, "协议操作执行失败", cause);
        }
    }

    private <T> T runInTransaction(Supplier<T> operation) {
        StateTransaction tx = new StateTransaction(dataBase);
        CURRENT.set(tx);
        try {
            T result = operation.get();
            commit(tx);
            return result;
        } finally {
            CURRENT.remove();
        }
    }

    private void commit(StateTransaction tx) {
        if (tx.isEmpty()) {
            return;
        }
        List<LedgerInstruction> instructions = tx.getLedgerInstructions();
        // 账本先结算：余额不足等错误在此抛出，数据库尚未写入
        valueLedger.settle(instructions);
        List<DbOperation> operations = tx.toDbOperations();
        if (operations.isEmpty() || dataBase.dataTransaction(operations)) {
            return;
        }
        log.error("状态落盘失败，冲正账本指令 {} 条", instructions.size());
        List<LedgerInstruction> reversal = new ArrayList<>(instructions.size());
        for (int i = instructions.size() - 1; i >= 0; i--) {
            reversal.add(instructions.get(i).reverse());
        }
        try {
            valueLedger.settle(reversal);
        } catch (RuntimeException e) {
            log.error("账本冲正失败，账本与状态可能不一致", e);
        }
        throw new ProtocolException(ErrorType.STORAGE, "状态持久化失败，操作已回滚");
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        log.info("关闭状态定序器");
        sequencer.shutdown();
        if (!sequencer.awaitTermination(5, TimeUnit.SECONDS)) {
            sequencer.shutdownNow();
        }
    }
}
