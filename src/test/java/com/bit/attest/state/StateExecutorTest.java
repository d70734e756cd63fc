package com.bit.attest.state;

import com.bit.attest.common.Address;
import com.bit.attest.database.DbOperation;
import com.bit.attest.database.memory.MemoryDb;
import com.bit.attest.exception.ErrorType;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.ledger.impl.InMemoryValueLedger;
import com.bit.attest.structure.stake.StakeAccount;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 定序器事务的原子性：失败的操作不留下任何表写入或账本变动
 */
@Slf4j
public class StateExecutorTest {

    private final AtomicBoolean failWrites = new AtomicBoolean(false);

    private MemoryDb dataBase;
    private InMemoryValueLedger ledger;
    private StateExecutor executor;
    private StakeAccountRepository repository;

    private final Address alice = Address.derive("alice");
    private final Address bob = Address.derive("bob");

    @BeforeEach
    void setUp() {
        dataBase = new MemoryDb() {
            @Override
            public boolean dataTransaction(List<DbOperation> operations) {
                return !failWrites.get() && super.dataTransaction(operations);
            }
        };
        ledger = new InMemoryValueLedger();
        executor = new StateExecutor(dataBase, ledger);
        repository = new StakeAccountRepository(dataBase);
        ledger.mint(alice, 100);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdown();
    }

    private void stakeAndPay(long stake, long payment) {
        StakeAccount account = repository.find(alice).orElseGet(() -> new StakeAccount(alice, 1L));
        account.setActiveStake(account.getActiveStake() + stake);
        repository.save(account);
        StateExecutor.current().transfer(alice, bob, payment);
    }

    @Test
    void successfulOperationCommitsWritesAndLedger() {
        executor.run(() -> stakeAndPay(10, 40));

        assertEquals(10, repository.find(alice).orElseThrow().getActiveStake());
        assertEquals(60, ledger.balanceOf(alice));
        assertEquals(40, ledger.balanceOf(bob));
    }

    @Test
    void readsSeeOwnStagedWrites() {
        long stake = executor.execute(() -> {
            stakeAndPay(10, 1);
            stakeAndPay(5, 1);
            return repository.find(alice).orElseThrow().getActiveStake();
        });
        assertEquals(15, stake);
    }

    @Test
    void thrownErrorDiscardsEverything() {
        assertThrows(ProtocolException.class, () -> executor.run(() -> {
            stakeAndPay(10, 40);
            throw ProtocolException.state("中途失败");
        }));

        assertTrue(repository.find(alice).isEmpty());
        assertEquals(100, ledger.balanceOf(alice));
        assertEquals(0, ledger.balanceOf(bob));
    }

    @Test
    void ledgerFailureDiscardsTableWrites() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> executor.run(() -> stakeAndPay(10, 500)));

        assertEquals(ErrorType.VALIDATION, e.getErrorType());
        assertTrue(repository.find(alice).isEmpty());
        assertEquals(100, ledger.balanceOf(alice));
    }

    @Test
    void storageFailureReversesLedger() {
        failWrites.set(true);

        ProtocolException e = assertThrows(ProtocolException.class, () -> executor.run(() -> stakeAndPay(10, 40)));

        assertEquals(ErrorType.STORAGE, e.getErrorType());
        assertTrue(repository.find(alice).isEmpty());
        assertEquals(100, ledger.balanceOf(alice));
        assertEquals(0, ledger.balanceOf(bob));
    }

    @Test
    void nestedOperationJoinsOuterTransaction() {
        assertThrows(ProtocolException.class, () -> executor.run(() -> {
            executor.run(() -> stakeAndPay(10, 40));
            throw ProtocolException.consensus("外层失败");
        }));

        assertTrue(repository.find(alice).isEmpty());
        assertEquals(100, ledger.balanceOf(alice));
    }

    @Test
    void writesOutsideSequencerAreRejected() {
        assertThrows(IllegalStateException.class, () -> repository.save(new StakeAccount(alice, 1L)));
    }
}
