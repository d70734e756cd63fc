package com.bit.attest.staking;

import com.bit.attest.ProtocolTestSupport;
import com.bit.attest.common.Address;
import com.bit.attest.exception.ErrorType;
import com.bit.attest.structure.stake.StakeAccount;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class StakingServiceTest extends ProtocolTestSupport {

    @Test
    void depositMovesFundsIntoCustody() {
        Address custody = protocolConfig.getStakeCustodyAddress();
        long custodyBefore = valueLedger.balanceOf(custody);
        Address validator = randomAddress();
        valueLedger.mint(validator, 1500);

        StakeAccount account = stakingService.deposit(validator, 1200);

        assertEquals(1200, account.getActiveStake());
        assertEquals(300, valueLedger.balanceOf(validator));
        assertEquals(custodyBefore + 1200, valueLedger.balanceOf(custody));
        assertTrue(stakingService.isQualified(validator));
        log.info("质押账户: {}", stakingService.getStakeAccount(validator));
    }

    @Test
    void depositRejectsNonPositiveAmount() {
        Address validator = randomAddress();
        assertError(ErrorType.VALIDATION, () -> stakingService.deposit(validator, 0));
        assertError(ErrorType.VALIDATION, () -> stakingService.deposit(validator, -5));
        assertError(ErrorType.NOT_FOUND, () -> stakingService.getStakeAccount(validator));
    }

    @Test
    void depositWithoutFundsLeavesNoAccount() {
        Address validator = randomAddress();
        valueLedger.mint(validator, 10);

        assertError(ErrorType.VALIDATION, () -> stakingService.deposit(validator, 1000));

        assertError(ErrorType.NOT_FOUND, () -> stakingService.getStakeAccount(validator));
        assertEquals(10, valueLedger.balanceOf(validator));
    }

    @Test
    void qualificationFollowsMinimumStake() {
        Address small = newValidator(999);
        Address exact = newValidator(1000);
        assertFalse(stakingService.isQualified(small));
        assertTrue(stakingService.isQualified(exact));
        assertFalse(stakingService.isQualified(randomAddress()));
    }

    @Test
    void withdrawalHonoursDelay() {
        Address validator = newValidator(2000);

        assertError(ErrorType.NOT_FOUND, () -> stakingService.requestWithdrawal(randomAddress(), 10));
        assertError(ErrorType.VALIDATION, () -> stakingService.requestWithdrawal(validator, 0));
        assertError(ErrorType.VALIDATION, () -> stakingService.requestWithdrawal(validator, 2001));
        assertError(ErrorType.STATE, () -> stakingService.completeWithdrawal(validator));

        StakeAccount account = stakingService.requestWithdrawal(validator, 1500);
        assertEquals(500, account.getActiveStake());
        assertEquals(1500, account.getPendingWithdrawal());
        assertFalse(stakingService.isQualified(validator));

        clock.advance(Duration.ofDays(7).minusMillis(1));
        assertError(ErrorType.TIMING, () -> stakingService.completeWithdrawal(validator));

        clock.advance(Duration.ofMillis(1));
        long withdrawn = stakingService.completeWithdrawal(validator);
        assertEquals(1500, withdrawn);
        assertEquals(1500, valueLedger.balanceOf(validator));
        assertEquals(0, stakingService.getStakeAccount(validator).getPendingWithdrawal());
    }

    @Test
    void secondRequestAddsToPendingAndRestartsDelay() {
        Address validator = newValidator(3000);
        StakeAccount first = stakingService.requestWithdrawal(validator, 1000);
        long firstUnlock = first.getWithdrawalUnlockTime();

        clock.advance(Duration.ofDays(3));
        StakeAccount second = stakingService.requestWithdrawal(validator, 500);

        assertEquals(1500, second.getPendingWithdrawal());
        assertEquals(1500, second.getActiveStake());
        assertEquals(firstUnlock + Duration.ofDays(3).toMillis(), second.getWithdrawalUnlockTime());

        clock.advance(Duration.ofDays(5));
        assertError(ErrorType.TIMING, () -> stakingService.completeWithdrawal(validator));
    }

    @Test
    void slashIsAdminOnlyAndCappedAtActiveStake() {
        Address validator = newValidator(1200);
        stakingService.requestWithdrawal(validator, 200);
        Address treasury = protocolConfig.getTreasuryAddress();
        long treasuryBefore = valueLedger.balanceOf(treasury);

        assertError(ErrorType.AUTHORIZATION, () -> stakingService.slash(validator, validator, 100, "自罚"));
        assertError(ErrorType.VALIDATION, () -> stakingService.slash(admin, validator, 0, "零"));
        assertError(ErrorType.NOT_FOUND, () -> stakingService.slash(admin, randomAddress(), 10, "未知"));

        long slashed = stakingService.slash(admin, validator, 5000, "虚假证明");

        StakeAccount account = stakingService.getStakeAccount(validator);
        assertEquals(1000, slashed);
        assertEquals(0, account.getActiveStake());
        assertEquals(200, account.getPendingWithdrawal());
        assertEquals(1000, account.getTotalSlashed());
        assertEquals(treasuryBefore + 1000, valueLedger.balanceOf(treasury));
    }
}
