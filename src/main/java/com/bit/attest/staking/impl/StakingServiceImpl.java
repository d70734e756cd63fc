package com.bit.attest.staking.impl;

import com.bit.attest.common.Address;
import com.bit.attest.config.ProtocolConfig;
import com.bit.attest.exception.ProtocolException;
import com.bit.attest.staking.StakingService;
import com.bit.attest.state.StakeAccountRepository;
import com.bit.attest.state.StateExecutor;
import com.bit.attest.state.StateTransaction;
import com.bit.attest.structure.stake.StakeAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Slf4j
@Component
public class StakingServiceImpl implements StakingService {

    @Autowired
    private StateExecutor stateExecutor;

    @Autowired
    private StakeAccountRepository stakeAccountRepository;

    @Autowired
    private ProtocolConfig protocolConfig;

    @Autowired
    private Clock clock;

    @Override
    public StakeAccount deposit(Address validator, long amount) {
        return stateExecutor.execute(() -> {
            if (amount <= 0) {
                throw ProtocolException.invalid("质押金额必须为正数: " + amount);
            }
            long now = clock.millis();
            StakeAccount account = stakeAccountRepository.find(validator)
                    .orElseGet(() -> new StakeAccount(validator, now));
            account.setActiveStake(Math.addExact(account.getActiveStake(), amount));
            account.setUpdatedAt(now);
            stakeAccountRepository.save(account);
            StateExecutor.current().transfer(validator, protocolConfig.getStakeCustodyAddress(), amount);
            log.info("验证者 {} 质押 {}，当前有效质押 {}", validator, amount, account.getActiveStake());
            return account;
        });
    }

    @Override
    public StakeAccount requestWithdrawal(Address validator, long amount) {
        return stateExecutor.execute(() -> {
            StakeAccount account = requireAccount(validator);
            if (amount <= 0) {
                throw ProtocolException.invalid("提取金额必须为正数: " + amount);
            }
            if (amount > account.getActiveStake()) {
                throw ProtocolException.invalid("提取金额 " + amount + " 超过有效质押 " + account.getActiveStake());
            }
            long now = clock.millis();
            account.setActiveStake(account.getActiveStake() - amount);
            account.setPendingWithdrawal(account.getPendingWithdrawal() + amount);
            account.setWithdrawalUnlockTime(now + protocolConfig.getWithdrawalDelay().toMillis());
            account.setUpdatedAt(now);
            stakeAccountRepository.save(account);
            log.info("验证者 {} 申请提取 {}，待提取 {}，解锁时间 {}", validator, amount,
                    account.getPendingWithdrawal(), account.getWithdrawalUnlockTime());
            return account;
        });
    }

    @Override
    public long completeWithdrawal(Address validator) {
        return stateExecutor.execute(() -> {
            StakeAccount account = requireAccount(validator);
            if (!account.hasPendingWithdrawal()) {
                throw ProtocolException.state("验证者没有待提取的金额: " + validator);
            }
            long now = clock.millis();
            if (now < account.getWithdrawalUnlockTime()) {
                throw ProtocolException.timing("提取尚未解锁，解锁时间 " + account.getWithdrawalUnlockTime() + "，当前 " + now);
            }
            long amount = account.getPendingWithdrawal();
            account.setPendingWithdrawal(0);
            account.setWithdrawalUnlockTime(0);
            account.setUpdatedAt(now);
            stakeAccountRepository.save(account);
            StateExecutor.current().transfer(protocolConfig.getStakeCustodyAddress(), validator, amount);
            log.info("验证者 {} 完成提取 {}", validator, amount);
            return amount;
        });
    }

    @Override
    public long slash(Address admin, Address validator, long amount, String reason) {
        return stateExecutor.execute(() -> {
            if (!protocolConfig.isAdmin(admin)) {
                log.warn("非管理员 {} 尝试罚没验证者 {}", admin, validator);
                throw ProtocolException.unauthorized("只有管理员可以罚没质押");
            }
            return penalize(validator, amount, reason);
        });
    }

    @Override
    public long penalize(Address validator, long amount, String reason) {
        return stateExecutor.execute(() -> {
            if (amount <= 0) {
                throw ProtocolException.invalid("罚没金额必须为正数: " + amount);
            }
            StakeAccount account = requireAccount(validator);
            long slashed = Math.min(amount, account.getActiveStake());
            account.setActiveStake(account.getActiveStake() - slashed);
            account.setTotalSlashed(account.getTotalSlashed() + slashed);
            account.setUpdatedAt(clock.millis());
            stakeAccountRepository.save(account);
            StateTransaction tx = StateExecutor.current();
            tx.transfer(protocolConfig.getStakeCustodyAddress(), protocolConfig.getTreasuryAddress(), slashed);
            log.info("罚没验证者 {} 质押 {}（请求 {}），原因: {}，剩余有效质押 {}",
                    validator, slashed, amount, reason, account.getActiveStake());
            return slashed;
        });
    }

    @Override
    public boolean isQualified(Address validator) {
        if (validator == null) {
            return false;
        }
        return stakeAccountRepository.find(validator)
                .map(account -> account.isQualified(protocolConfig.getMinStake()))
                .orElse(false);
    }

    @Override
    public StakeAccount getStakeAccount(Address validator) {
        return requireAccount(validator);
    }

    @Override
    public List<StakeAccount> listStakeAccounts(int limit) {
        return stakeAccountRepository.list(limit);
    }

    private StakeAccount requireAccount(Address validator) {
        return stakeAccountRepository.find(validator)
                .orElseThrow(() -> ProtocolException.notFound("验证者质押账户不存在: " + validator));
    }
}
