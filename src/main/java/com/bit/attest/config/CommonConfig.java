package com.bit.attest.config;

import com.bit.attest.structure.dispute.Ruling;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class CommonConfig {

    @Autowired
    private ProtocolConfig protocolConfig;

    @PostConstruct
    public void init() {
        validate(protocolConfig);
        log.info("国库账户: {}", protocolConfig.getTreasuryAddress());
        log.info("维护者池: {}", protocolConfig.getMaintainerPoolAddress());
        log.info("质押托管: {}，争议托管: {}", protocolConfig.getStakeCustodyAddress(),
                protocolConfig.getDisputeCustodyAddress());
        log.info("最低质押 {}，最低确认数 {}，终结延迟 {}", protocolConfig.getMinStake(),
                protocolConfig.getMinConfirmations(), protocolConfig.getFinalizationDelay());
    }

    /**
     * 启动时校验协议参数，非法配置直接拒绝启动
     */
    static void validate(ProtocolConfig config) {
        int shares = config.getWorkerSharePercent() + config.getBuildingSharePercent()
                + config.getMaintainerSharePercent();
        if (config.getWorkerSharePercent() < 0 || config.getBuildingSharePercent() < 0
                || config.getMaintainerSharePercent() < 0 || shares > 100) {
            throw new IllegalStateException("分账比例非法，三项之和不能超过100: " + shares);
        }
        if (config.getMinConfirmations() < 1) {
            throw new IllegalStateException("最低确认数至少为1");
        }
        // 平票只能落到一个确定的裁决上
        if (config.getTieRuling() != Ruling.UPHELD && config.getTieRuling() != Ruling.OVERTURNED) {
            throw new IllegalStateException("平票裁决只能是 UPHELD 或 OVERTURNED: " + config.getTieRuling());
        }
        requirePositive("withdrawal-delay", config.getWithdrawalDelay());
        requirePositive("finalization-delay", config.getFinalizationDelay());
        requirePositive("commit-window", config.getCommitWindow());
        requirePositive("reveal-window", config.getRevealWindow());
    }

    private static void requirePositive(String name, Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalStateException("时间参数 " + name + " 必须为正: " + duration);
        }
    }

    /**
     * 节点可信时钟，协议内所有时间判断都以此为准
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
