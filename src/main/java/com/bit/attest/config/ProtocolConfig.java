package com.bit.attest.config;

import com.bit.attest.common.Address;
import com.bit.attest.structure.dispute.Ruling;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 协议参数：质押门槛、各时间窗口、分账比例、争议保证金、系统账户
 * 系统账户未配置时由固定种子派生
 */
@Data
@Component
@ConfigurationProperties(prefix = "protocol")
public class ProtocolConfig {

    // ---------------- 质押 ----------------
    private long minStake = 1000;
    private Duration withdrawalDelay = Duration.ofDays(7);

    // ---------------- 贡献预言机 ----------------
    private Duration finalizationDelay = Duration.ofHours(24);
    private int minConfirmations = 2;
    // 分账比例（百分比），国库吸收余数
    private int workerSharePercent = 70;
    private int buildingSharePercent = 10;
    private int maintainerSharePercent = 10;

    // ---------------- 争议仲裁 ----------------
    private long disputeBond = 100;
    private Duration commitWindow = Duration.ofHours(24);
    private Duration revealWindow = Duration.ofHours(25);
    // 平票或无人揭示时的默认裁决
    private Ruling tieRuling = Ruling.UPHELD;
    // 裁决推翻时自动罚没确认过该记录的验证者
    private boolean slashOnOverturn = false;
    private long overturnSlashAmount = 0;

    // ---------------- 签名域 ----------------
    private String domainName = "BILT Contribution Oracle";
    private String domainVersion = "1";
    private long chainId = 1;

    // ---------------- 系统账户（Base58，留空则派生） ----------------
    private String treasury;
    private String maintainerPool;
    private String stakeCustody;
    private String disputeCustody;
    private String oracleAccount;

    // 管理员列表（Base58公钥）
    private List<String> admins = new ArrayList<>();

    public Address getTreasuryAddress() {
        return resolve(treasury, "treasury");
    }

    public Address getMaintainerPoolAddress() {
        return resolve(maintainerPool, "maintainer-pool");
    }

    public Address getStakeCustodyAddress() {
        return resolve(stakeCustody, "stake-custody");
    }

    public Address getDisputeCustodyAddress() {
        return resolve(disputeCustody, "dispute-custody");
    }

    /**
     * 签名域中的验证合约地址
     */
    public Address getOracleAddress() {
        return resolve(oracleAccount, "contribution-oracle");
    }

    public boolean isAdmin(Address caller) {
        if (caller == null) {
            return false;
        }
        for (String admin : admins) {
            if (Address.fromBase58(admin).equals(caller)) {
                return true;
            }
        }
        return false;
    }

    private static Address resolve(String configured, String seed) {
        if (configured == null || configured.isBlank()) {
            return Address.derive(seed);
        }
        return Address.fromBase58(configured);
    }
}
