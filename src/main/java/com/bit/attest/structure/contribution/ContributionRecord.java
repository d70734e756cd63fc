package com.bit.attest.structure.contribution;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.util.BinaryCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 贡献记录：由第一次有效证明创建，之后只会被追加确认、打标、终结/取消修改
 * finalized=true 后为终态，不再接受任何修改
 */
@Data
@NoArgsConstructor
public class ContributionRecord {

    private ContributionKey key;

    private String buildingId;

    /**
     * 工人公钥（证明签名者）
     */
    private Address workerId;

    /**
     * 创建时快照的建筑收款钱包，之后建筑改绑钱包不影响本记录
     */
    private Address buildingWallet;

    private long amount;

    /**
     * 确认过该记录的验证者（按确认顺序）
     */
    private Set<Address> confirmingValidators = new LinkedHashSet<>();

    /**
     * 第一次证明的时间（毫秒），终结延迟从此刻起算
     */
    private long proposedAt;

    private boolean finalized;

    /**
     * 被裁决推翻后取消（finalized 同时为 true，但未发放任何资金）
     */
    private boolean cancelled;

    /**
     * 验证者的轻量争议标记（无保证金、无投票），阻止终结
     */
    private boolean disputed;

    private Address flaggedBy;

    private String flagReason;

    private long finalizedAt;

    public ContributionRecord(ContributionKey key, String buildingId, Address workerId,
                              Address buildingWallet, long amount, long proposedAt) {
        this.key = key;
        this.buildingId = buildingId;
        this.workerId = workerId;
        this.buildingWallet = buildingWallet;
        this.amount = amount;
        this.proposedAt = proposedAt;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return finalized;
    }

    public int getConfirmationCount() {
        return confirmingValidators.size();
    }

    public boolean hasConfirmed(Address validator) {
        return confirmingValidators.contains(validator);
    }

    public ContributionStatus getStatus() {
        if (cancelled) {
            return ContributionStatus.CANCELLED;
        }
        if (finalized) {
            return ContributionStatus.FINALIZED;
        }
        if (disputed) {
            return ContributionStatus.DISPUTED;
        }
        return ContributionStatus.PROPOSED;
    }

    // ==================== 序列化/反序列化 ====================
    // 格式：[键32] [建筑ID] [工人32] [钱包32] [金额8] [确认数4 + 验证者32*n] [提议时间8]
    //      [finalized1] [cancelled1] [disputed1] [flaggedBy?] [flagReason?] [终结时间8]

    public byte[] serialize() {
        return BinaryCodec.encode(dos -> {
            BinaryCodec.writeKey(dos, key);
            BinaryCodec.writeString(dos, buildingId);
            BinaryCodec.writeAddress(dos, workerId);
            BinaryCodec.writeAddress(dos, buildingWallet);
            dos.writeLong(amount);
            dos.writeInt(confirmingValidators.size());
            for (Address validator : confirmingValidators) {
                BinaryCodec.writeAddress(dos, validator);
            }
            dos.writeLong(proposedAt);
            dos.writeBoolean(finalized);
            dos.writeBoolean(cancelled);
            dos.writeBoolean(disputed);
            BinaryCodec.writeNullableAddress(dos, flaggedBy);
            BinaryCodec.writeString(dos, flagReason);
            dos.writeLong(finalizedAt);
        });
    }

    public static ContributionRecord deserialize(byte[] data) {
        return BinaryCodec.decode(data, dis -> {
            ContributionRecord record = new ContributionRecord();
            record.setKey(BinaryCodec.readKey(dis));
            record.setBuildingId(BinaryCodec.readString(dis));
            record.setWorkerId(BinaryCodec.readAddress(dis));
            record.setBuildingWallet(BinaryCodec.readAddress(dis));
            record.setAmount(dis.readLong());
            int confirmations = dis.readInt();
            Set<Address> validators = new LinkedHashSet<>();
            for (int i = 0; i < confirmations; i++) {
                validators.add(BinaryCodec.readAddress(dis));
            }
            record.setConfirmingValidators(validators);
            record.setProposedAt(dis.readLong());
            record.setFinalized(dis.readBoolean());
            record.setCancelled(dis.readBoolean());
            record.setDisputed(dis.readBoolean());
            record.setFlaggedBy(BinaryCodec.readNullableAddress(dis));
            record.setFlagReason(BinaryCodec.readString(dis));
            record.setFinalizedAt(dis.readLong());
            return record;
        });
    }
}
