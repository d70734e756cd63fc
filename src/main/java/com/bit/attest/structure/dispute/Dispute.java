package com.bit.attest.structure.dispute;

import com.bit.attest.common.Address;
import com.bit.attest.common.ContributionKey;
import com.bit.attest.util.BinaryCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 带保证金的争议，与贡献记录一一对应
 * 承诺阶段 [openedAt, commitDeadline)，揭示阶段 [commitDeadline, revealDeadline)
 * resolved=true 后不可再修改
 */
@Data
@NoArgsConstructor
public class Dispute {

    private ContributionKey contributionKey;

    private Address challenger;

    /**
     * 开启争议时实际锁定的保证金
     */
    private long bond;

    private String reason;

    /**
     * 验证者 -> 32字节承诺哈希（按提交顺序）
     */
    @JsonIgnore
    private Map<Address, byte[]> commitments = new LinkedHashMap<>();

    /**
     * 验证者 -> 揭示的投票（true=证明有效）
     */
    private Map<Address, Boolean> reveals = new LinkedHashMap<>();

    private long openedAt;

    private long commitDeadline;

    private long revealDeadline;

    private Ruling ruling = Ruling.UNRESOLVED;

    private boolean resolved;

    private long resolvedAt;

    public Dispute(ContributionKey contributionKey, Address challenger, long bond, String reason,
                   long openedAt, long commitDeadline, long revealDeadline) {
        this.contributionKey = contributionKey;
        this.challenger = challenger;
        this.bond = bond;
        this.reason = reason;
        this.openedAt = openedAt;
        this.commitDeadline = commitDeadline;
        this.revealDeadline = revealDeadline;
    }

    public boolean hasCommitted(Address voter) {
        return commitments.containsKey(voter);
    }

    public boolean hasRevealed(Address voter) {
        return reveals.containsKey(voter);
    }

    /**
     * 相同的承诺哈希是否已被提交过（不论提交者）
     */
    public boolean containsCommitment(byte[] commitment) {
        for (byte[] existing : commitments.values()) {
            if (Arrays.equals(existing, commitment)) {
                return true;
            }
        }
        return false;
    }

    public int getCommitCount() {
        return commitments.size();
    }

    public int getValidVotes() {
        return (int) reveals.values().stream().filter(Boolean::booleanValue).count();
    }

    public int getInvalidVotes() {
        return reveals.size() - getValidVotes();
    }

    // ==================== 序列化/反序列化 ====================
    // 格式：[键32] [挑战者32] [保证金8] [原因?] [承诺数4 + (验证者32 + 哈希32)*n]
    //      [揭示数4 + (验证者32 + 投票1)*n] [开启8] [承诺截止8] [揭示截止8] [裁决1] [resolved1] [裁决时间8]

    public byte[] serialize() {
        return BinaryCodec.encode(dos -> {
            BinaryCodec.writeKey(dos, contributionKey);
            BinaryCodec.writeAddress(dos, challenger);
            dos.writeLong(bond);
            BinaryCodec.writeString(dos, reason);
            dos.writeInt(commitments.size());
            for (Map.Entry<Address, byte[]> entry : commitments.entrySet()) {
                BinaryCodec.writeAddress(dos, entry.getKey());
                BinaryCodec.writeBytes(dos, entry.getValue());
            }
            dos.writeInt(reveals.size());
            for (Map.Entry<Address, Boolean> entry : reveals.entrySet()) {
                BinaryCodec.writeAddress(dos, entry.getKey());
                dos.writeBoolean(entry.getValue());
            }
            dos.writeLong(openedAt);
            dos.writeLong(commitDeadline);
            dos.writeLong(revealDeadline);
            dos.writeByte(ruling.ordinal());
            dos.writeBoolean(resolved);
            dos.writeLong(resolvedAt);
        });
    }

    public static Dispute deserialize(byte[] data) {
        return BinaryCodec.decode(data, dis -> {
            Dispute dispute = new Dispute();
            dispute.setContributionKey(BinaryCodec.readKey(dis));
            dispute.setChallenger(BinaryCodec.readAddress(dis));
            dispute.setBond(dis.readLong());
            dispute.setReason(BinaryCodec.readString(dis));
            int commitCount = dis.readInt();
            Map<Address, byte[]> commitments = new LinkedHashMap<>();
            for (int i = 0; i < commitCount; i++) {
                commitments.put(BinaryCodec.readAddress(dis), BinaryCodec.readBytes(dis));
            }
            dispute.setCommitments(commitments);
            int revealCount = dis.readInt();
            Map<Address, Boolean> reveals = new LinkedHashMap<>();
            for (int i = 0; i < revealCount; i++) {
                reveals.put(BinaryCodec.readAddress(dis), dis.readBoolean());
            }
            dispute.setReveals(reveals);
            dispute.setOpenedAt(dis.readLong());
            dispute.setCommitDeadline(dis.readLong());
            dispute.setRevealDeadline(dis.readLong());
            dispute.setRuling(Ruling.values()[dis.readByte()]);
            dispute.setResolved(dis.readBoolean());
            dispute.setResolvedAt(dis.readLong());
            return dispute;
        });
    }
}
