package com.bit.attest.structure.stake;

import com.bit.attest.common.Address;
import com.bit.attest.util.BinaryCodec;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 验证者质押账户
 * activeStake >= 0，pendingWithdrawal >= 0；activeStake >= MIN_STAKE 时具备验证者资格
 */
@Data
@NoArgsConstructor
public class StakeAccount {

    /**
     * 验证者公钥
     */
    private Address validator;

    /**
     * 有效质押（参与资格判断、可被罚没）
     */
    private long activeStake;

    /**
     * 待提取金额（已退出质押，等待解锁）
     */
    private long pendingWithdrawal;

    /**
     * 待提取金额的解锁时间（毫秒）
     */
    private long withdrawalUnlockTime;

    /**
     * 累计被罚没金额（审计用）
     */
    private long totalSlashed;

    private long createdAt;

    private long updatedAt;

    public StakeAccount(Address validator, long now) {
        this.validator = validator;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isQualified(long minStake) {
        return activeStake >= minStake;
    }

    public boolean hasPendingWithdrawal() {
        return pendingWithdrawal > 0;
    }

    // ==================== 序列化/反序列化 ====================

    public byte[] serialize() {
        return BinaryCodec.encode(dos -> {
            BinaryCodec.writeAddress(dos, validator);
            dos.writeLong(activeStake);
            dos.writeLong(pendingWithdrawal);
            dos.writeLong(withdrawalUnlockTime);
            dos.writeLong(totalSlashed);
            dos.writeLong(createdAt);
            dos.writeLong(updatedAt);
        });
    }

    public static StakeAccount deserialize(byte[] data) {
        return BinaryCodec.decode(data, dis -> {
            StakeAccount account = new StakeAccount();
            account.setValidator(BinaryCodec.readAddress(dis));
            account.setActiveStake(dis.readLong());
            account.setPendingWithdrawal(dis.readLong());
            account.setWithdrawalUnlockTime(dis.readLong());
            account.setTotalSlashed(dis.readLong());
            account.setCreatedAt(dis.readLong());
            account.setUpdatedAt(dis.readLong());
            return account;
        });
    }
}
