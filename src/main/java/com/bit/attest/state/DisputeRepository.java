package com.bit.attest.state;

import com.bit.attest.common.ContributionKey;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.TableEnum;
import com.bit.attest.structure.dispute.Dispute;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 争议表，以贡献记录键为键（每条记录最多一次争议）
 * 预言机通过本仓库读取争议状态，不直接依赖仲裁服务
 */
@Component
public class DisputeRepository extends AbstractRepository<Dispute> {

    @Autowired
    public DisputeRepository(DataBase dataBase) {
        super(dataBase, TableEnum.DISPUTE);
    }

    public Optional<Dispute> find(ContributionKey key) {
        return load(key.getBytes());
    }

    public boolean hasUnresolvedDispute(ContributionKey key) {
        return find(key).map(dispute -> !dispute.isResolved()).orElse(false);
    }

    public void save(Dispute dispute) {
        store(dispute.getContributionKey().getBytes(), dispute);
    }

    @Override
    protected byte[] serialize(Dispute entity) {
        return entity.serialize();
    }

    @Override
    protected Dispute deserialize(byte[] data) {
        return Dispute.deserialize(data);
    }
}
