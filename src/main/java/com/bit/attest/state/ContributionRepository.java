package com.bit.attest.state;

import com.bit.attest.common.ContributionKey;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.TableEnum;
import com.bit.attest.structure.contribution.ContributionRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ContributionRepository extends AbstractRepository<ContributionRecord> {

    @Autowired
    public ContributionRepository(DataBase dataBase) {
        super(dataBase, TableEnum.CONTRIBUTION);
    }

    public Optional<ContributionRecord> find(ContributionKey key) {
        return load(key.getBytes());
    }

    public void save(ContributionRecord record) {
        store(record.getKey().getBytes(), record);
    }

    @Override
    protected byte[] serialize(ContributionRecord entity) {
        return entity.serialize();
    }

    @Override
    protected ContributionRecord deserialize(byte[] data) {
        return ContributionRecord.deserialize(data);
    }
}
