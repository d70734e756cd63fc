package com.bit.attest.state;

import com.bit.attest.database.DataBase;
import com.bit.attest.database.TableEnum;
import com.bit.attest.structure.contribution.ConsumedProof;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class ConsumedProofRepository extends AbstractRepository<ConsumedProof> {

    @Autowired
    public ConsumedProofRepository(DataBase dataBase) {
        super(dataBase, TableEnum.CONSUMED_PROOF);
    }

    public boolean isConsumed(byte[] digest) {
        return load(digest).isPresent();
    }

    public Optional<ConsumedProof> find(byte[] digest) {
        return load(digest);
    }

    public void save(ConsumedProof consumed) {
        store(consumed.getDigest(), consumed);
    }

    @Override
    protected byte[] serialize(ConsumedProof entity) {
        return entity.serialize();
    }

    @Override
    protected ConsumedProof deserialize(byte[] data) {
        return ConsumedProof.deserialize(data);
    }
}
