package com.bit.attest.state;

import com.bit.attest.common.Address;
import com.bit.attest.database.DataBase;
import com.bit.attest.database.TableEnum;
import com.bit.attest.structure.stake.StakeAccount;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class StakeAccountRepository extends AbstractRepository<StakeAccount> {

    @Autowired
    public StakeAccountRepository(DataBase dataBase) {
        super(dataBase, TableEnum.STAKE_ACCOUNT);
    }

    public Optional<StakeAccount> find(Address validator) {
        return load(validator.toBytes());
    }

    public void save(StakeAccount account) {
        store(account.getValidator().toBytes(), account);
    }

    @Override
    protected byte[] serialize(StakeAccount entity) {
        return entity.serialize();
    }

    @Override
    protected StakeAccount deserialize(byte[] data) {
        return StakeAccount.deserialize(data);
    }
}
