package com.bit.attest.state;

import com.bit.attest.database.DataBase;
import com.bit.attest.database.TableEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 按表存取实体：定序器线程内读写走当前事务，其余线程只读已提交状态
 */
public abstract class AbstractRepository<T> {

    protected final DataBase dataBase;

    private final TableEnum table;

    protected AbstractRepository(DataBase dataBase, TableEnum table) {
        this.dataBase = dataBase;
        this.table = table;
    }

    protected abstract byte[] serialize(T entity);

    protected abstract T deserialize(byte[] data);

    protected Optional<T> load(byte[] key) {
        StateTransaction tx = StateExecutor.current();
        byte[] data = tx != null ? tx.get(table, key) : dataBase.get(table, key);
        return data == null ? Optional.empty() : Optional.of(deserialize(data));
    }

    protected void store(byte[] key, T entity) {
        StateTransaction tx = StateExecutor.current();
        if (tx == null) {
            throw new IllegalStateException("写入 " + table.getColumnFamilyName() + " 必须在定序器事务内进行");
        }
        tx.put(table, key, serialize(entity));
    }

    /**
     * 按键序遍历已提交的实体
     */
    public List<T> list(int limit) {
        List<T> result = new ArrayList<>();
        if (limit <= 0) {
            return result;
        }
        dataBase.iterate(table, (key, value) -> {
            result.add(deserialize(value));
            return result.size() < limit;
        });
        return result;
    }

    public int count() {
        return dataBase.count(table);
    }
}
