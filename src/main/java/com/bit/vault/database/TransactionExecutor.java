package com.bit.vault.database;

import com.bit.vault.exception.ErrorType;
import com.bit.vault.exception.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 操作串行化与原子提交
 * 所有写操作持有同一把写锁，对应宿主账本的全序执行；任一步抛出异常则本次写入全部作废
 */
@Slf4j
@Component
public class TransactionExecutor {

    private final DataBase dataBase;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public TransactionExecutor(DataBase dataBase, Clock clock, ApplicationEventPublisher publisher) {
        this.dataBase = dataBase;
        this.clock = clock;
        this.publisher = publisher;
    }

    public <T> T execute(Function<StateTransaction, T> action) {
        List<Object> events;
        T result;
        lock.writeLock().lock();
        try {
            StateTransaction tx = new StateTransaction(dataBase, now(), false);
            result = action.apply(tx);
            List<DbOperation> operations = tx.getOperations();
            if (!dataBase.dataTransaction(operations)) {
                throw new VaultException(ErrorType.PERSIST_FAILED, "事务提交失败，操作数: " + operations.size());
            }
            log.debug("事务提交成功，写入{}条，事件{}个", operations.size(), tx.getEvents().size());
            events = tx.getEvents();
        } finally {
            lock.writeLock().unlock();
        }
        events.forEach(publisher::publishEvent);
        return result;
    }

    public <T> T query(Function<StateTransaction, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(new StateTransaction(dataBase, now(), true));
        } finally {
            lock.readLock().unlock();
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
