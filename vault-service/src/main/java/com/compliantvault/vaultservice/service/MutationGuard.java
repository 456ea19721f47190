package com.compliantvault.vaultservice.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single critical section around every mutation of balances and pending requests.
 * Work runs in one transaction which commits before the lock is handed over.
 */
@Component
@RequiredArgsConstructor
public class MutationGuard {

    private final TransactionTemplate tx;
    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T execute(Supplier<T> work) {
        lock.lock();
        try {
            return tx.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable work) {
        lock.lock();
        try {
            tx.executeWithoutResult(status -> work.run());
        } finally {
            lock.unlock();
        }
    }
}
