package com.flagship.topup_gateway.topup;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes saldo read-modify-write sequences per card number within this
 * process.
 *
 * Locks are striped: card numbers hashing to the same stripe share a lock,
 * which bounds memory at the cost of occasional unrelated contention.
 */
@Component
public class CardLockRegistry {

    private final ReentrantLock[] stripes;

    public CardLockRegistry(@Value("${topup.saldo.lock-stripes:64}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("Lock stripe count must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Runs {@code action} while holding the lock for {@code cardNumber}.
     */
    public <T> T withCardLock(String cardNumber, Supplier<T> action) {
        ReentrantLock lock = lockFor(cardNumber);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String cardNumber) {
        return stripes[Math.floorMod(cardNumber.hashCode(), stripes.length)];
    }
}
