package com.guildledger.ledger;

import com.guildledger.common.exception.StorageConflictException;
import com.guildledger.config.GuildLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process locks keyed by (account, asset) pair or by any other logical key.
 *
 * Keys are always taken in sorted order so two units touching the same pairs
 * cannot deadlock. Locks are reentrant, which lets a unit that already holds a
 * treasury pair run the treasury refill without blocking on itself.
 *
 * An entry lives only while some thread holds or waits for its key; the last
 * one out removes it, so the map stays bounded by the keys in use.
 */
@Component
@Slf4j
public class AccountLockManager {

    private final ConcurrentMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public AccountLockManager(GuildLedgerProperties properties) {
        this.timeoutMs = properties.getLocking().getTimeoutMs();
    }

    public static String balanceKey(String accountId, String assetId) {
        return "balance:" + accountId + ":" + assetId;
    }

    /**
     * Acquire every key, waiting at most the configured timeout for each.
     *
     * @throws StorageConflictException if a key could not be acquired in time
     */
    public Held acquire(Collection<String> keys) {
        Deque<String> acquired = new ArrayDeque<>();
        for (String key : new TreeSet<>(keys)) {
            KeyLock keyLock = enter(key);
            boolean locked;
            try {
                locked = keyLock.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                leave(key);
                Thread.currentThread().interrupt();
                release(acquired);
                throw new StorageConflictException("Interrupted while waiting for lock " + key);
            }
            if (!locked) {
                leave(key);
                release(acquired);
                log.warn("Timed out after {}ms waiting for lock {}", timeoutMs, key);
                throw new StorageConflictException("Timed out waiting for lock " + key);
            }
            acquired.push(key);
        }
        log.debug("Acquired locks {}", keys);
        return new Held(this, acquired);
    }

    /**
     * Number of keys currently held or waited for.
     */
    int size() {
        return locks.size();
    }

    private KeyLock enter(String key) {
        return locks.compute(key, (k, existing) -> {
            KeyLock keyLock = existing == null ? new KeyLock() : existing;
            keyLock.users++;
            return keyLock;
        });
    }

    private void leave(String key) {
        locks.computeIfPresent(key, (k, keyLock) -> --keyLock.users == 0 ? null : keyLock);
    }

    private void release(Deque<String> acquired) {
        while (!acquired.isEmpty()) {
            String key = acquired.pop();
            KeyLock keyLock = locks.get(key);
            if (keyLock == null) {
                throw new IllegalStateException("Lock " + key + " released but not registered");
            }
            keyLock.lock.unlock();
            leave(key);
        }
    }

    private static final class KeyLock {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map's compute
        private int users;
    }

    /**
     * Locks held by the current thread; closing releases them in reverse order.
     */
    public static final class Held implements AutoCloseable {

        private final AccountLockManager owner;
        private final Deque<String> acquired;

        private Held(AccountLockManager owner, Deque<String> acquired) {
            this.owner = owner;
            this.acquired = acquired;
        }

        @Override
        public void close() {
            owner.release(acquired);
        }
    }
}
