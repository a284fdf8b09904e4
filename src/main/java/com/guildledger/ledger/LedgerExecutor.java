package com.guildledger.ledger;

import com.guildledger.common.exception.StorageConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Runs atomic units: one database transaction under a set of in-process locks.
 *
 * The optional prepare step runs under the same locks but outside the
 * transaction. It is where callers top up a treasury, whose refill commits on
 * its own. A unit that loses a race on a row or a unique constraint is replayed
 * from the prepare step; once the retries are spent the failure surfaces as a
 * {@link StorageConflictException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerExecutor {

    private static final Runnable NO_PREPARATION = () -> { };

    private final AccountLockManager lockManager;
    private final TransactionTemplate transactionTemplate;
    private final RetryTemplate ledgerRetryTemplate;

    public <T> T execute(String operation, Collection<String> lockKeys, Supplier<T> unit) {
        return execute(operation, lockKeys, NO_PREPARATION, unit);
    }

    public <T> T execute(String operation, Collection<String> lockKeys, Runnable prepare, Supplier<T> unit) {
        try (AccountLockManager.Held ignored = lockManager.acquire(lockKeys)) {
            return ledgerRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying {} after {}, attempt {}",
                        operation, context.getLastThrowable(), context.getRetryCount() + 1);
                }
                prepare.run();
                return transactionTemplate.execute(status -> unit.get());
            });
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            log.warn("Giving up on {} after repeated storage conflicts", operation, e);
            throw new StorageConflictException(operation, e);
        }
    }
}
