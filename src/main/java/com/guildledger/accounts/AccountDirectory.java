package com.guildledger.accounts;

import com.guildledger.common.exception.AccountNotFoundException;
import com.guildledger.common.exception.StorageConflictException;
import com.guildledger.ledger.AccountLockManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps (tenant, owner, type) to a durable account, creating it on first use.
 *
 * Creation commits in its own transaction so that an account exists as soon as
 * its id is handed out, whatever happens to the caller's unit. Concurrent
 * callers asking for the same account all get the id of the single row.
 */
@Service
@Slf4j
public class AccountDirectory {

    public static final Set<AccountType> SYSTEM_TYPES = EnumSet.complementOf(EnumSet.of(AccountType.USER));

    private final AccountRepository accountRepository;
    private final AccountLockManager lockManager;
    private final TransactionTemplate creationTemplate;

    public AccountDirectory(AccountRepository accountRepository,
                            AccountLockManager lockManager,
                            PlatformTransactionManager transactionManager) {
        this.accountRepository = accountRepository;
        this.lockManager = lockManager;
        this.creationTemplate = new TransactionTemplate(transactionManager);
        this.creationTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Create the tenant's treasury, burn, mint, bank and escrow accounts if missing.
     */
    public void ensureSystemAccounts(String tenantId) {
        requireId(tenantId, "Tenant id");
        for (AccountType type : SYSTEM_TYPES) {
            String name = Account.systemAccountName(tenantId, type);
            ensure(name, () -> new Account(null, tenantId, name, type));
        }
    }

    /**
     * Get or create the member account of a user.
     *
     * @return the account id
     */
    public String ensureUserAccount(String tenantId, String userId) {
        requireId(tenantId, "Tenant id");
        requireId(userId, "User id");
        String name = Account.userAccountName(tenantId, userId);
        return ensure(name, () -> new Account(userId, tenantId, name, AccountType.USER));
    }

    /**
     * Id of a system account by its logical name ({@code treasury}, {@code burn},
     * {@code mint}, {@code bank} or {@code escrow}).
     *
     * @throws AccountNotFoundException if the tenant's system accounts were never created
     */
    @Transactional(readOnly = true)
    public String accountIdByName(String tenantId, String logicalName) {
        AccountType type = AccountType.fromCode(logicalName);
        if (!type.isSystem()) {
            throw new IllegalArgumentException("Not a system account: " + logicalName);
        }
        return systemAccountId(tenantId, type);
    }

    @Transactional(readOnly = true)
    public String systemAccountId(String tenantId, AccountType type) {
        String name = Account.systemAccountName(tenantId, type);
        return accountRepository.findByName(name)
            .map(Account::getId)
            .orElseThrow(() -> new AccountNotFoundException(name));
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return accountRepository.findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findUserAccount(String tenantId, String userId) {
        return accountRepository.findByName(Account.userAccountName(tenantId, userId));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(String tenantId) {
        return accountRepository.findByTenantId(tenantId);
    }

    private String ensure(String name, Supplier<Account> factory) {
        Optional<Account> existing = accountRepository.findByName(name);
        if (existing.isPresent()) {
            return existing.get().getId();
        }

        try (AccountLockManager.Held ignored = lockManager.acquire(List.of("account:" + name))) {
            String id = creationTemplate.execute(status -> accountRepository.findByName(name)
                .orElseGet(() -> {
                    Account created = accountRepository.saveAndFlush(factory.get());
                    log.info("Created account {} ({})", created.getName(), created.getId());
                    return created;
                })
                .getId());
            return id;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // Another process inserted the same name first.
            log.debug("Account {} was created concurrently, reading it back", name);
            return accountRepository.findByName(name)
                .map(Account::getId)
                .orElseThrow(() -> new StorageConflictException("create account " + name, e));
        }
    }

    private static void requireId(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be blank");
        }
    }
}
