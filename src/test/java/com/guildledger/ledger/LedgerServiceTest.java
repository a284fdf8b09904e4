package com.guildledger.ledger;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.AssetService;
import com.guildledger.common.exception.UnbalancedTransactionException;
import com.guildledger.payments.PaymentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for postings, balances and the commit-time balance check.
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private AccountDirectory accountDirectory;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private String tenantId;
    private String goldId;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        goldId = assetService.createAsset(tenantId, "gold", "Gold", 2);
    }

    @Test
    void testUnbalancedTransactionIsRolledBack() {
        String userId = accountDirectory.ensureUserAccount(tenantId, "alice");

        assertThrows(UnbalancedTransactionException.class, () ->
            transactionTemplate.execute(status -> {
                String txId = ledgerService.newTransaction(TransactionKind.ISSUE, "admin", null, "one-legged");
                ledgerService.postEntry(txId, userId, goldId, new BigDecimal("5.00"));
                return txId;
            }));

        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.balanceOf(userId, goldId)));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.replayBalance(userId, goldId)));
    }

    @Test
    void testBalancedTransactionCommits() {
        String aliceId = accountDirectory.ensureUserAccount(tenantId, "alice");
        String bobId = accountDirectory.ensureUserAccount(tenantId, "bob");
        String burnId = accountDirectory.systemAccountId(tenantId, AccountType.BURN);

        String txId = transactionTemplate.execute(status -> {
            String id = ledgerService.newTransaction(TransactionKind.ISSUE, "admin", null, "split");
            ledgerService.postEntry(id, burnId, goldId, new BigDecimal("-3.00"));
            ledgerService.postEntry(id, aliceId, goldId, new BigDecimal("1.25"));
            ledgerService.postEntry(id, bobId, goldId, new BigDecimal("1.75"));
            return id;
        });

        List<LedgerEntry> entries = ledgerService.entriesForTransaction(txId);
        assertEquals(3, entries.size());
        BigDecimal sum = entries.stream().map(LedgerEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, BigDecimal.ZERO.compareTo(sum));
        assertEquals(0, new BigDecimal("1.75").compareTo(ledgerService.balanceOf(bobId, goldId)));
    }

    @Test
    void testPostEntryRequiresActiveTransaction() {
        String userId = accountDirectory.ensureUserAccount(tenantId, "alice");

        assertThrows(IllegalStateException.class, () ->
            ledgerService.postEntry("tx", userId, goldId, BigDecimal.ONE));
    }

    @Test
    void testPostEntryRejectsExcessPrecisionAndZero() {
        String userId = accountDirectory.ensureUserAccount(tenantId, "alice");
        String burnId = accountDirectory.systemAccountId(tenantId, AccountType.BURN);

        assertThrows(IllegalArgumentException.class, () ->
            transactionTemplate.execute(status -> {
                String txId = ledgerService.newTransaction(TransactionKind.ISSUE, null, null, null);
                ledgerService.postEntry(txId, burnId, goldId, new BigDecimal("-0.001"));
                ledgerService.postEntry(txId, userId, goldId, new BigDecimal("0.001"));
                return txId;
            }));

        assertThrows(IllegalArgumentException.class, () ->
            transactionTemplate.execute(status -> {
                String txId = ledgerService.newTransaction(TransactionKind.ISSUE, null, null, null);
                ledgerService.postEntry(txId, userId, goldId, BigDecimal.ZERO);
                return txId;
            }));
    }

    @Test
    void testEightDecimalAmountsRoundTripExactly() {
        assetService.createAsset(tenantId, "DUST", "Dust", 8);

        paymentService.issue(tenantId, "admin", "alice", "DUST", new BigDecimal("0.00000001"), null);
        paymentService.issue(tenantId, "admin", "alice", "DUST", new BigDecimal("1.23456789"), null);

        BigDecimal expected = new BigDecimal("1.23456790");
        assertEquals(0, expected.compareTo(paymentService.balance(tenantId, "alice", "DUST")));

        String aliceId = accountDirectory.ensureUserAccount(tenantId, "alice");
        String dustId = assetService.getAsset(tenantId, "DUST").getId();
        assertEquals(0, expected.compareTo(ledgerService.replayBalance(aliceId, dustId)));
        for (LedgerEntry entry : ledgerService.entriesForAccount(aliceId)) {
            assertTrue(entry.getAmount().scale() <= 8);
        }
    }

    @Test
    void testMaterializedBalanceMatchesReplay() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("50.00"), null);
        paymentService.transfer(tenantId, "alice", "bob", "GOLD", new BigDecimal("12.34"), null);
        paymentService.transfer(tenantId, "bob", "carol", "GOLD", new BigDecimal("2.34"), null);
        paymentService.transfer(tenantId, "alice", "carol", "GOLD", new BigDecimal("0.66"), null);

        for (String user : List.of("alice", "bob", "carol")) {
            String accountId = accountDirectory.ensureUserAccount(tenantId, user);
            assertEquals(0, ledgerService.replayBalance(accountId, goldId)
                .compareTo(ledgerService.balanceOf(accountId, goldId)));
        }
        assertEquals(0, new BigDecimal("37.00").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals(0, new BigDecimal("10.00").compareTo(paymentService.balance(tenantId, "bob", "GOLD")));
        assertEquals(0, new BigDecimal("3.00").compareTo(paymentService.balance(tenantId, "carol", "GOLD")));
    }

    @Test
    void testRebuildBalanceRestoresCache() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("20.00"), null);
        String aliceId = accountDirectory.ensureUserAccount(tenantId, "alice");

        BigDecimal rebuilt = ledgerService.rebuildBalance(aliceId, goldId);

        assertEquals(0, new BigDecimal("20.00").compareTo(rebuilt));
        assertEquals(0, rebuilt.compareTo(ledgerService.balanceOf(aliceId, goldId)));
    }

    @Test
    void testMintBalanceMirrorsSupply() {
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.accountIdByName(tenantId, "mint");

        assertEquals(0, ledgerService.balanceOf(treasuryId, goldId)
            .compareTo(ledgerService.balanceOf(mintId, goldId).negate()));
    }
}
