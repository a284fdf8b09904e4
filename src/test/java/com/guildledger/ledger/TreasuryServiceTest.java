package com.guildledger.ledger;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.AssetService;
import com.guildledger.payments.PaymentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for treasury auto-refill.
 */
@SpringBootTest
@ActiveProfiles("test")
class TreasuryServiceTest {

    private static final BigDecimal QUANTUM = new BigDecimal("1000000000");

    @Autowired
    private TreasuryService treasuryService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private AccountDirectory accountDirectory;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private PaymentService paymentService;

    private String tenantId;
    private String goldId;
    private String treasuryId;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        goldId = assetService.createAsset(tenantId, "GOLD", "Gold", 0);
        treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
    }

    @Test
    void testNoRefillWhileFunded() {
        assertFalse(treasuryService.autoRefillTreasuryIfNeeded(treasuryId, goldId, tenantId, null));
        assertFalse(treasuryService.autoRefillTreasuryIfNeeded(treasuryId, goldId, tenantId, new BigDecimal("500")));
        assertEquals(0, QUANTUM.compareTo(ledgerService.balanceOf(treasuryId, goldId)));
    }

    @Test
    void testRefillWhenRequiredExceedsBalance() {
        BigDecimal required = QUANTUM.add(BigDecimal.ONE);

        assertTrue(treasuryService.autoRefillTreasuryIfNeeded(treasuryId, goldId, tenantId, required));

        assertEquals(0, QUANTUM.multiply(BigDecimal.valueOf(2)).compareTo(ledgerService.balanceOf(treasuryId, goldId)));
    }

    @Test
    void testIssueBeyondTreasuryRefillsFirst() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", QUANTUM.add(BigDecimal.TEN), null);

        assertEquals(0, QUANTUM.subtract(BigDecimal.TEN)
            .compareTo(paymentService.treasuryBalance(tenantId, "GOLD")));
        assertEquals(0, QUANTUM.add(BigDecimal.TEN).compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
    }

    @Test
    void testConcurrentRefillHappensOnce() throws Exception {
        // Drain the treasury exactly.
        paymentService.issue(tenantId, "admin", "alice", "GOLD", QUANTUM, null);
        assertEquals(0, BigDecimal.ZERO.compareTo(ledgerService.balanceOf(treasuryId, goldId)));

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return treasuryService.autoRefillTreasuryIfNeeded(treasuryId, goldId, tenantId, null);
            }));
        }
        start.countDown();

        int refills = 0;
        for (Future<Boolean> result : results) {
            if (result.get(30, TimeUnit.SECONDS)) {
                refills++;
            }
        }
        executor.shutdown();

        assertEquals(1, refills);
        assertEquals(0, QUANTUM.compareTo(ledgerService.balanceOf(treasuryId, goldId)));
    }

    @Test
    void testNeedsRefill() {
        assertTrue(TreasuryService.needsRefill(BigDecimal.ZERO, null));
        assertTrue(TreasuryService.needsRefill(new BigDecimal("-1"), null));
        assertFalse(TreasuryService.needsRefill(BigDecimal.TEN, null));
        assertFalse(TreasuryService.needsRefill(BigDecimal.TEN, BigDecimal.TEN));
        assertTrue(TreasuryService.needsRefill(BigDecimal.TEN, new BigDecimal("10.01")));
    }
}
