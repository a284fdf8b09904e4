package com.guildledger.rewards;

import com.guildledger.assets.AssetService;
import com.guildledger.common.exception.DuplicateClaimException;
import com.guildledger.payments.PaymentService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for message-triggered rewards.
 */
@SpringBootTest
@ActiveProfiles("test")
class AutoRewardServiceTest {

    @Autowired
    private AutoRewardService autoRewardService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private AssetService assetService;

    private String tenantId;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        assetService.createAsset(tenantId, "GOLD", "Gold", 2);
        autoRewardService.configure(tenantId, "welcome", "hello", "GOLD", new BigDecimal("5"));
    }

    @Test
    void testMatchingMessagePaysOnce() {
        Optional<AutoRewardPayout> payout = autoRewardService.onMessage(tenantId, "welcome", "alice", "  hello ");

        assertTrue(payout.isPresent());
        assertEquals("GOLD", payout.get().getSymbol());
        assertEquals(0, new BigDecimal("5").compareTo(payout.get().getAmount()));
        assertEquals(0, new BigDecimal("5").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));

        assertThrows(DuplicateClaimException.class,
            () -> autoRewardService.onMessage(tenantId, "welcome", "alice", "hello"));
        assertEquals(0, new BigDecimal("5").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
    }

    @Test
    void testUnicodeWhitespaceAroundTriggerIsIgnored() {
        autoRewardService.configure(tenantId, "greetings", "\u3000こんにちは ", "GOLD", new BigDecimal("3"));

        Optional<AutoRewardPayout> payout = autoRewardService.onMessage(tenantId, "greetings", "alice",
            "こんにちは\u3000");

        assertTrue(payout.isPresent());
        assertEquals(0, new BigDecimal("3").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals("こんにちは", autoRewardService.list(tenantId).stream()
            .filter(config -> config.getChannelId().equals("greetings"))
            .findFirst().orElseThrow().getTriggerMessage());
    }

    @Test
    void testNonMatchingMessagesAreIgnored() {
        assertTrue(autoRewardService.onMessage(tenantId, "welcome", "alice", "hello there").isEmpty());
        assertTrue(autoRewardService.onMessage(tenantId, "welcome", "alice", "Hello").isEmpty());
        assertTrue(autoRewardService.onMessage(tenantId, "general", "alice", "hello").isEmpty());
        assertEquals(0, paymentService.balance(tenantId, "alice", "GOLD").signum());
    }

    @Test
    void testDisabledRewardDoesNotPay() {
        assertTrue(autoRewardService.disable(tenantId, "welcome"));
        assertTrue(autoRewardService.onMessage(tenantId, "welcome", "alice", "hello").isEmpty());

        assertTrue(autoRewardService.enable(tenantId, "welcome"));
        assertTrue(autoRewardService.onMessage(tenantId, "welcome", "alice", "hello").isPresent());
        assertFalse(autoRewardService.enable(tenantId, "missing"));
    }

    @Test
    void testReconfigureKeepsClaims() {
        autoRewardService.onMessage(tenantId, "welcome", "alice", "hello");

        autoRewardService.configure(tenantId, "welcome", "hi", "GOLD", new BigDecimal("7"));

        assertEquals(1, autoRewardService.list(tenantId).size());
        assertThrows(DuplicateClaimException.class,
            () -> autoRewardService.onMessage(tenantId, "welcome", "alice", "hi"));
        assertEquals(0, new BigDecimal("7").compareTo(
            autoRewardService.onMessage(tenantId, "welcome", "bob", "hi").orElseThrow().getAmount()));
    }

    @Test
    void testRemoveDropsConfigAndClaims() {
        autoRewardService.onMessage(tenantId, "welcome", "alice", "hello");

        assertTrue(autoRewardService.remove(tenantId, "welcome"));
        assertFalse(autoRewardService.remove(tenantId, "welcome"));
        assertTrue(autoRewardService.list(tenantId).isEmpty());

        // A fresh reward in the same channel can be claimed again.
        autoRewardService.configure(tenantId, "welcome", "hello", "GOLD", new BigDecimal("5"));
        assertTrue(autoRewardService.onMessage(tenantId, "welcome", "alice", "hello").isPresent());
        assertEquals(0, new BigDecimal("10").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
    }

    @Test
    void testConcurrentClaimsPayOnce() throws Exception {
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<AutoRewardPayout>>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return autoRewardService.onMessage(tenantId, "welcome", "carol", "hello");
            }));
        }
        start.countDown();

        int paid = 0;
        int duplicates = 0;
        for (Future<Optional<AutoRewardPayout>> result : results) {
            try {
                if (result.get(30, TimeUnit.SECONDS).isPresent()) {
                    paid++;
                }
            } catch (ExecutionException e) {
                assertInstanceOf(DuplicateClaimException.class, e.getCause());
                duplicates++;
            }
        }
        executor.shutdown();

        assertEquals(1, paid);
        assertEquals(threads - 1, duplicates);
        assertEquals(0, new BigDecimal("5").compareTo(paymentService.balance(tenantId, "carol", "GOLD")));
    }
}
