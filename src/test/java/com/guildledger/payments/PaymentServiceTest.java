package com.guildledger.payments;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.AssetService;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.common.exception.InsufficientBalanceException;
import com.guildledger.ledger.LedgerEntry;
import com.guildledger.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for transfers, issuance and burning.
 */
@SpringBootTest
@ActiveProfiles("test")
class PaymentServiceTest {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private AccountDirectory accountDirectory;

    @Autowired
    private LedgerService ledgerService;

    private String tenantId;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        assetService.createAsset(tenantId, "GOLD", "Gold", 2);
    }

    @Test
    void testTransferMovesFunds() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("100"), null);

        PaymentReceipt receipt = paymentService.transfer(tenantId, "alice", "bob", "GOLD",
            new BigDecimal("30"), "rent");

        assertEquals("GOLD", receipt.getSymbol());
        assertEquals(0, new BigDecimal("30").compareTo(receipt.getAmount()));
        assertEquals(0, new BigDecimal("70.00").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals(0, new BigDecimal("30.00").compareTo(paymentService.balance(tenantId, "bob", "GOLD")));

        List<LedgerEntry> entries = ledgerService.entriesForTransaction(receipt.getTransactionId());
        assertEquals(2, entries.size());
        assertEquals(0, entries.stream().map(LedgerEntry::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add).signum());
    }

    @Test
    void testInsufficientFundsLeavesBalancesUnchanged() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("10.00"), null);

        InsufficientBalanceException error = assertThrows(InsufficientBalanceException.class,
            () -> paymentService.transfer(tenantId, "alice", "bob", "GOLD", new BigDecimal("10.01"), null));

        assertEquals(0, new BigDecimal("10.01").compareTo(error.getRequired()));
        assertEquals(0, new BigDecimal("10.00").compareTo(error.getAvailable()));
        assertEquals(0, new BigDecimal("10.00").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals(0, paymentService.balance(tenantId, "bob", "GOLD").signum());
    }

    @Test
    void testSelfTransferIsRejected() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("10"), null);

        assertThrows(IllegalArgumentException.class,
            () -> paymentService.transfer(tenantId, "alice", "alice", "GOLD", BigDecimal.ONE, null));
    }

    @Test
    void testAmountsAreTruncatedToAssetPrecision() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("5"), null);

        PaymentReceipt receipt = paymentService.transfer(tenantId, "alice", "bob", "GOLD",
            new BigDecimal("1.239"), null);

        assertEquals(0, new BigDecimal("1.23").compareTo(receipt.getAmount()));
        assertEquals(0, new BigDecimal("3.77").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.transfer(tenantId, "alice", "bob", "GOLD", new BigDecimal("0.009"), null));
        assertThrows(IllegalArgumentException.class,
            () -> paymentService.transfer(tenantId, "alice", "bob", "GOLD", new BigDecimal("-1"), null));
    }

    @Test
    void testIssueDrawsFromTreasury() {
        BigDecimal before = paymentService.treasuryBalance(tenantId, "GOLD");

        paymentService.issue(tenantId, "admin", "alice", "gold", new BigDecimal("250.50"), "welcome");

        assertEquals(0, before.subtract(new BigDecimal("250.50"))
            .compareTo(paymentService.treasuryBalance(tenantId, "GOLD")));
        assertEquals(0, new BigDecimal("250.50").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
    }

    @Test
    void testBurnMovesFundsToBurnAccount() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("20"), null);

        paymentService.burn(tenantId, "alice", "GOLD", new BigDecimal("5"));

        String burnId = accountDirectory.systemAccountId(tenantId, AccountType.BURN);
        String assetId = assetService.getAsset(tenantId, "GOLD").getId();
        assertEquals(0, new BigDecimal("15").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals(0, new BigDecimal("5").compareTo(ledgerService.balanceOf(burnId, assetId)));
        assertThrows(InsufficientBalanceException.class,
            () -> paymentService.burn(tenantId, "alice", "GOLD", new BigDecimal("16")));
    }

    @Test
    void testBalanceOfUnknownMemberIsZero() {
        assertEquals(0, paymentService.balance(tenantId, "nobody", "GOLD").signum());
        assertThrows(AssetNotFoundException.class, () -> paymentService.balance(tenantId, "nobody", "SILVER"));
    }
}
