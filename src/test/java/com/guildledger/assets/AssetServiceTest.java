package com.guildledger.assets;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.allowance.MonthlyAllowanceService;
import com.guildledger.bank.BankService;
import com.guildledger.betting.BettingEvent;
import com.guildledger.betting.BettingService;
import com.guildledger.claims.ClaimService;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.common.exception.DuplicateAssetException;
import com.guildledger.ledger.LedgerEntryRepository;
import com.guildledger.ledger.LedgerService;
import com.guildledger.payments.PaymentService;
import com.guildledger.rewards.AutoRewardService;
import com.guildledger.voice.VcEarningService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the asset registry and the deletion cascade.
 */
@SpringBootTest
@ActiveProfiles("test")
class AssetServiceTest {

    @Autowired
    private AssetService assetService;

    @Autowired
    private AccountDirectory accountDirectory;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private LedgerEntryRepository entryRepository;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private BankService bankService;

    @Autowired
    private ClaimService claimService;

    @Autowired
    private AutoRewardService autoRewardService;

    @Autowired
    private MonthlyAllowanceService allowanceService;

    @Autowired
    private VcEarningService vcEarningService;

    @Autowired
    private BettingService bettingService;

    @Autowired
    private TrippableAssetCascade trippableCascade;

    private String tenantId;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
    }

    @Test
    void testCreateAssetNormalizesSymbolAndIssuesTreasury() {
        String assetId = assetService.createAsset(tenantId, " gold ", "Gold Coin", 2);

        Asset asset = assetService.getAsset(tenantId, "GOLD");
        assertEquals(assetId, asset.getId());
        assertEquals("GOLD", asset.getSymbol());
        assertEquals(2, asset.getDecimals());
        assertEquals(asset, assetService.getAssetById(assetId));

        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        assertEquals(0, new BigDecimal("1000000000").compareTo(ledgerService.balanceOf(treasuryId, assetId)));
        assertEquals(0, new BigDecimal("-1000000000").compareTo(ledgerService.balanceOf(mintId, assetId)));
    }

    @Test
    void testDuplicateSymbolIsRejected() {
        assetService.createAsset(tenantId, "GOLD", "Gold", 2);

        assertThrows(DuplicateAssetException.class, () -> assetService.createAsset(tenantId, "gold", "Other", 0));
        assertEquals(1, assetService.listAssets(tenantId).size());

        // Symbols are scoped to their tenant.
        assertNotNull(assetService.createAsset("tenant-" + UUID.randomUUID(), "GOLD", "Gold", 2));
    }

    @Test
    void testDecimalsOutOfRangeAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> assetService.createAsset(tenantId, "BAD", "Bad", 9));
        assertThrows(IllegalArgumentException.class, () -> assetService.createAsset(tenantId, "BAD", "Bad", -1));
        assertTrue(assetService.findAsset(tenantId, "BAD").isEmpty());
    }

    @Test
    void testUnknownAsset() {
        assertThrows(AssetNotFoundException.class, () -> assetService.getAsset(tenantId, "NOPE"));
        assertThrows(AssetNotFoundException.class, () -> assetService.deleteAsset(tenantId, "NOPE"));
    }

    @Test
    void testListAssetsIsSortedBySymbol() {
        assetService.createAsset(tenantId, "ZED", "Zed", 0);
        assetService.createAsset(tenantId, "ALPHA", "Alpha", 0);

        assertEquals("ALPHA", assetService.listAssets(tenantId).get(0).getSymbol());
        assertEquals("ZED", assetService.listAssets(tenantId).get(1).getSymbol());
    }

    @Test
    void testDeleteAssetCascadesEverySubledger() {
        String goldId = assetService.createAsset(tenantId, "GOLD", "Gold", 2);
        String silverId = assetService.createAsset(tenantId, "SILVER", "Silver", 2);
        populate("GOLD");
        paymentService.issue(tenantId, "admin", "alice", "SILVER", new BigDecimal("5.00"), null);

        AssetDeletionSummary summary = assetService.deleteAsset(tenantId, "gold");

        assertEquals(goldId, summary.getAssetId());
        assertEquals("GOLD", summary.getSymbol());
        assertEquals(1, summary.getDeletedRows("assets"));
        assertTrue(summary.getDeletedRows("ledger_entries") > 0);
        assertTrue(summary.getDeletedRows("account_balances") > 0);
        assertEquals(1, summary.getDeletedRows("bank_accounts"));
        assertEquals(1, summary.getDeletedRows("bank_transactions"));
        assertEquals(1, summary.getDeletedRows("claims"));
        assertEquals(1, summary.getDeletedRows("auto_reward_configs"));
        assertEquals(1, summary.getDeletedRows("auto_reward_claims"));
        assertEquals(1, summary.getDeletedRows("monthly_allowances"));
        assertEquals(1, summary.getDeletedRows("vc_earning_rates"));
        assertEquals(1, summary.getDeletedRows("betting_events"));
        assertEquals(1, summary.getDeletedRows("betting_players"));
        assertEquals(1, summary.getDeletedRows("bets"));

        assertTrue(assetService.findAsset(tenantId, "GOLD").isEmpty());
        assertEquals(0, entryRepository.countByAssetId(goldId));
        assertTrue(autoRewardService.list(tenantId).isEmpty());
        assertTrue(bettingService.activeEvent(tenantId).isEmpty());

        // Other currencies of the tenant are untouched.
        assertTrue(entryRepository.countByAssetId(silverId) > 0);
        assertEquals(0, new BigDecimal("5.00").compareTo(paymentService.balance(tenantId, "alice", "SILVER")));
    }

    @Test
    void testFailedCascadeRollsBackEverything() {
        String goldId = assetService.createAsset(tenantId, "GOLD", "Gold", 2);
        populate("GOLD");
        long entries = entryRepository.countByAssetId(goldId);

        trippableCascade.arm();
        assertThrows(IllegalStateException.class, () -> assetService.deleteAsset(tenantId, "GOLD"));

        assertTrue(assetService.findAsset(tenantId, "GOLD").isPresent());
        assertEquals(entries, entryRepository.countByAssetId(goldId));
        assertEquals(1, autoRewardService.list(tenantId).size());
        assertEquals(0, new BigDecimal("20.00").compareTo(bankService.statement(tenantId, "alice", "GOLD").getBank()));
        assertEquals(1, claimService.pendingFor(tenantId, "alice").size());
        assertTrue(bettingService.activeEvent(tenantId).isPresent());
    }

    private void populate(String symbol) {
        paymentService.issue(tenantId, "admin", "alice", symbol, new BigDecimal("100.00"), "seed");
        bankService.deposit(tenantId, "alice", symbol, new BigDecimal("20.00"));
        claimService.request(tenantId, "bob", "alice", symbol, new BigDecimal("5.00"), "lunch");
        autoRewardService.configure(tenantId, "general", "gm", symbol, new BigDecimal("1.00"));
        autoRewardService.onMessage(tenantId, "general", "alice", "gm");
        allowanceService.configure(tenantId, "member", symbol, new BigDecimal("10.00"));
        vcEarningService.configureRate(tenantId, "voice", symbol, new BigDecimal("0.50"));

        BettingEvent event = bettingService.openEvent(tenantId, "admin", "Final", symbol);
        bettingService.addPlayer(event.getId(), "carol");
        bettingService.placeBet(event.getId(), "alice", "carol", 10);
    }
}
