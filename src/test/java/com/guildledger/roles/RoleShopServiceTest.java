package com.guildledger.roles;

import com.guildledger.assets.AssetService;
import com.guildledger.common.exception.InsufficientBalanceException;
import com.guildledger.payments.PaymentService;
import com.guildledger.providers.InMemoryGuildRoles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the role shop and role expiry.
 */
@SpringBootTest
@ActiveProfiles("test")
class RoleShopServiceTest {

    @Autowired
    private RoleShopService roleShopService;

    @Autowired
    private RoleExpiryService roleExpiryService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private AssetService assetService;

    @Autowired
    private InMemoryGuildRoles guildRoles;

    private String tenantId;
    private RolePanel panel;
    private RolePlan plan;

    @BeforeEach
    void setUp() {
        tenantId = "tenant-" + UUID.randomUUID();
        assetService.createAsset(tenantId, "GOLD", "Gold", 2);
        panel = roleShopService.createPanel(tenantId, 1, "VIP", "vip-panel-role", "GOLD");
        plan = roleShopService.addPlan(panel.getId(), "VIP for a day", "vip", new BigDecimal("25"), 24, "Shiny");
    }

    @Test
    void testPurchasePaysTreasuryAndGrantsRole() {
        paymentService.issue(tenantId, "admin", "alice", "GOLD", new BigDecimal("40"), null);
        BigDecimal treasuryBefore = paymentService.treasuryBalance(tenantId, "GOLD");

        RolePurchase purchase = roleShopService.purchase(tenantId, "alice", plan.getId());

        assertEquals("vip", purchase.getRoleId());
        assertEquals(Duration.ofHours(24), Duration.between(purchase.getPurchasedAt(), purchase.getExpiresAt()));
        assertEquals(0, new BigDecimal("15").compareTo(paymentService.balance(tenantId, "alice", "GOLD")));
        assertEquals(0, treasuryBefore.add(new BigDecimal("25"))
            .compareTo(paymentService.treasuryBalance(tenantId, "GOLD")));
        assertTrue(guildRoles.hasRole(tenantId, "alice", "vip"));
        assertEquals(1, roleShopService.purchasesOf(tenantId, "alice").size());
    }

    @Test
    void testPurchaseWithoutFundsGrantsNothing() {
        paymentService.issue(tenantId, "admin", "bob", "GOLD", new BigDecimal("24.99"), null);

        assertThrows(InsufficientBalanceException.class,
            () -> roleShopService.purchase(tenantId, "bob", plan.getId()));

        assertFalse(guildRoles.hasRole(tenantId, "bob", "vip"));
        assertTrue(roleShopService.purchasesOf(tenantId, "bob").isEmpty());
        assertEquals(0, new BigDecimal("24.99").compareTo(paymentService.balance(tenantId, "bob", "GOLD")));
    }

    @Test
    void testInvokeActions() {
        paymentService.issue(tenantId, "admin", "carol", "GOLD", new BigDecimal("25"), null);

        RoleActionResult shown = roleShopService.invoke(tenantId, "carol",
            RoleAction.showPlans(panel.getId()).toActionId());
        assertEquals(1, shown.getPlans().size());
        assertNull(shown.getPurchase());

        RoleActionResult bought = roleShopService.invoke(tenantId, "carol",
            RoleAction.purchase(plan.getId()).toActionId());
        assertNotNull(bought.getPurchase());
        assertTrue(guildRoles.hasRole(tenantId, "carol", "vip"));
    }

    @Test
    void testActionsOfAnotherTenantAreRejected() {
        String otherTenant = "tenant-" + UUID.randomUUID();

        assertThrows(IllegalArgumentException.class, () -> roleShopService.invoke(otherTenant, "carol",
            RoleAction.showPlans(panel.getId()).toActionId()));
        assertThrows(IllegalArgumentException.class, () -> roleShopService.invoke(otherTenant, "carol",
            RoleAction.purchase(plan.getId()).toActionId()));
    }

    @Test
    void testPanelAndPlanValidation() {
        assertThrows(IllegalStateException.class,
            () -> roleShopService.createPanel(tenantId, 1, "Again", "r", "GOLD"));
        assertThrows(IllegalArgumentException.class,
            () -> roleShopService.addPlan(panel.getId(), "Zero", "vip", BigDecimal.ONE, 0, null));
        assertThrows(IllegalArgumentException.class,
            () -> roleShopService.addPlan(panel.getId(), "Free", "vip", BigDecimal.ZERO, 1, null));

        roleShopService.createPanel(tenantId, 2, "Second", "r", "GOLD");
        assertEquals(2, roleShopService.panels(tenantId).size());
        assertEquals(1, roleShopService.panels(tenantId).get(0).getPanelNumber());
    }

    @Test
    void testExpiredPurchasesAreRevokedAndRemoved() {
        paymentService.issue(tenantId, "admin", "dave", "GOLD", new BigDecimal("25"), null);
        RolePurchase purchase = roleShopService.purchase(tenantId, "dave", plan.getId());

        roleExpiryService.sweep(purchase.getExpiresAt().minusSeconds(1));
        assertTrue(guildRoles.hasRole(tenantId, "dave", "vip"));
        assertEquals(1, roleShopService.purchasesOf(tenantId, "dave").size());

        Instant expiry = purchase.getExpiresAt();
        assertTrue(roleExpiryService.sweep(expiry) >= 1);
        assertFalse(guildRoles.hasRole(tenantId, "dave", "vip"));
        assertTrue(roleShopService.purchasesOf(tenantId, "dave").isEmpty());
    }

    @Test
    void testOverlappingPurchaseKeepsRoleUntilItExpires() {
        RolePlan longer = roleShopService.addPlan(panel.getId(), "VIP for two days", "vip", new BigDecimal("40"),
            48, null);
        paymentService.issue(tenantId, "admin", "erin", "GOLD", new BigDecimal("65"), null);
        RolePurchase first = roleShopService.purchase(tenantId, "erin", plan.getId());
        RolePurchase second = roleShopService.purchase(tenantId, "erin", longer.getId());

        roleExpiryService.sweep(first.getExpiresAt());
        assertTrue(guildRoles.hasRole(tenantId, "erin", "vip"));
        assertEquals(1, roleShopService.purchasesOf(tenantId, "erin").size());
        assertEquals(second.getId(), roleShopService.purchasesOf(tenantId, "erin").get(0).getId());

        roleExpiryService.sweep(second.getExpiresAt());
        assertFalse(guildRoles.hasRole(tenantId, "erin", "vip"));
        assertTrue(roleShopService.purchasesOf(tenantId, "erin").isEmpty());
    }
}
