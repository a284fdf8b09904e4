package com.guildledger.roles;

import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.providers.RoleGrantGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the expiry sweep, with the role platform and storage mocked.
 */
@ExtendWith(MockitoExtension.class)
class RoleExpiryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private RolePurchaseRepository purchaseRepository;

    @Mock
    private RoleGrantGateway roleGrantGateway;

    @Mock
    private LedgerExecutor ledgerExecutor;

    private RoleExpiryService service;

    @BeforeEach
    void setUp() {
        service = new RoleExpiryService(purchaseRepository, roleGrantGateway, ledgerExecutor);
    }

    @Test
    void testRevokeFailureStillRemovesRecord() {
        RolePurchase gone = purchase("left-the-server", "vip");
        RolePurchase kept = purchase("alice", "vip");
        when(purchaseRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(NOW)).thenReturn(List.of(gone, kept));
        when(purchaseRepository.existsById(anyString())).thenReturn(true);
        when(purchaseRepository.existsByTenantIdAndUserIdAndRoleIdAndExpiresAtAfter(
            anyString(), anyString(), anyString(), eq(NOW))).thenReturn(false);
        runUnitsInline();
        doAnswer(invocation -> {
            if ("left-the-server".equals(invocation.getArgument(1))) {
                throw new IllegalStateException("Unknown member");
            }
            return null;
        }).when(roleGrantGateway).revokeRole(anyString(), anyString(), anyString());

        int removed = service.sweep(NOW);

        assertEquals(2, removed);
        verify(roleGrantGateway).revokeRole("tenant-1", "alice", "vip");
        verify(purchaseRepository).deleteById(gone.getId());
        verify(purchaseRepository).deleteById(kept.getId());
    }

    @Test
    void testAlreadyRemovedPurchaseIsNotCounted() {
        RolePurchase purchase = purchase("alice", "vip");
        when(purchaseRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(NOW)).thenReturn(List.of(purchase));
        when(purchaseRepository.existsById(purchase.getId())).thenReturn(false);
        when(purchaseRepository.existsByTenantIdAndUserIdAndRoleIdAndExpiresAtAfter("tenant-1", "alice", "vip", NOW))
            .thenReturn(false);
        runUnitsInline();

        assertEquals(0, service.sweep(NOW));
        verify(purchaseRepository, never()).deleteById(anyString());
    }

    @Test
    void testRoleWithAnotherActivePurchaseIsKept() {
        RolePurchase older = purchase("alice", "vip");
        when(purchaseRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(NOW)).thenReturn(List.of(older));
        when(purchaseRepository.existsByTenantIdAndUserIdAndRoleIdAndExpiresAtAfter("tenant-1", "alice", "vip", NOW))
            .thenReturn(true);
        when(purchaseRepository.existsById(older.getId())).thenReturn(true);
        runUnitsInline();

        assertEquals(1, service.sweep(NOW));
        verify(roleGrantGateway, never()).revokeRole(anyString(), anyString(), anyString());
        verify(purchaseRepository).deleteById(older.getId());
    }

    @Test
    void testNothingExpired() {
        when(purchaseRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(NOW)).thenReturn(List.of());

        assertEquals(0, service.sweep(NOW));
        verifyNoInteractions(roleGrantGateway, ledgerExecutor);
    }

    private void runUnitsInline() {
        when(ledgerExecutor.execute(anyString(), anyCollection(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> unit = invocation.getArgument(2);
                return unit.get();
            });
    }

    private static RolePurchase purchase(String userId, String roleId) {
        RolePlan plan = new RolePlan("panel-1", "Plan", roleId, BigDecimal.TEN, "asset-1", 1, null);
        return new RolePurchase("tenant-1", userId, plan, "txn-" + userId, NOW.minusSeconds(7200));
    }
}
