package com.guildledger.providers;

/**
 * Grants and revokes roles on the chat platform.
 *
 * In production this calls the platform's API; the ledger only needs the two
 * operations below.
 */
public interface RoleGrantGateway {

    /**
     * Give a member a role.
     */
    void grantRole(String tenantId, String userId, String roleId);

    /**
     * Take a role away from a member. Revoking a role the member does not hold is a no-op.
     */
    void revokeRole(String tenantId, String userId, String roleId);
}
