package com.guildledger.providers;

import java.util.List;

/**
 * Looks up the members of a tenant.
 */
public interface GuildMemberDirectory {

    /**
     * Ids of the members currently holding a role.
     */
    List<String> membersWithRole(String tenantId, String roleId);
}
