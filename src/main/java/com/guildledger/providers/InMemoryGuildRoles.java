package com.guildledger.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory role assignments for development and tests.
 *
 * Serves both ports, so a role granted through the gateway is immediately
 * visible to member lookups. In production both are replaced with adapters
 * backed by the chat platform.
 */
@Component
@Slf4j
public class InMemoryGuildRoles implements RoleGrantGateway, GuildMemberDirectory {

    // tenant:role -> members
    private final ConcurrentMap<String, Set<String>> members = new ConcurrentHashMap<>();

    @Override
    public void grantRole(String tenantId, String userId, String roleId) {
        members.computeIfAbsent(key(tenantId, roleId), k -> ConcurrentHashMap.newKeySet()).add(userId);
        log.debug("Granted role {} to {} in tenant {}", roleId, userId, tenantId);
    }

    @Override
    public void revokeRole(String tenantId, String userId, String roleId) {
        Set<String> holders = members.get(key(tenantId, roleId));
        if (holders != null) {
            holders.remove(userId);
        }
        log.debug("Revoked role {} from {} in tenant {}", roleId, userId, tenantId);
    }

    @Override
    public List<String> membersWithRole(String tenantId, String roleId) {
        Set<String> holders = members.get(key(tenantId, roleId));
        return holders == null ? List.of() : holders.stream().sorted().toList();
    }

    public boolean hasRole(String tenantId, String userId, String roleId) {
        Set<String> holders = members.get(key(tenantId, roleId));
        return holders != null && holders.contains(userId);
    }

    private static String key(String tenantId, String roleId) {
        return tenantId + ":" + roleId;
    }
}
