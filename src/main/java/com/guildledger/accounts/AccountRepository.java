package com.guildledger.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByName(String name);

    List<Account> findByTenantId(String tenantId);

    long countByName(String name);
}
