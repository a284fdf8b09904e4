package com.guildledger.assets;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for currency definitions.
 */
@Repository
public interface AssetRepository extends JpaRepository<Asset, String> {

    Optional<Asset> findByTenantIdAndSymbol(String tenantId, String symbol);

    boolean existsByTenantIdAndSymbol(String tenantId, String symbol);

    List<Asset> findByTenantIdOrderBySymbolAsc(String tenantId);
}
