package com.guildledger.roles;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RolePanelRepository extends JpaRepository<RolePanel, String> {

    Optional<RolePanel> findByTenantIdAndPanelNumber(String tenantId, int panelNumber);

    List<RolePanel> findByTenantIdOrderByPanelNumberAsc(String tenantId);

    @Modifying
    @Query("delete from RolePanel p where p.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
