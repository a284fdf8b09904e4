package com.guildledger.roles;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RolePlanRepository extends JpaRepository<RolePlan, String> {

    List<RolePlan> findByPanelIdOrderByNameAsc(String panelId);

    @Modifying
    @Query("delete from RolePlan p where p.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
