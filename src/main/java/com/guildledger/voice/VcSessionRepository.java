package com.guildledger.voice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VcSessionRepository extends JpaRepository<VcSession, String> {

    Optional<VcSession> findByTenantIdAndUserId(String tenantId, String userId);

    List<VcSession> findAllByOrderByStartedAtAsc();

    List<VcSession> findByTenantId(String tenantId);
}
