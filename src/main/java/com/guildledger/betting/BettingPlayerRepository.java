package com.guildledger.betting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BettingPlayerRepository extends JpaRepository<BettingPlayer, String> {

    Optional<BettingPlayer> findByEventIdAndUserId(String eventId, String userId);

    boolean existsByEventIdAndUserId(String eventId, String userId);

    List<BettingPlayer> findByEventIdOrderByAddedAtAsc(String eventId);

    @Modifying
    @Query("delete from BettingPlayer p where p.eventId in :eventIds")
    int deleteByEventIdIn(@Param("eventIds") Collection<String> eventIds);
}
