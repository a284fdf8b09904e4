package com.guildledger.betting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface BetRepository extends JpaRepository<Bet, String> {

    List<Bet> findByEventIdOrderByPlacedAtAsc(String eventId);

    boolean existsByEventIdAndTargetUserId(String eventId, String targetUserId);

    @Modifying
    @Query("delete from Bet b where b.eventId in :eventIds")
    int deleteByEventIdIn(@Param("eventIds") Collection<String> eventIds);
}
