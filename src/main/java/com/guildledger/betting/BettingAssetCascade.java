package com.guildledger.betting;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class BettingAssetCascade implements AssetCascade {

    private final BettingEventRepository eventRepository;
    private final BettingPlayerRepository playerRepository;
    private final BetRepository betRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        List<String> eventIds = eventRepository.findByAssetId(asset.getId()).stream()
            .map(BettingEvent::getId)
            .toList();
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("bets", eventIds.isEmpty() ? 0L : (long) betRepository.deleteByEventIdIn(eventIds));
        deleted.put("betting_players", eventIds.isEmpty() ? 0L : (long) playerRepository.deleteByEventIdIn(eventIds));
        deleted.put("betting_events", (long) eventRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
