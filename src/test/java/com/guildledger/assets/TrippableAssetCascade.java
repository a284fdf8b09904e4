package com.guildledger.assets;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cascade that fails the next deletion once armed, to prove the cascade is atomic.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class TrippableAssetCascade implements AssetCascade {

    private final AtomicBoolean armed = new AtomicBoolean();

    public void arm() {
        armed.set(true);
    }

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        if (armed.getAndSet(false)) {
            throw new IllegalStateException("Simulated failure while deleting " + asset.getSymbol());
        }
        return Map.of();
    }
}
