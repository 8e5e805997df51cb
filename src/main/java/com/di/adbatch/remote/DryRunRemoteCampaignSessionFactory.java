package com.di.adbatch.remote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Session factory used when no real platform integration is configured
 * ({@code adbatch.remote.mode=dry-run}, the default). Each configure call is logged
 * and answered with a synthetic entity id; every creative counts as uploaded.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "adbatch.remote", name = "mode", havingValue = "dry-run", matchIfMissing = true)
public class DryRunRemoteCampaignSessionFactory implements RemoteCampaignSessionFactory {

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String mode() {
        return "dry-run";
    }

    @Override
    public RemoteCampaignSession openSession(int workerId) {
        log.info("[REMOTE] dry-run session opened for worker {}", workerId);
        return new RemoteCampaignSession() {
            @Override
            public ConfigureResult configure(ConfigureRequest request) {
                String entityId = "DRY-" + sequence.incrementAndGet();
                int    creatives = request.getCreativeSource() == null ? 0 : request.getCreativeSource().size();
                log.info("[REMOTE] dry-run configure set='{}' variant={} cloneFrom={} creatives={} → {}",
                         request.getCampaignSetName(), request.getVariant(),
                         request.getPredecessorEntityId() == null ? "template" : request.getPredecessorEntityId(),
                         creatives, entityId);
                return ConfigureResult.success(entityId, creatives);
            }

            @Override
            public void close() {
                log.debug("[REMOTE] dry-run session closed for worker {}", workerId);
            }
        };
    }
}
