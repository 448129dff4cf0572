package com.phillippitts.callscribe.gateway;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Gateway used when no voice transport bean is present: reports no channels and refuses joins.
 * Keeps the service, its REST surface and health checks usable while the transport is offline.
 */
public class DetachedVoiceGateway implements VoiceGateway {

    private static final Logger LOG = LogManager.getLogger(DetachedVoiceGateway.class);

    public DetachedVoiceGateway() {
        LOG.warn("No voice transport configured; sessions will never start");
    }

    @Override
    public List<VoiceChannelInfo> voiceChannels(String guildId) {
        return List.of();
    }

    @Override
    public Optional<GuildMember> member(String guildId, String userId) {
        return Optional.empty();
    }

    @Override
    public CompletableFuture<VoiceConnection> join(String guildId, String channelId) {
        return CompletableFuture.failedFuture(
                new IllegalStateException("voice transport is not connected"));
    }

    @Override
    public void addMembershipListener(Runnable listener) {
        // no membership changes without a transport
    }
}
