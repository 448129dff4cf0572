package com.phillippitts.callscribe.gateway;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the chat platform's voice transport.
 *
 * <p>Implementations adapt a concrete client library. All methods may be called from the
 * session loop thread and must not block for long: membership reads are expected to come from
 * a local cache, and {@link #join} completes asynchronously.
 */
public interface VoiceGateway {

    /**
     * Lists the voice channels of a guild with their current occupants.
     *
     * @param guildId governed guild
     * @return channels in the platform's enumeration order (first-seen order)
     */
    List<VoiceChannelInfo> voiceChannels(String guildId);

    /**
     * Looks up a guild member, used to resolve display names and filter bots.
     */
    Optional<GuildMember> member(String guildId, String userId);

    /**
     * Connects to a voice channel, self-muted. The future completes once the connection is
     * ready to receive audio, or exceptionally when the platform refuses the join.
     */
    CompletableFuture<VoiceConnection> join(String guildId, String channelId);

    /**
     * Registers a callback invoked whenever someone joins, leaves or moves between voice channels.
     */
    void addMembershipListener(Runnable listener);
}
