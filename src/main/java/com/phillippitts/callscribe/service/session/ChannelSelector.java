package com.phillippitts.callscribe.service.session;

import com.phillippitts.callscribe.gateway.VoiceChannelInfo;

import java.util.List;
import java.util.Optional;

/**
 * Picks the voice channel to record: the one with the most human occupants.
 */
final class ChannelSelector {

    private ChannelSelector() {
    }

    /**
     * @param channels channels in gateway enumeration order
     * @return the channel with the highest non-zero human count; the earliest one on ties
     */
    static Optional<VoiceChannelInfo> pick(List<VoiceChannelInfo> channels) {
        VoiceChannelInfo best = null;
        int bestHumans = 0;
        for (VoiceChannelInfo channel : channels) {
            int humans = channel.humanCount();
            if (humans > bestHumans) {
                best = channel;
                bestHumans = humans;
            }
        }
        return Optional.ofNullable(best);
    }
}
