package com.phillippitts.callscribe.gateway;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a voice channel and the members connected to it.
 *
 * @param id platform channel id
 * @param name display name of the channel
 * @param occupants connected members, bots included
 */
public record VoiceChannelInfo(String id, String name, List<GuildMember> occupants) {

    public VoiceChannelInfo {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
        occupants = occupants == null ? List.of() : List.copyOf(occupants);
    }

    /** Number of connected members that are not bots. */
    public int humanCount() {
        return (int) occupants.stream().filter(m -> !m.bot()).count();
    }
}
