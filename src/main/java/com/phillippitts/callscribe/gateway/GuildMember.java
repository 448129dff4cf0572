package com.phillippitts.callscribe.gateway;

/**
 * A guild member as seen by the voice gateway.
 */
public record GuildMember(String id, String displayName, boolean bot) {
}
