package com.roomchat.gateway.presence;

public record PresenceStats(
        int online,
        int away,
        int busy,
        int offline,
        int typing,
        double averageSessionMinutes
) {
}
