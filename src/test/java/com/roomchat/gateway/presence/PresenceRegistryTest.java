package com.roomchat.gateway.presence;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresenceRegistryTest {

    private final PresenceRegistry registry = new PresenceRegistry();

    @Test
    void firstConnectionGoesOnline_secondConnectionIsNotATransition() {
        PresenceTransition first = registry.setOnline(1L, "c1", 1_000L);
        PresenceTransition second = registry.setOnline(1L, "c2", 2_000L);

        assertThat(first.wentOnline()).isTrue();
        assertThat(second.statusChanged()).isFalse();
        assertThat(registry.connectionIds(1L)).containsExactlyInAnyOrder("c1", "c2");
        assertThat(registry.isOnline(1L)).isTrue();
    }

    @Test
    void lastConnectionClosing_forcesOfflineAndStampsLastSeen() {
        registry.setOnline(1L, "c1", 1_000L);
        registry.setOnline(1L, "c2", 1_000L);

        PresenceTransition t1 = registry.setOffline(1L, "c1", 5_000L);
        assertThat(t1.wentOffline()).isFalse();
        assertThat(registry.status(1L)).isEqualTo(PresenceStatus.ONLINE);

        PresenceTransition t2 = registry.setOffline(1L, "c2", 6_000L);
        assertThat(t2.wentOffline()).isTrue();
        assertThat(t2.lastSeenMs()).isEqualTo(6_000L);

        PresenceSnapshot s = registry.snapshot(1L);
        assertThat(s.status()).isEqualTo(PresenceStatus.OFFLINE);
        assertThat(s.connectionIds()).isEmpty();
        assertThat(s.lastSeenMs()).isEqualTo(6_000L);
    }

    @Test
    void offlineForUnknownUser_isNoop() {
        PresenceTransition t = registry.setOffline(42L, "c1", 1_000L);
        assertThat(t.statusChanged()).isFalse();
        assertThat(registry.snapshot(42L)).isNull();
    }

    @Test
    void newConnectionKeepsAwayStatus() {
        registry.setOnline(1L, "c1", 1_000L);
        registry.updateStatus(1L, PresenceStatus.AWAY, 2_000L);

        PresenceTransition t = registry.setOnline(1L, "c2", 3_000L);

        assertThat(t.statusChanged()).isFalse();
        assertThat(registry.status(1L)).isEqualTo(PresenceStatus.AWAY);
    }

    @Test
    void updateStatus_rejectsOfflineAndIsIgnoredWithoutConnections() {
        assertThatThrownBy(() -> registry.updateStatus(1L, PresenceStatus.OFFLINE, 1L))
                .isInstanceOf(IllegalArgumentException.class);

        registry.setOnline(1L, "c1", 1_000L);
        registry.setOffline(1L, "c1", 2_000L);
        PresenceTransition t = registry.updateStatus(1L, PresenceStatus.BUSY, 3_000L);

        assertThat(t.statusChanged()).isFalse();
        assertThat(registry.status(1L)).isEqualTo(PresenceStatus.OFFLINE);
    }

    @Test
    void activityIsClearedWhenGoingOffline() {
        registry.setOnline(1L, "c1", 1_000L);
        assertThat(registry.setActivity(1L, ActivityKind.MESSAGING, "99", 1_500L)).isTrue();
        assertThat(registry.snapshot(1L).activity().isViewingConversation(99L)).isTrue();

        registry.setOffline(1L, null, 2_000L);

        assertThat(registry.snapshot(1L).activity()).isNull();
        assertThat(registry.setActivity(1L, ActivityKind.BROWSING, null, 2_500L)).isFalse();
    }

    @Test
    void sweepStale_forcesOfflineKeepingLastHeartbeat() {
        registry.setOnline(1L, "c1", 1_000L);
        registry.setOnline(2L, "c2", 1_000L);
        registry.touch(2L, 9_000L);

        List<PresenceTransition> forced = registry.sweepStale(10_000L, 5_000L);

        assertThat(forced).hasSize(1);
        assertThat(forced.get(0).userId()).isEqualTo(1L);
        assertThat(forced.get(0).removedConnectionIds()).isEqualTo(Set.of("c1"));
        assertThat(registry.snapshot(1L).lastSeenMs()).isEqualTo(1_000L);
        assertThat(registry.isOnline(1L)).isFalse();
        assertThat(registry.isOnline(2L)).isTrue();
    }

    @Test
    void pruneOffline_removesOnlyOldOfflineRecords() {
        registry.setOnline(1L, "c1", 1_000L);
        registry.setOffline(1L, "c1", 1_000L);
        registry.setOnline(2L, "c2", 1_000L);
        registry.setOffline(2L, "c2", 9_000L);
        registry.setOnline(3L, "c3", 1_000L);

        int removed = registry.pruneOffline(10_000L, 5_000L);

        assertThat(removed).isEqualTo(1);
        assertThat(registry.snapshot(1L)).isNull();
        assertThat(registry.snapshot(2L)).isNotNull();
        assertThat(registry.snapshot(3L)).isNotNull();
    }

    @Test
    void stats_countsByStatus() {
        registry.setOnline(1L, "c1", 0L);
        registry.setOnline(2L, "c2", 0L);
        registry.updateStatus(2L, PresenceStatus.BUSY, 0L);
        registry.setOnline(3L, "c3", 0L);
        registry.setOffline(3L, "c3", 0L);

        PresenceStats stats = registry.stats(120_000L, 4);

        assertThat(stats.online()).isEqualTo(1);
        assertThat(stats.busy()).isEqualTo(1);
        assertThat(stats.offline()).isEqualTo(1);
        assertThat(stats.typing()).isEqualTo(4);
        assertThat(stats.averageSessionMinutes()).isEqualTo(2.0D);
        assertThat(registry.onlineUserIds()).containsExactlyInAnyOrder(1L, 2L);
    }
}
