package com.roomchat.notify;

import com.roomchat.gateway.presence.ActivityKind;
import com.roomchat.gateway.presence.PresenceActivity;
import com.roomchat.gateway.presence.PresenceSnapshot;
import com.roomchat.gateway.presence.PresenceStatus;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NotificationDeciderTest {

    private static final long CONV = 10L;
    private static final long THRESHOLD = 30 * 60_000L;

    private static PresenceSnapshot online(PresenceActivity activity) {
        return new PresenceSnapshot(1L, PresenceStatus.ONLINE, 1_000L, Set.of("c1"), activity, 0L);
    }

    private static PresenceSnapshot offline(long lastSeenMs) {
        return new PresenceSnapshot(1L, PresenceStatus.OFFLINE, lastSeenMs, Set.of(), null, 0L);
    }

    @Test
    void viewingTheConversation_suppressesEvenWhenMuted() {
        PresenceSnapshot s = online(new PresenceActivity(ActivityKind.MESSAGING, "10", 0L));
        assertEquals(NotificationDecision.SUPPRESS_VIEWING, NotificationDecider.decide(s, true, CONV, 2_000L, THRESHOLD));
    }

    @Test
    void viewingAnotherConversation_isPlainPush() {
        PresenceSnapshot s = online(new PresenceActivity(ActivityKind.MESSAGING, "11", 0L));
        assertEquals(NotificationDecision.PUSH, NotificationDecider.decide(s, false, CONV, 2_000L, THRESHOLD));
    }

    @Test
    void mutedRecipient_isSuppressed() {
        assertEquals(NotificationDecision.SUPPRESS_MUTED, NotificationDecider.decide(online(null), true, CONV, 2_000L, THRESHOLD));
        assertEquals(NotificationDecision.SUPPRESS_MUTED, NotificationDecider.decide(null, true, CONV, 2_000L, THRESHOLD));
    }

    @Test
    void unknownPresence_getsPushAndEmail() {
        assertEquals(NotificationDecision.PUSH_AND_EMAIL, NotificationDecider.decide(null, false, CONV, 2_000L, THRESHOLD));
    }

    @Test
    void offlineRecipient_emailOnlyAfterThreshold() {
        long now = 100 * 60_000L;
        assertEquals(NotificationDecision.PUSH, NotificationDecider.decide(offline(now - THRESHOLD), false, CONV, now, THRESHOLD));
        assertEquals(NotificationDecision.PUSH_AND_EMAIL, NotificationDecider.decide(offline(now - THRESHOLD - 1), false, CONV, now, THRESHOLD));
    }

    @Test
    void offlineRecordWithStaleMessagingActivity_isNotTreatedAsViewing() {
        PresenceSnapshot s = new PresenceSnapshot(1L, PresenceStatus.OFFLINE, 1_000L, Set.of(),
                new PresenceActivity(ActivityKind.MESSAGING, "10", 0L), 0L);
        assertEquals(NotificationDecision.PUSH, NotificationDecider.decide(s, false, CONV, 2_000L, THRESHOLD));
    }
}
