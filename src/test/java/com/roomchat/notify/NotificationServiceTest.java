package com.roomchat.notify;

import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.MessageType;
import com.roomchat.gateway.presence.ActivityKind;
import com.roomchat.gateway.presence.PresenceRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class NotificationServiceTest {

    private final PresenceRegistry presence = new PresenceRegistry();
    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);

    private NotificationService service(boolean enabled) {
        return new NotificationService(presence, dispatcher, new NotifyProperties(enabled, null), Runnable::run);
    }

    private static MessageEntity message(String content) {
        MessageEntity m = new MessageEntity();
        m.setId(100L);
        m.setConversationId(10L);
        m.setSenderId(1L);
        m.setMsgType(MessageType.TEXT);
        m.setContent(content);
        return m;
    }

    private static ConversationParticipantEntity participant(long userId, boolean active, boolean muted) {
        ConversationParticipantEntity p = new ConversationParticipantEntity();
        p.setConversationId(10L);
        p.setUserId(userId);
        p.setActive(active);
        p.setMuted(muted);
        return p;
    }

    @Test
    void skipsSenderInactiveAndMutedRecipients() {
        List<ConversationParticipantEntity> participants = List.of(
                participant(1L, true, false),
                participant(2L, true, false),
                participant(3L, false, false),
                participant(4L, true, true));

        int submitted = service(true).onMessagePersisted(message("hi"), participants);

        assertThat(submitted).isEqualTo(1);
        ArgumentCaptor<NotificationRequest> captor = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(dispatcher, times(1)).dispatch(captor.capture());
        NotificationRequest req = captor.getValue();
        assertThat(req.recipientId()).isEqualTo(2L);
        assertThat(req.messageType()).isEqualTo("text");
        assertThat(req.decision()).isEqualTo(NotificationDecision.PUSH_AND_EMAIL);
    }

    @Test
    void expiredMuteNoLongerSuppresses() {
        ConversationParticipantEntity p = participant(2L, true, true);
        p.setMuteUntil(LocalDateTime.now().minusMinutes(1));

        assertThat(service(true).onMessagePersisted(message("hi"), List.of(p))).isEqualTo(1);
    }

    @Test
    void recipientViewingConversation_isNotNotified() {
        presence.setOnline(2L, "c2", System.currentTimeMillis());
        presence.setActivity(2L, ActivityKind.MESSAGING, "10", System.currentTimeMillis());

        assertThat(service(true).onMessagePersisted(message("hi"), List.of(participant(2L, true, false)))).isZero();
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void previewIsTruncated() {
        String longContent = "x".repeat(300);

        service(true).onMessagePersisted(message(longContent), List.of(participant(2L, true, false)));

        ArgumentCaptor<NotificationRequest> captor = ArgumentCaptor.forClass(NotificationRequest.class);
        verify(dispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().preview()).hasSize(100);
    }

    @Test
    void dispatcherFailureIsContained() {
        doThrow(new IllegalStateException("push gateway down")).when(dispatcher).dispatch(any());

        int submitted = service(true).onMessagePersisted(message("hi"), List.of(participant(2L, true, false)));

        assertThat(submitted).isEqualTo(1);
    }

    @Test
    void rejectedExecutorIsNotCounted() {
        NotificationService svc = new NotificationService(presence, dispatcher, new NotifyProperties(true, null), r -> {
            throw new RejectedExecutionException("full");
        });

        assertThat(svc.onMessagePersisted(message("hi"), List.of(participant(2L, true, false)))).isZero();
    }

    @Test
    void disabled_noop() {
        assertThat(service(false).onMessagePersisted(message("hi"), List.of(participant(2L, true, false)))).isZero();
        verify(dispatcher, never()).dispatch(any());
    }
}
