package com.roomchat.domain.service.impl;

import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.config.MessageProperties;
import com.roomchat.domain.dto.DeliveryUpdate;
import com.roomchat.domain.dto.ReactionUpdate;
import com.roomchat.domain.dto.ReadReceipt;
import com.roomchat.domain.dto.SendMessageCommand;
import com.roomchat.domain.dto.SendResult;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.entity.MessageReactionEntity;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.enums.MessageStatus;
import com.roomchat.domain.enums.MessageType;
import com.roomchat.domain.enums.ReactionType;
import com.roomchat.domain.mapper.MessageReactionMapper;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.domain.service.MessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatDeliveryServiceImplTest {

    private static final long CONV = 10L;
    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    private ConversationService conversationService;
    private MessageService messageService;
    private MessageReactionMapper reactionMapper;
    private ChatDeliveryServiceImpl service;

    @BeforeEach
    void setUp() {
        conversationService = mock(ConversationService.class);
        messageService = mock(MessageService.class);
        reactionMapper = mock(MessageReactionMapper.class);
        service = new ChatDeliveryServiceImpl(conversationService, messageService, reactionMapper,
                new MessageProperties(null, null, null, null, null));

        ConversationEntity conversation = new ConversationEntity();
        conversation.setId(CONV);
        conversation.setType(ConversationType.DIRECT);
        conversation.setStatus(ConversationStatus.ACTIVE);
        when(conversationService.requireConversation(CONV)).thenReturn(conversation);
        when(conversationService.activeParticipants(CONV)).thenReturn(List.of(participant(ALICE), participant(BOB)));
    }

    private static ConversationParticipantEntity participant(long userId) {
        ConversationParticipantEntity p = new ConversationParticipantEntity();
        p.setConversationId(CONV);
        p.setUserId(userId);
        p.setActive(true);
        return p;
    }

    private static SendMessageCommand text(String content, String clientTempId) {
        return new SendMessageCommand(500L, ALICE, CONV, content, MessageType.TEXT, null, null, clientTempId);
    }

    private static MessageEntity stored(long id, long senderId, Long receiverId, LocalDateTime createdAt) {
        MessageEntity m = new MessageEntity();
        m.setId(id);
        m.setConversationId(CONV);
        m.setSenderId(senderId);
        m.setReceiverId(receiverId);
        m.setMsgType(MessageType.TEXT);
        m.setContent("hello");
        m.setStatus(MessageStatus.SENT);
        m.setDeleted(false);
        m.setDeletedForEveryone(false);
        m.setCreatedAt(createdAt);
        return m;
    }

    @Test
    void send_persistsAsSentWithDirectReceiverAndProjects() {
        SendResult result = service.send(text("  hello  ", "tmp-1"));

        assertThat(result.duplicate()).isFalse();
        MessageEntity m = result.message();
        assertThat(m.getId()).isEqualTo(500L);
        assertThat(m.getContent()).isEqualTo("hello");
        assertThat(m.getStatus()).isEqualTo(MessageStatus.SENT);
        assertThat(m.getReceiverId()).isEqualTo(BOB);
        assertThat(m.getClientTempId()).isEqualTo("tmp-1");
        verify(messageService).save(m);
        verify(conversationService).applyNewMessage(m);
    }

    @Test
    void send_rejectsNonMember() {
        when(conversationService.requireActiveParticipant(CONV, ALICE)).thenThrow(ChatException.permissionDenied("not_participant"));

        assertThatThrownBy(() -> service.send(text("hi", null)))
                .isInstanceOf(ChatException.class)
                .hasMessage("not_participant");
        verify(messageService, never()).save(any());
    }

    @Test
    void send_rejectsArchivedConversation() {
        conversationService.requireConversation(CONV).setStatus(ConversationStatus.ARCHIVED);

        assertThatThrownBy(() -> service.send(text("hi", null)))
                .isInstanceOf(ChatException.class)
                .hasMessage("conversation_not_active");
    }

    @Test
    void send_validatesContent() {
        assertThatThrownBy(() -> service.send(text("   ", null))).hasMessage("empty_content");
        assertThatThrownBy(() -> service.send(text("x".repeat(5001), null))).hasMessage("content_too_long");
        assertThatThrownBy(() -> service.send(new SendMessageCommand(1L, ALICE, CONV, "hi", MessageType.SYSTEM, null, null, null)))
                .hasMessage("system_message_not_allowed");
        assertThatThrownBy(() -> service.send(new SendMessageCommand(1L, ALICE, CONV, "", MessageType.LOCATION, Map.of("latitude", 100, "longitude", 0), null, null)))
                .hasMessage("malformed_metadata");
    }

    @Test
    void send_replyTargetMustLiveInSameConversation() {
        MessageEntity other = stored(7L, BOB, ALICE, LocalDateTime.now());
        other.setConversationId(99L);
        when(messageService.getById(7L)).thenReturn(other);

        assertThatThrownBy(() -> service.send(new SendMessageCommand(1L, ALICE, CONV, "re", MessageType.TEXT, null, 7L, null)))
                .isInstanceOf(ChatException.class)
                .hasMessage("reply_target_not_found");
    }

    @Test
    void send_duplicateClientTempIdReturnsExisting() {
        MessageEntity existing = stored(400L, ALICE, BOB, LocalDateTime.now());
        when(messageService.save(any())).thenThrow(new DuplicateKeyException("uk_message_client_temp"));
        when(messageService.findBySenderAndClientTempId(ALICE, "tmp-1")).thenReturn(existing);

        SendResult result = service.send(text("hello", "tmp-1"));

        assertThat(result.duplicate()).isTrue();
        assertThat(result.message()).isSameAs(existing);
        verify(conversationService, never()).applyNewMessage(any());
    }

    @Test
    void send_projectionFailureDoesNotFailTheSend() {
        doThrow(new DataAccessResourceFailureException("down")).when(conversationService).applyNewMessage(any());

        SendResult result = service.send(text("hello", null));

        assertThat(result.message().getStatus()).isEqualTo(MessageStatus.SENT);
    }

    @Test
    void sendSystemMessage_usesSystemSenderAndType() {
        SendResult result = service.sendSystemMessage(CONV, "match_created", "You matched!");

        assertThat(result.message().getSenderId()).isEqualTo(ChatDeliveryServiceImpl.SYSTEM_SENDER_ID);
        assertThat(result.message().getMsgType()).isEqualTo(MessageType.SYSTEM);
        assertThat(result.message().getMetadata()).containsEntry("systemMessageType", "match_created");
        assertThat(result.participants()).hasSize(2);
    }

    @Test
    void acknowledgeRead_isIdempotent() {
        MessageEntity m = stored(100L, ALICE, BOB, LocalDateTime.now());
        when(messageService.getById(100L)).thenReturn(m);
        when(messageService.markRead(eq(100L), any())).thenReturn(true, false);

        DeliveryUpdate first = service.acknowledgeRead(100L, BOB);
        DeliveryUpdate second = service.acknowledgeRead(100L, BOB);

        assertThat(first.changed()).isTrue();
        assertThat(first.message().getStatus()).isEqualTo(MessageStatus.READ);
        assertThat(first.message().getDeliveredAt()).isNotNull();
        assertThat(second.changed()).isFalse();
    }

    @Test
    void acknowledgeDelivered_afterReconnectAdvancesOnce() {
        MessageEntity m = stored(100L, ALICE, BOB, LocalDateTime.now());
        when(messageService.getById(100L)).thenReturn(m);
        when(messageService.markDelivered(eq(100L), any())).thenReturn(true, false);

        DeliveryUpdate first = service.acknowledgeDelivered(100L, BOB);
        DeliveryUpdate second = service.acknowledgeDelivered(100L, BOB);

        assertThat(first.changed()).isTrue();
        assertThat(first.message().getStatus()).isEqualTo(MessageStatus.DELIVERED);
        assertThat(first.message().getDeliveredAt()).isNotNull();
        assertThat(second.changed()).isFalse();
        assertThat(second.message().getStatus()).isEqualTo(MessageStatus.DELIVERED);
        verify(conversationService, times(2)).requireActiveParticipant(CONV, BOB);
    }

    @Test
    void acknowledge_senderCannotAckOwnMessage() {
        when(messageService.getById(100L)).thenReturn(stored(100L, ALICE, BOB, LocalDateTime.now()));

        assertThatThrownBy(() -> service.acknowledgeDelivered(100L, ALICE))
                .isInstanceOf(ChatException.class)
                .hasMessage("ack_not_allowed");
    }

    @Test
    void markConversationRead_advancesCursorToHighestChangedId() {
        when(messageService.markReadBatch(eq(CONV), eq(BOB), any(), any())).thenReturn(List.of(101L, 103L));

        ReadReceipt receipt = service.markConversationRead(CONV, BOB, null);

        assertThat(receipt.messageIds()).containsExactly(101L, 103L);
        verify(conversationService).markReadUpTo(eq(CONV), eq(BOB), eq(103L), any());
    }

    @Test
    void edit_withinWindowKeepsOriginalContent() {
        MessageEntity m = stored(100L, ALICE, BOB, LocalDateTime.now().minusHours(23));
        when(messageService.getById(100L)).thenReturn(m);
        when(messageService.applyEdit(eq(100L), eq(ALICE), eq("hello again"), any())).thenReturn(true);

        MessageEntity edited = service.edit(100L, ALICE, "hello again");

        assertThat(edited.getContent()).isEqualTo("hello again");
        assertThat(edited.getOriginalContent()).isEqualTo("hello");
        assertThat(edited.getEdited()).isTrue();
    }

    @Test
    void edit_afterWindowIsRejected() {
        when(messageService.getById(100L)).thenReturn(stored(100L, ALICE, BOB, LocalDateTime.now().minusHours(25)));

        assertThatThrownBy(() -> service.edit(100L, ALICE, "late"))
                .isInstanceOf(ChatException.class)
                .hasMessage("edit_window_expired");
        verify(messageService, never()).applyEdit(anyLong(), anyLong(), anyString(), any());
    }

    @Test
    void edit_onlyBySender() {
        when(messageService.getById(100L)).thenReturn(stored(100L, ALICE, BOB, LocalDateTime.now()));

        assertThatThrownBy(() -> service.edit(100L, BOB, "mine now"))
                .isInstanceOfSatisfying(ChatException.class, e -> assertThat(e.getCode()).isEqualTo(ChatErrorCode.PERMISSION_DENIED));
    }

    @Test
    void deleteForEveryone_replacesContentWithinWindow() {
        MessageEntity m = stored(100L, ALICE, BOB, LocalDateTime.now().minusMinutes(10));
        when(messageService.getById(100L)).thenReturn(m);
        when(messageService.softDelete(eq(100L), eq(ALICE), eq(true), any())).thenReturn(true);

        MessageEntity deleted = service.delete(100L, ALICE, true);

        assertThat(deleted.getContent()).isEqualTo(MessageEntity.DELETED_PLACEHOLDER);
        assertThat(deleted.getOriginalContent()).isEqualTo("hello");
        assertThat(deleted.isDeletedForEveryoneFlag()).isTrue();
        verify(conversationService).replaceLastMessagePreview(CONV, 100L, MessageEntity.DELETED_PLACEHOLDER);
    }

    @Test
    void deleteForEveryone_afterWindowIsRejected_butSelfDeleteIsAllowed() {
        MessageEntity m = stored(100L, ALICE, BOB, LocalDateTime.now().minusMinutes(61));
        when(messageService.getById(100L)).thenReturn(m);
        when(messageService.softDelete(eq(100L), eq(ALICE), eq(false), any())).thenReturn(true);

        assertThatThrownBy(() -> service.delete(100L, ALICE, true)).hasMessage("delete_window_expired");

        MessageEntity deleted = service.delete(100L, ALICE, false);
        assertThat(deleted.isDeletedFlag()).isTrue();
        assertThat(deleted.getContent()).isEqualTo("hello");
    }

    @Test
    void react_upsertsAndReturnsCurrentReactions() {
        when(messageService.getById(100L)).thenReturn(stored(100L, ALICE, BOB, LocalDateTime.now()));

        ReactionUpdate update = service.react(100L, BOB, ReactionType.LOVE);

        ArgumentCaptor<ReactionType> captor = ArgumentCaptor.forClass(ReactionType.class);
        verify(reactionMapper).upsert(anyLong(), eq(100L), eq(BOB), captor.capture(), any());
        assertThat(captor.getValue()).isEqualTo(ReactionType.LOVE);
        assertThat(update.reaction()).isEqualTo(ReactionType.LOVE);
        assertThat(update.reactions()).isEmpty();
    }

    @Test
    void react_sameUserTwiceKeepsSingleEntryWithLatestKind() {
        when(messageService.getById(100L)).thenReturn(stored(100L, ALICE, BOB, LocalDateTime.now()));
        // (message_id, user_id) 唯一键：后一次覆盖前一次
        Map<Long, MessageReactionEntity> byUser = new LinkedHashMap<>();
        when(reactionMapper.upsert(anyLong(), eq(100L), anyLong(), any(), any())).thenAnswer(inv -> {
            MessageReactionEntity r = new MessageReactionEntity();
            r.setId(inv.getArgument(0));
            r.setMessageId(inv.getArgument(1));
            r.setUserId(inv.getArgument(2));
            r.setReaction(inv.getArgument(3));
            byUser.put(r.getUserId(), r);
            return 1;
        });
        when(reactionMapper.selectByMessageId(100L)).thenAnswer(inv -> new ArrayList<>(byUser.values()));

        service.react(100L, BOB, ReactionType.LIKE);
        ReactionUpdate update = service.react(100L, BOB, ReactionType.LAUGH);

        assertThat(update.reaction()).isEqualTo(ReactionType.LAUGH);
        assertThat(update.reactions()).hasSize(1);
        assertThat(update.reactions().get(0).getUserId()).isEqualTo(BOB);
        assertThat(update.reactions().get(0).getReaction()).isEqualTo(ReactionType.LAUGH);
    }

    @Test
    void react_rejectsUnknownReactionAndDeletedMessage() {
        assertThatThrownBy(() -> service.react(100L, BOB, null)).hasMessage("invalid_reaction");

        MessageEntity gone = stored(100L, ALICE, BOB, LocalDateTime.now());
        gone.setDeletedForEveryone(true);
        when(messageService.getById(100L)).thenReturn(gone);
        assertThatThrownBy(() -> service.react(100L, BOB, ReactionType.LIKE)).hasMessage("message_deleted");
    }
}
