package com.roomchat.domain.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
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
import com.roomchat.domain.service.ChatDeliveryService;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.domain.service.MessageMetadataValidator;
import com.roomchat.domain.service.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatDeliveryServiceImpl implements ChatDeliveryService {

    /** 系统消息的 senderId */
    public static final long SYSTEM_SENDER_ID = 0L;

    private final ConversationService conversationService;
    private final MessageService messageService;
    private final MessageReactionMapper reactionMapper;
    private final MessageProperties messageProps;

    @Override
    public SendResult send(SendMessageCommand cmd) {
        ConversationEntity conversation = conversationService.requireConversation(cmd.conversationId());
        if (conversation.getStatus() != ConversationStatus.ACTIVE) {
            throw ChatException.permissionDenied("conversation_not_active");
        }
        conversationService.requireActiveParticipant(cmd.conversationId(), cmd.senderId());

        MessageType type = cmd.type();
        if (type == null) {
            throw ChatException.validation("invalid_message_type");
        }
        if (type == MessageType.SYSTEM) {
            throw ChatException.validation("system_message_not_allowed");
        }
        String content = normalizeContent(cmd.content(), type == MessageType.TEXT);
        MessageMetadataValidator.validate(type, cmd.metadata());

        if (cmd.replyToId() != null) {
            MessageEntity target = messageService.getById(cmd.replyToId());
            if (target == null || target.isDeletedFlag() || !Objects.equals(target.getConversationId(), cmd.conversationId())) {
                throw ChatException.notFound("reply_target_not_found");
            }
        }

        List<ConversationParticipantEntity> participants = conversationService.activeParticipants(cmd.conversationId());
        Long receiverId = null;
        if (conversation.getType() == ConversationType.DIRECT) {
            for (ConversationParticipantEntity p : participants) {
                if (!Objects.equals(p.getUserId(), cmd.senderId())) {
                    receiverId = p.getUserId();
                    break;
                }
            }
        }

        MessageEntity message = newMessage(cmd.messageId() > 0 ? cmd.messageId() : IdWorker.getId(),
                cmd.conversationId(), cmd.senderId(), type, content, cmd.metadata());
        message.setReceiverId(receiverId);
        message.setReplyToId(cmd.replyToId());
        message.setClientTempId(StrUtil.isBlank(cmd.clientTempId()) ? null : cmd.clientTempId());

        try {
            messageService.save(message);
        } catch (DuplicateKeyException e) {
            MessageEntity existing = messageService.findBySenderAndClientTempId(cmd.senderId(), cmd.clientTempId());
            if (existing == null) {
                throw e;
            }
            log.info("duplicate send ignored: senderId={}, clientTempId={}, messageId={}", cmd.senderId(), cmd.clientTempId(), existing.getId());
            return new SendResult(existing, conversation, participants, true);
        }

        applyProjection(message);
        return new SendResult(message, conversation, participants, false);
    }

    @Override
    public SendResult sendSystemMessage(long conversationId, String systemMessageType, String content) {
        ConversationEntity conversation = conversationService.requireConversation(conversationId);
        String text = normalizeContent(content, true);
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("systemMessageType", StrUtil.blankToDefault(systemMessageType, "notice"));

        MessageEntity message = newMessage(IdWorker.getId(), conversationId, SYSTEM_SENDER_ID, MessageType.SYSTEM, text, metadata);
        messageService.save(message);
        applyProjection(message);
        return new SendResult(message, conversation, conversationService.activeParticipants(conversationId), false);
    }

    @Override
    public DeliveryUpdate markDeliveredOnline(MessageEntity message) {
        LocalDateTime now = LocalDateTime.now();
        boolean changed = messageService.markDelivered(message.getId(), now);
        if (changed) {
            message.setStatus(MessageStatus.DELIVERED);
            message.setDeliveredAt(now);
        }
        return new DeliveryUpdate(message, changed);
    }

    @Override
    public boolean markFailed(long messageId) {
        return messageService.markFailed(messageId, LocalDateTime.now());
    }

    @Override
    public DeliveryUpdate acknowledgeDelivered(long messageId, long userId) {
        MessageEntity message = requireAckTarget(messageId, userId);
        LocalDateTime now = LocalDateTime.now();
        boolean changed = messageService.markDelivered(messageId, now);
        if (changed) {
            message.setStatus(MessageStatus.DELIVERED);
            message.setDeliveredAt(now);
        }
        return new DeliveryUpdate(message, changed);
    }

    @Override
    public DeliveryUpdate acknowledgeRead(long messageId, long readerId) {
        MessageEntity message = requireAckTarget(messageId, readerId);
        LocalDateTime now = LocalDateTime.now();
        boolean changed = messageService.markRead(messageId, now);
        if (changed) {
            message.setStatus(MessageStatus.READ);
            message.setReadAt(now);
            if (message.getDeliveredAt() == null) {
                message.setDeliveredAt(now);
            }
        }
        conversationService.markReadUpTo(message.getConversationId(), readerId, messageId, now);
        return new DeliveryUpdate(message, changed);
    }

    @Override
    public ReadReceipt markConversationRead(long conversationId, long readerId, Collection<Long> messageIds) {
        ConversationEntity conversation = conversationService.requireConversation(conversationId);
        conversationService.requireActiveParticipant(conversationId, readerId);
        LocalDateTime now = LocalDateTime.now();

        List<Long> changed = messageService.markReadBatch(conversationId, readerId, messageIds, now);
        long upTo = 0L;
        if (!changed.isEmpty()) {
            upTo = Collections.max(changed);
        } else if (messageIds != null && !messageIds.isEmpty()) {
            upTo = messageIds.stream().filter(Objects::nonNull).mapToLong(Long::longValue).max().orElse(0L);
        } else if (conversation.getLastMessageId() != null) {
            upTo = conversation.getLastMessageId();
        }
        conversationService.markReadUpTo(conversationId, readerId, upTo, now);
        return new ReadReceipt(conversationId, readerId, changed, now);
    }

    @Override
    public MessageEntity edit(long messageId, long requesterId, String newContent) {
        MessageEntity message = requireMessage(messageId);
        if (!Objects.equals(message.getSenderId(), requesterId)) {
            throw ChatException.permissionDenied("not_message_sender");
        }
        if (message.isDeletedFlag()) {
            throw ChatException.notFound("message_deleted");
        }
        if (message.getMsgType() != MessageType.TEXT) {
            throw ChatException.permissionDenied("edit_not_allowed");
        }
        LocalDateTime now = LocalDateTime.now();
        if (message.getCreatedAt() != null
                && message.getCreatedAt().plusHours(messageProps.editWindowHoursEffective()).isBefore(now)) {
            throw ChatException.permissionDenied("edit_window_expired");
        }
        String content = normalizeContent(newContent, true);
        conversationService.requireActiveParticipant(message.getConversationId(), requesterId);

        if (!messageService.applyEdit(messageId, requesterId, content, now)) {
            throw ChatException.notFound("message_deleted");
        }
        if (message.getOriginalContent() == null) {
            message.setOriginalContent(message.getContent());
        }
        message.setContent(content);
        message.setEdited(true);
        message.setEditedAt(now);
        return message;
    }

    @Override
    public MessageEntity delete(long messageId, long requesterId, boolean forEveryone) {
        MessageEntity message = requireMessage(messageId);
        if (!Objects.equals(message.getSenderId(), requesterId)) {
            throw ChatException.permissionDenied("not_message_sender");
        }
        if (forEveryone ? message.isDeletedForEveryoneFlag() : message.isDeletedFlag()) {
            throw ChatException.notFound("message_deleted");
        }
        LocalDateTime now = LocalDateTime.now();
        if (forEveryone && message.getCreatedAt() != null
                && message.getCreatedAt().plusMinutes(messageProps.deleteForEveryoneWindowMinutesEffective()).isBefore(now)) {
            throw ChatException.permissionDenied("delete_window_expired");
        }

        if (!messageService.softDelete(messageId, requesterId, forEveryone, now)) {
            throw ChatException.notFound("message_deleted");
        }
        message.setDeleted(true);
        message.setDeletedAt(now);
        message.setDeletedBy(requesterId);
        if (forEveryone) {
            if (message.getOriginalContent() == null) {
                message.setOriginalContent(message.getContent());
            }
            message.setContent(MessageEntity.DELETED_PLACEHOLDER);
            message.setDeletedForEveryone(true);
            try {
                conversationService.replaceLastMessagePreview(message.getConversationId(), messageId, MessageEntity.DELETED_PLACEHOLDER);
            } catch (RuntimeException e) {
                log.warn("replace last message preview failed: conversationId={}, messageId={}, err={}",
                        message.getConversationId(), messageId, e.toString());
            }
        }
        return message;
    }

    @Override
    public ReactionUpdate react(long messageId, long userId, ReactionType reaction) {
        if (reaction == null) {
            throw ChatException.validation("invalid_reaction");
        }
        MessageEntity message = requireLiveMessage(messageId);
        conversationService.requireActiveParticipant(message.getConversationId(), userId);
        reactionMapper.upsert(IdWorker.getId(), messageId, userId, reaction, LocalDateTime.now());
        return new ReactionUpdate(message, userId, reaction, reactions(messageId));
    }

    @Override
    public ReactionUpdate removeReaction(long messageId, long userId) {
        MessageEntity message = requireLiveMessage(messageId);
        conversationService.requireActiveParticipant(message.getConversationId(), userId);
        reactionMapper.deleteByMessageAndUser(messageId, userId);
        return new ReactionUpdate(message, userId, null, reactions(messageId));
    }

    private List<MessageReactionEntity> reactions(long messageId) {
        List<MessageReactionEntity> list = reactionMapper.selectByMessageId(messageId);
        return list == null ? List.of() : list;
    }

    private MessageEntity requireMessage(long messageId) {
        MessageEntity message = messageService.getById(messageId);
        if (message == null) {
            throw ChatException.notFound("message_not_found");
        }
        return message;
    }

    private MessageEntity requireLiveMessage(long messageId) {
        MessageEntity message = requireMessage(messageId);
        if (message.isDeletedForEveryoneFlag()) {
            throw ChatException.notFound("message_deleted");
        }
        return message;
    }

    /**
     * ACK 只能由接收方发出：单聊是 receiverId，群聊是发送者以外的成员。
     */
    private MessageEntity requireAckTarget(long messageId, long userId) {
        MessageEntity message = requireMessage(messageId);
        conversationService.requireActiveParticipant(message.getConversationId(), userId);
        if (Objects.equals(message.getSenderId(), userId)
                || (message.getReceiverId() != null && !Objects.equals(message.getReceiverId(), userId))) {
            throw ChatException.permissionDenied("ack_not_allowed");
        }
        return message;
    }

    private String normalizeContent(String raw, boolean required) {
        String content = StrUtil.trimToEmpty(raw);
        if (required && content.isEmpty()) {
            throw ChatException.validation("empty_content");
        }
        if (content.length() > messageProps.maxContentLengthEffective()) {
            throw ChatException.validation("content_too_long");
        }
        return content;
    }

    private void applyProjection(MessageEntity message) {
        try {
            conversationService.applyNewMessage(message);
        } catch (RuntimeException e) {
            // 投影落后于消息流是可接受的，不影响已落库消息的广播
            log.warn("apply conversation projection failed: conversationId={}, messageId={}, err={}",
                    message.getConversationId(), message.getId(), e.toString());
        }
    }

    private static MessageEntity newMessage(long id, long conversationId, long senderId, MessageType type,
                                            String content, Map<String, Object> metadata) {
        MessageEntity message = new MessageEntity();
        message.setId(id);
        message.setConversationId(conversationId);
        message.setSenderId(senderId);
        message.setMsgType(type);
        message.setContent(content);
        message.setMetadata(metadata == null || metadata.isEmpty() ? null : metadata);
        message.setStatus(MessageStatus.SENT);
        message.setEdited(false);
        message.setDeleted(false);
        message.setDeletedForEveryone(false);
        message.setCreatedAt(LocalDateTime.now());
        return message;
    }
}
