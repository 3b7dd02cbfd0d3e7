package com.roomchat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.roomchat.domain.dto.ConversationSummaryDto;
import com.roomchat.domain.dto.CreatedConversation;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 会话与成员状态。校验失败统一抛 {@link com.roomchat.common.error.ChatException}。
 */
public interface ConversationService extends IService<ConversationEntity> {

    /**
     * 创建会话：单聊恰好 2 人（同一对用户的活跃单聊直接复用），群聊 2-50 人，创建者自动成为成员。
     */
    CreatedConversation createConversation(long creatorId,
                                           ConversationType type,
                                           Collection<Long> participantIds,
                                           String title,
                                           Long matchId,
                                           Long listingId);

    /**
     * 会话不存在或已 deleted 时抛 NOT_FOUND。
     */
    ConversationEntity requireConversation(long conversationId);

    /**
     * 非活跃成员时抛 PERMISSION_DENIED(not_participant)。
     */
    ConversationParticipantEntity requireActiveParticipant(long conversationId, long userId);

    boolean isActiveParticipant(long conversationId, long userId);

    List<ConversationParticipantEntity> activeParticipants(long conversationId);

    List<Long> activeConversationIdsForUser(long userId);

    /**
     * 新消息落库后的投影：lastMessage、analytics、其他成员 unread +1。
     */
    void applyNewMessage(MessageEntity message);

    /**
     * unread 归零、推进已读游标、记 lastSeenAt；没有变化时返回 false。
     */
    boolean markReadUpTo(long conversationId, long userId, long messageId, LocalDateTime at);

    void replaceLastMessagePreview(long conversationId, long messageId, String preview);

    void setMute(long conversationId, long userId, boolean muted, LocalDateTime muteUntil);

    /**
     * 归档/屏蔽/删除/恢复，仅 admin 成员可操作。
     */
    ConversationEntity changeStatus(long conversationId, long userId, ConversationStatus status);

    List<ConversationSummaryDto> listForUser(long userId);

    long totalUnread(long userId);
}
