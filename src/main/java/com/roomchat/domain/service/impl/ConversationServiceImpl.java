package com.roomchat.domain.service.impl;

import cn.hutool.core.bean.BeanUtil;
import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.config.MessageProperties;
import com.roomchat.domain.dto.ConversationSummaryDto;
import com.roomchat.domain.dto.CreatedConversation;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.entity.ConversationParticipantEntity;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.enums.ConversationStatus;
import com.roomchat.domain.enums.ConversationType;
import com.roomchat.domain.enums.MemberRole;
import com.roomchat.domain.mapper.ConversationMapper;
import com.roomchat.domain.mapper.ConversationParticipantMapper;
import com.roomchat.domain.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, ConversationEntity> implements ConversationService {

    private final ConversationParticipantMapper participantMapper;
    private final MessageProperties messageProps;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CreatedConversation createConversation(long creatorId,
                                                  ConversationType type,
                                                  Collection<Long> participantIds,
                                                  String title,
                                                  Long matchId,
                                                  Long listingId) {
        if (type == null) {
            throw ChatException.validation("invalid_conversation_type");
        }
        Set<Long> members = new LinkedHashSet<>();
        members.add(creatorId);
        if (participantIds != null) {
            for (Long uid : participantIds) {
                if (uid != null && uid > 0) {
                    members.add(uid);
                }
            }
        }
        if (type == ConversationType.DIRECT && members.size() != 2) {
            throw ChatException.validation("direct_requires_two_participants");
        }
        if (members.size() < 2 || members.size() > type.getMaxParticipants()) {
            throw ChatException.validation("invalid_participant_count");
        }

        if (type == ConversationType.DIRECT) {
            List<Long> pair = new ArrayList<>(members);
            Long existingId = participantMapper.selectActiveDirectConversationId(pair.get(0), pair.get(1));
            if (existingId != null) {
                ConversationEntity existing = getById(existingId);
                if (existing != null) {
                    return new CreatedConversation(existing, pair, true);
                }
            }
        }

        LocalDateTime now = LocalDateTime.now();
        ConversationEntity conversation = new ConversationEntity();
        conversation.setType(type);
        conversation.setStatus(ConversationStatus.ACTIVE);
        conversation.setTitle(StrUtil.isBlank(title) ? null : StrUtil.sub(title.trim(), 0, 100));
        conversation.setMatchId(matchId);
        conversation.setListingId(listingId);
        conversation.setCreatedBy(creatorId);
        conversation.setMaxParticipants(type.getMaxParticipants());
        conversation.setTotalMessages(0L);
        conversation.setMessagesThisWeek(0);
        conversation.setMessagesThisMonth(0);
        conversation.setResponseCount(0L);
        conversation.setAverageResponseTimeMs(0L);
        conversation.setLastActivityAt(now);
        save(conversation);

        for (Long uid : members) {
            ConversationParticipantEntity p = new ConversationParticipantEntity();
            p.setConversationId(conversation.getId());
            p.setUserId(uid);
            // 单聊双方对称，都可以归档/屏蔽
            boolean admin = type == ConversationType.DIRECT || uid == creatorId;
            p.setRole(admin ? MemberRole.ADMIN : MemberRole.MEMBER);
            p.setActive(true);
            p.setJoinedAt(now);
            p.setUnreadCount(0);
            p.setMuted(false);
            participantMapper.insert(p);
        }
        log.info("conversation created: id={}, type={}, creatorId={}, members={}", conversation.getId(), type.getDesc(), creatorId, members.size());
        return new CreatedConversation(conversation, new ArrayList<>(members), false);
    }

    @Override
    public ConversationEntity requireConversation(long conversationId) {
        ConversationEntity conversation = getById(conversationId);
        if (conversation == null || conversation.getStatus() == ConversationStatus.DELETED) {
            throw ChatException.notFound("conversation_not_found");
        }
        return conversation;
    }

    @Override
    public ConversationParticipantEntity requireActiveParticipant(long conversationId, long userId) {
        ConversationParticipantEntity p = findParticipant(conversationId, userId);
        if (p == null || !p.isActiveFlag()) {
            throw ChatException.permissionDenied("not_participant");
        }
        return p;
    }

    @Override
    public boolean isActiveParticipant(long conversationId, long userId) {
        ConversationParticipantEntity p = findParticipant(conversationId, userId);
        return p != null && p.isActiveFlag();
    }

    @Override
    public List<ConversationParticipantEntity> activeParticipants(long conversationId) {
        return participantMapper.selectList(new LambdaQueryWrapper<ConversationParticipantEntity>()
                .eq(ConversationParticipantEntity::getConversationId, conversationId)
                .eq(ConversationParticipantEntity::getActive, true));
    }

    @Override
    public List<Long> activeConversationIdsForUser(long userId) {
        List<Long> ids = participantMapper.selectActiveConversationIds(userId);
        return ids == null ? List.of() : ids;
    }

    @Override
    public void applyNewMessage(MessageEntity message) {
        LocalDateTime at = message.getCreatedAt() == null ? LocalDateTime.now() : message.getCreatedAt();
        LocalDate day = at.toLocalDate();
        LocalDate weekStart = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate monthStart = day.withDayOfMonth(1);
        getBaseMapper().applyNewMessage(
                message.getConversationId(),
                message.getId(),
                message.getSenderId(),
                message.getMsgType(),
                preview(message),
                at,
                weekStart,
                monthStart);
        participantMapper.incrementUnread(message.getConversationId(), message.getSenderId(), at);
    }

    @Override
    public boolean markReadUpTo(long conversationId, long userId, long messageId, LocalDateTime at) {
        return participantMapper.resetUnread(conversationId, userId, messageId, at) > 0;
    }

    @Override
    public void replaceLastMessagePreview(long conversationId, long messageId, String preview) {
        getBaseMapper().replaceLastMessagePreview(conversationId, messageId, preview);
    }

    @Override
    public void setMute(long conversationId, long userId, boolean muted, LocalDateTime muteUntil) {
        requireConversation(conversationId);
        requireActiveParticipant(conversationId, userId);
        if (muted && muteUntil != null && !muteUntil.isAfter(LocalDateTime.now())) {
            throw ChatException.validation("mute_until_in_past");
        }
        participantMapper.updateMute(conversationId, userId, muted, muted ? muteUntil : null);
    }

    @Override
    public ConversationEntity changeStatus(long conversationId, long userId, ConversationStatus status) {
        if (status == null) {
            throw ChatException.validation("invalid_status");
        }
        ConversationEntity conversation = requireConversation(conversationId);
        ConversationParticipantEntity p = requireActiveParticipant(conversationId, userId);
        if (p.getRole() != MemberRole.ADMIN) {
            throw ChatException.permissionDenied("not_conversation_admin");
        }
        if (conversation.getStatus() != status) {
            ConversationEntity patch = new ConversationEntity();
            patch.setId(conversationId);
            patch.setStatus(status);
            updateById(patch);
            conversation.setStatus(status);
            log.info("conversation status changed: id={}, status={}, by={}", conversationId, status.getDesc(), userId);
        }
        return conversation;
    }

    @Override
    public List<ConversationSummaryDto> listForUser(long userId) {
        List<ConversationParticipantEntity> mine = participantMapper.selectList(new LambdaQueryWrapper<ConversationParticipantEntity>()
                .eq(ConversationParticipantEntity::getUserId, userId)
                .eq(ConversationParticipantEntity::getActive, true));
        if (mine == null || mine.isEmpty()) {
            return List.of();
        }
        Map<Long, ConversationParticipantEntity> byConversation = new HashMap<>();
        for (ConversationParticipantEntity p : mine) {
            byConversation.put(p.getConversationId(), p);
        }
        List<ConversationEntity> conversations = listByIds(byConversation.keySet());
        List<ConversationSummaryDto> out = new ArrayList<>(conversations.size());
        LocalDateTime now = LocalDateTime.now();
        for (ConversationEntity c : conversations) {
            if (c.getStatus() == ConversationStatus.DELETED) {
                continue;
            }
            ConversationParticipantEntity p = byConversation.get(c.getId());
            ConversationSummaryDto dto = BeanUtil.copyProperties(c, ConversationSummaryDto.class, "type", "status", "lastMessageType");
            dto.setType(c.getType() == null ? null : c.getType().getDesc());
            dto.setStatus(c.getStatus() == null ? null : c.getStatus().getDesc());
            dto.setLastMessageType(c.getLastMessageType() == null ? null : c.getLastMessageType().getDesc());
            dto.setUnreadCount(p.getUnreadCount() == null ? 0 : p.getUnreadCount());
            dto.setMuted(p.isMutedAt(now));
            dto.setMuteUntil(p.getMuteUntil());
            out.add(dto);
        }
        out.sort(Comparator.comparing(ConversationSummaryDto::getLastMessageAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out;
    }

    @Override
    public long totalUnread(long userId) {
        return participantMapper.sumUnread(userId);
    }

    private ConversationParticipantEntity findParticipant(long conversationId, long userId) {
        return participantMapper.selectOne(new LambdaQueryWrapper<ConversationParticipantEntity>()
                .eq(ConversationParticipantEntity::getConversationId, conversationId)
                .eq(ConversationParticipantEntity::getUserId, userId)
                .last("limit 1"));
    }

    String preview(MessageEntity message) {
        String content = message.getContent();
        if (StrUtil.isBlank(content)) {
            return message.getMsgType() == null ? "" : "[" + message.getMsgType().getDesc() + "]";
        }
        return StrUtil.sub(content, 0, messageProps.lastMessagePreviewLengthEffective());
    }
}
