package com.roomchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.roomchat.domain.config.MessageProperties;
import com.roomchat.domain.dto.HistoryPage;
import com.roomchat.domain.entity.MessageEntity;
import com.roomchat.domain.mapper.MessageMapper;
import com.roomchat.domain.service.MessageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MessageServiceImpl extends ServiceImpl<MessageMapper, MessageEntity> implements MessageService {

    private static final int DEFAULT_PAGE_SIZE = 50;

    private final MessageProperties messageProps;

    @Override
    public HistoryPage history(long conversationId, long requesterId, Long before, Long after, Integer limit) {
        int max = messageProps.historyMaxPageSizeEffective();
        int size = limit == null || limit <= 0 ? Math.min(DEFAULT_PAGE_SIZE, max) : Math.min(limit, max);

        LambdaQueryWrapper<MessageEntity> wrapper = new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getConversationId, conversationId)
                // “仅自己删除”的消息对删除者本人不可见
                .and(w -> w.eq(MessageEntity::getDeleted, false)
                        .or().eq(MessageEntity::getDeletedForEveryone, true)
                        .or().ne(MessageEntity::getDeletedBy, requesterId));
        boolean forward = after != null && before == null;
        if (forward) {
            wrapper.gt(MessageEntity::getId, after).orderByAsc(MessageEntity::getId);
        } else {
            if (before != null) {
                wrapper.lt(MessageEntity::getId, before);
            }
            if (after != null) {
                wrapper.gt(MessageEntity::getId, after);
            }
            wrapper.orderByDesc(MessageEntity::getId);
        }
        wrapper.last("limit " + (size + 1));

        List<MessageEntity> rows = new ArrayList<>(list(wrapper));
        boolean hasMore = rows.size() > size;
        if (hasMore) {
            rows = new ArrayList<>(rows.subList(0, size));
        }
        if (!forward) {
            Collections.reverse(rows);
        }
        Long nextCursor = null;
        if (!rows.isEmpty()) {
            nextCursor = forward ? rows.get(rows.size() - 1).getId() : rows.get(0).getId();
        }
        return new HistoryPage(rows, hasMore, nextCursor);
    }

    @Override
    public MessageEntity findBySenderAndClientTempId(long senderId, String clientTempId) {
        if (clientTempId == null || clientTempId.isBlank()) {
            return null;
        }
        return getOne(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getSenderId, senderId)
                .eq(MessageEntity::getClientTempId, clientTempId)
                .last("limit 1"));
    }

    @Override
    public boolean markDelivered(long messageId, LocalDateTime at) {
        return getBaseMapper().markDelivered(messageId, at) > 0;
    }

    @Override
    public boolean markRead(long messageId, LocalDateTime at) {
        return getBaseMapper().markRead(messageId, at) > 0;
    }

    @Override
    public boolean markFailed(long messageId, LocalDateTime at) {
        return getBaseMapper().markFailed(messageId, at) > 0;
    }

    @Override
    public List<Long> markReadBatch(long conversationId, long readerId, Collection<Long> ids, LocalDateTime at) {
        List<Long> readable = getBaseMapper().selectReadableIds(conversationId, readerId, ids);
        if (readable == null || readable.isEmpty()) {
            return List.of();
        }
        getBaseMapper().markReadByIds(readable, at);
        return readable;
    }

    @Override
    public boolean applyEdit(long messageId, long senderId, String content, LocalDateTime at) {
        return getBaseMapper().applyEdit(messageId, senderId, content, at) > 0;
    }

    @Override
    public boolean softDelete(long messageId, long senderId, boolean forEveryone, LocalDateTime at) {
        return getBaseMapper().softDelete(messageId, senderId, forEveryone, MessageEntity.DELETED_PLACEHOLDER, at) > 0;
    }
}
