package com.roomchat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.roomchat.domain.dto.HistoryPage;
import com.roomchat.domain.entity.MessageEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface MessageService extends IService<MessageEntity> {

    /**
     * 按 id 的游标分页：before 取更早的、after 取更新的，都为空从最新开始；limit 上限 100。
     */
    HistoryPage history(long conversationId, long requesterId, Long before, Long after, Integer limit);

    MessageEntity findBySenderAndClientTempId(long senderId, String clientTempId);

    boolean markDelivered(long messageId, LocalDateTime at);

    boolean markRead(long messageId, LocalDateTime at);

    boolean markFailed(long messageId, LocalDateTime at);

    /**
     * 会话内 reader 的未读消息（ids 为空表示全部）标记为已读，返回实际变更的 id。
     */
    List<Long> markReadBatch(long conversationId, long readerId, Collection<Long> ids, LocalDateTime at);

    boolean applyEdit(long messageId, long senderId, String content, LocalDateTime at);

    boolean softDelete(long messageId, long senderId, boolean forEveryone, LocalDateTime at);
}
