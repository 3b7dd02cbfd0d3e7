package com.roomchat.domain.dto;

import com.roomchat.domain.entity.MessageEntity;

import java.util.List;

/**
 * 历史消息分页：items 按 id 升序；nextCursor 是继续翻页时传给 before（向前）或 after（向后）的 id。
 */
public record HistoryPage(
        List<MessageEntity> items,
        boolean hasMore,
        Long nextCursor
) {
}
