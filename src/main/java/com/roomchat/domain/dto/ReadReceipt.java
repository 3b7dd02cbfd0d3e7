package com.roomchat.domain.dto;

import java.time.LocalDateTime;
import java.util.List;

public record ReadReceipt(
        long conversationId,
        long readerId,
        List<Long> messageIds,
        LocalDateTime readAt
) {
}
