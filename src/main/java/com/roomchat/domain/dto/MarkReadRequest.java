package com.roomchat.domain.dto;

import lombok.Data;

import java.util.List;

/**
 * messageIds 为空表示把会话内所有未读标记为已读。
 */
@Data
public class MarkReadRequest {
    private List<Long> messageIds;
}
