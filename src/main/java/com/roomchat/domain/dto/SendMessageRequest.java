package com.roomchat.domain.dto;

import lombok.Data;

import java.util.Map;

@Data
public class SendMessageRequest {
    private String content;
    private String type;
    private Map<String, Object> metadata;
    private Long replyToId;
    private String clientTempId;
}
