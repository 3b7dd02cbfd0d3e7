package com.roomchat.domain.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * muteUntil 为空表示无限期静音。
 */
@Data
public class MuteRequest {
    private LocalDateTime muteUntil;
}
