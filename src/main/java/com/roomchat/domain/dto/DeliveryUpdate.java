package com.roomchat.domain.dto;

import com.roomchat.domain.entity.MessageEntity;

/**
 * @param changed 本次调用是否真的推进了状态；false 表示重复 ACK，调用方不再广播
 */
public record DeliveryUpdate(MessageEntity message, boolean changed) {
}
