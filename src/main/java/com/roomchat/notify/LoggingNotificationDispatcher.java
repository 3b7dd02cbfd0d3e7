package com.roomchat.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认实现：只记日志。接入真实推送服务时注册自己的 {@link NotificationDispatcher} bean 即可替换。
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(NotificationRequest request) {
        log.info("notification requested: recipientId={}, conversationId={}, messageId={}, push={}, email={}",
                request.recipientId(), request.conversationId(), request.messageId(),
                request.decision().isPush(), request.decision().isEmail());
    }
}
