package com.roomchat.notify;

/**
 * 站外通知（push / email）的投递边界，由外部服务实现。
 */
public interface NotificationDispatcher {

    void dispatch(NotificationRequest request);
}
