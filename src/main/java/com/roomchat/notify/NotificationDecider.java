package com.roomchat.notify;

import com.roomchat.gateway.presence.PresenceSnapshot;

/**
 * 是否需要站外通知。纯函数：只看在线快照与静音状态。
 */
public final class NotificationDecider {

    private NotificationDecider() {
    }

    /**
     * @param presence 接收方在线快照，null 表示没有任何记录（从未连接或已被清理）
     * @param muted    静音是否在当前时刻生效
     */
    public static NotificationDecision decide(PresenceSnapshot presence,
                                              boolean muted,
                                              long conversationId,
                                              long nowMs,
                                              long emailAfterAbsentMs) {
        if (presence != null
                && presence.isOnline()
                && presence.activity() != null
                && presence.activity().isViewingConversation(conversationId)) {
            return NotificationDecision.SUPPRESS_VIEWING;
        }
        if (muted) {
            return NotificationDecision.SUPPRESS_MUTED;
        }
        if (presence == null) {
            return NotificationDecision.PUSH_AND_EMAIL;
        }
        if (!presence.isOnline() && nowMs - presence.lastSeenMs() > emailAfterAbsentMs) {
            return NotificationDecision.PUSH_AND_EMAIL;
        }
        return NotificationDecision.PUSH;
    }
}
