package com.roomchat.gateway.presence;

public record PresenceActivity(ActivityKind kind, String detail, long startedAtMs) {

    /**
     * 是否正在查看指定会话。
     */
    public boolean isViewingConversation(long conversationId) {
        return kind == ActivityKind.MESSAGING && String.valueOf(conversationId).equals(detail);
    }
}
