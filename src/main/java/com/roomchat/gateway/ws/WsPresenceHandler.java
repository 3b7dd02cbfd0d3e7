package com.roomchat.gateway.ws;

import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.gateway.presence.ActivityKind;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.PresenceStatus;
import com.roomchat.gateway.presence.PresenceTransition;
import com.roomchat.gateway.presence.TypingRegistry;
import com.roomchat.gateway.session.ConversationRoomRegistry;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.ChannelHandlerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 在线状态、当前活动与输入中。都是内存操作，直接在 channel 的 eventLoop 上处理。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPresenceHandler {

    private final SessionRegistry sessionRegistry;
    private final ConversationRoomRegistry roomRegistry;
    private final PresenceRegistry presenceRegistry;
    private final TypingRegistry typingRegistry;
    private final WsBroadcaster broadcaster;
    private final WsWriter wsWriter;

    public void handleStatusChange(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        PresenceStatus status = PresenceStatus.fromString(msg.status);
        if (status == null || status == PresenceStatus.OFFLINE) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "invalid_status", msg.clientTempId, null);
            return;
        }
        long now = System.currentTimeMillis();
        PresenceTransition t = presenceRegistry.updateStatus(userId, status, now);
        if (t.statusChanged()) {
            log.debug("presence status changed: userId={}, {} -> {}", userId, t.previous(), t.current());
            broadcaster.toAll(WsEvents.statusChange(userId, t.current(), t.lastSeenMs()), null);
        }
    }

    public void handleSetActivity(ChannelHandlerContext ctx, WsEnvelope msg) {
        long userId = sessionRegistry.userId(ctx.channel());
        ActivityKind kind = ActivityKind.fromString(msg.activity);
        if (kind == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "invalid_activity", msg.clientTempId, null);
            return;
        }
        String detail = msg.activityDetail;
        if ((detail == null || detail.isBlank()) && kind == ActivityKind.MESSAGING && msg.conversationId != null) {
            detail = String.valueOf(msg.conversationId);
        }
        presenceRegistry.setActivity(userId, kind, detail, System.currentTimeMillis());
    }

    public void handleClearActivity(ChannelHandlerContext ctx) {
        long userId = sessionRegistry.userId(ctx.channel());
        presenceRegistry.clearActivity(userId, System.currentTimeMillis());
    }

    public void handleTyping(ChannelHandlerContext ctx, WsEnvelope msg, boolean typing) {
        long userId = sessionRegistry.userId(ctx.channel());
        Long conversationId = msg.conversationId;
        if (conversationId == null) {
            wsWriter.writeError(ctx, ChatErrorCode.VALIDATION_FAILED, "missing_conversation_id", msg.clientTempId, null);
            return;
        }
        if (!roomRegistry.isMember(conversationId, ctx.channel())) {
            wsWriter.writeError(ctx, ChatErrorCode.PERMISSION_DENIED, "not_in_conversation", msg.clientTempId, null);
            return;
        }
        boolean changed = typing
                ? typingRegistry.start(userId, conversationId, System.currentTimeMillis())
                : typingRegistry.stop(userId, conversationId);
        if (changed) {
            broadcaster.toRoom(conversationId, WsEvents.typing(userId, conversationId, typing), userId);
        }
    }
}
