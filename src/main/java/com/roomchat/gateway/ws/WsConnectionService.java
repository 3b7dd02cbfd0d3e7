package com.roomchat.gateway.ws;

import com.roomchat.domain.dto.CreatedConversation;
import com.roomchat.domain.entity.ConversationEntity;
import com.roomchat.domain.service.ConversationService;
import com.roomchat.gateway.presence.LastActiveStore;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.PresenceStatus;
import com.roomchat.gateway.presence.PresenceTransition;
import com.roomchat.gateway.presence.TypingRegistry;
import com.roomchat.gateway.session.ConversationRoomRegistry;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * 连接生命周期：注册 → 上线广播 → 订阅会话房间；断开 → 退房 → 最后一个连接断开时下线广播。
 */
@Slf4j
@Component
public class WsConnectionService {

    static final String MATCH_SYSTEM_TYPE = "match_created";
    static final String MATCH_SYSTEM_CONTENT = "You matched! Start your conversation here.";

    private final SessionRegistry sessionRegistry;
    private final ConversationRoomRegistry roomRegistry;
    private final PresenceRegistry presenceRegistry;
    private final TypingRegistry typingRegistry;
    private final LastActiveStore lastActiveStore;
    private final ConversationService conversationService;
    private final MessageDeliveryPipeline pipeline;
    private final WsBroadcaster broadcaster;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    public WsConnectionService(SessionRegistry sessionRegistry,
                               ConversationRoomRegistry roomRegistry,
                               PresenceRegistry presenceRegistry,
                               TypingRegistry typingRegistry,
                               LastActiveStore lastActiveStore,
                               ConversationService conversationService,
                               MessageDeliveryPipeline pipeline,
                               WsBroadcaster broadcaster,
                               WsWriter wsWriter,
                               @Qualifier("chatDbExecutor") Executor dbExecutor) {
        this.sessionRegistry = sessionRegistry;
        this.roomRegistry = roomRegistry;
        this.presenceRegistry = presenceRegistry;
        this.typingRegistry = typingRegistry;
        this.lastActiveStore = lastActiveStore;
        this.conversationService = conversationService;
        this.pipeline = pipeline;
        this.broadcaster = broadcaster;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    /**
     * 已鉴权的 channel 注册为在线连接。重复调用无副作用。
     */
    public boolean register(Channel ch) {
        Long userId = sessionRegistry.userId(ch);
        if (userId == null || !sessionRegistry.register(ch)) {
            return false;
        }
        long now = System.currentTimeMillis();
        PresenceTransition t = presenceRegistry.setOnline(userId, SessionRegistry.connectionId(ch), now);
        if (!ch.isActive()) {
            // 注册过程中连接已断开，channelInactive 可能已经先跑完了
            disconnect(ch);
            return false;
        }

        WsEnvelope connected = WsEvents.base(WsEventTypes.CONNECTED);
        connected.userId = userId;
        connected.status = presenceRegistry.status(userId).getDesc();
        connected.userIds = presenceRegistry.onlineUserIds();
        wsWriter.write(ch, connected);

        if (t.wentOnline()) {
            broadcaster.toAll(WsEvents.statusChange(userId, PresenceStatus.ONLINE, now), userId);
        }
        recordLastActiveAsync(userId, now, false);
        joinRoomsAsync(ch, userId);
        log.info("ws connection registered: userId={}, connId={}, status={}", userId, SessionRegistry.connectionId(ch), t.current());
        return true;
    }

    /**
     * channelInactive / exceptionCaught / 空闲断开都会调到这里，可重入。
     */
    public void disconnect(Channel ch) {
        Long userId = sessionRegistry.userId(ch);
        if (userId == null) {
            return;
        }
        boolean removed = sessionRegistry.unbind(ch);
        roomRegistry.leaveAll(ch);
        if (!removed) {
            return;
        }
        long now = System.currentTimeMillis();
        PresenceTransition t = presenceRegistry.setOffline(userId, SessionRegistry.connectionId(ch), now);
        log.info("ws connection closed: userId={}, connId={}, status={}", userId, SessionRegistry.connectionId(ch), t.current());
        if (t.wentOffline()) {
            onWentOffline(userId, t.lastSeenMs());
        }
    }

    /**
     * 任意入站帧/心跳：刷新 lastSeen，按节流写 Redis。
     */
    public void touch(long userId) {
        long now = System.currentTimeMillis();
        presenceRegistry.touch(userId, now);
        recordLastActiveAsync(userId, now, false);
    }

    /**
     * 新会话：把所有在线成员的连接订阅进房间并推送 conversation_created；来自匹配的新会话再发一条系统消息。
     */
    public void onConversationCreated(CreatedConversation created) {
        ConversationEntity conversation = created.conversation();
        long conversationId = conversation.getId();
        WsEnvelope env = WsEvents.conversationCreated(conversation, created.participantIds());
        for (Long participantId : created.participantIds()) {
            for (Channel ch : sessionRegistry.getChannels(participantId)) {
                roomRegistry.join(conversationId, ch);
                wsWriter.write(ch, env);
            }
        }
        if (!created.reused() && conversation.getMatchId() != null) {
            pipeline.submitSystem(conversationId, MATCH_SYSTEM_TYPE, MATCH_SYSTEM_CONTENT)
                    .whenComplete((r, e) -> {
                        if (e != null) {
                            log.warn("match system message failed: conversationId={}, err={}", conversationId, e.toString());
                        }
                    });
        }
    }

    /**
     * 心跳超时的用户强制下线，并关掉残留的 channel。
     */
    public int sweepStalePresence(long nowMs, long staleAfterMs) {
        List<PresenceTransition> forced = presenceRegistry.sweepStale(nowMs, staleAfterMs);
        for (PresenceTransition t : forced) {
            sessionRegistry.closeUser(t.userId());
            onWentOffline(t.userId(), t.lastSeenMs());
        }
        return forced.size();
    }

    /**
     * 过期的输入状态广播 isTyping=false。
     */
    public int sweepTyping(long nowMs) {
        List<TypingRegistry.TypingKey> expired = typingRegistry.sweepExpired(nowMs);
        for (TypingRegistry.TypingKey key : expired) {
            broadcaster.toRoom(key.conversationId(), WsEvents.typing(key.userId(), key.conversationId(), false), key.userId());
        }
        return expired.size();
    }

    private void onWentOffline(long userId, long lastSeenMs) {
        for (Long conversationId : typingRegistry.clearUser(userId)) {
            broadcaster.toRoom(conversationId, WsEvents.typing(userId, conversationId, false), userId);
        }
        broadcaster.toAll(WsEvents.statusChange(userId, PresenceStatus.OFFLINE, lastSeenMs), userId);
        recordLastActiveAsync(userId, lastSeenMs, true);
    }

    private void recordLastActiveAsync(long userId, long atMs, boolean force) {
        try {
            CompletableFuture.runAsync(() -> lastActiveStore.record(userId, atMs, force), dbExecutor);
        } catch (Exception e) {
            log.warn("record last active rejected: userId={}, err={}", userId, e.toString());
        }
    }

    private void joinRoomsAsync(Channel ch, long userId) {
        CompletableFuture<List<Long>> f;
        try {
            f = CompletableFuture.supplyAsync(() -> conversationService.activeConversationIdsForUser(userId), dbExecutor)
                    .orTimeout(MessageDeliveryPipeline.DB_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.warn("load conversations rejected: userId={}, err={}", userId, e.toString());
            return;
        }
        f.whenComplete((ids, e) -> {
            if (e != null) {
                log.warn("load conversations failed: userId={}, err={}", userId, e.toString());
                return;
            }
            if (!ch.isActive()) {
                return;
            }
            ch.eventLoop().execute(() -> {
                for (Long conversationId : ids) {
                    roomRegistry.join(conversationId, ch);
                }
            });
        });
    }
}
