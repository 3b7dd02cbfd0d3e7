package com.roomchat.gateway.ws;

import com.roomchat.gateway.session.ConversationRoomRegistry;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 扇出：房间 / 单个用户的全部连接 / 全部连接。
 *
 * <p>写出都投递到目标 channel 的 eventLoop，本身不阻塞调用方。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsBroadcaster {

    private final SessionRegistry sessionRegistry;
    private final ConversationRoomRegistry roomRegistry;
    private final WsWriter wsWriter;

    /**
     * @param excludeUserId 不为 null 时跳过该用户的所有连接
     */
    public int toRoom(long conversationId, WsEnvelope env, Long excludeUserId) {
        return toChannels(roomRegistry.members(conversationId), env, excludeUserId);
    }

    /**
     * 房间广播，跳过发起请求的那个连接（它会单独收到回执）。
     */
    public int toRoomExcept(long conversationId, WsEnvelope env, Channel excluded) {
        List<Channel> members = new ArrayList<>(roomRegistry.members(conversationId));
        if (excluded != null) {
            members.remove(excluded);
        }
        return toChannels(members, env, null);
    }

    public int toUser(long userId, WsEnvelope env) {
        return toChannels(sessionRegistry.getChannels(userId), env, null);
    }

    public int toAll(WsEnvelope env, Long excludeUserId) {
        return toChannels(sessionRegistry.getAllChannels(), env, excludeUserId);
    }

    private int toChannels(Collection<Channel> channels, WsEnvelope env, Long excludeUserId) {
        int n = 0;
        for (Channel ch : channels) {
            if (ch == null || !ch.isActive()) {
                continue;
            }
            if (excludeUserId != null && Objects.equals(excludeUserId, sessionRegistry.userId(ch))) {
                continue;
            }
            wsWriter.write(ch, env).addListener(f -> {
                if (!f.isSuccess()) {
                    log.debug("ws broadcast write failed: type={}, channel={}, err={}", env.type, SessionRegistry.connectionId(ch), String.valueOf(f.cause()));
                }
            });
            n++;
        }
        return n;
    }
}
