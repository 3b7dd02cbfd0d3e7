package com.roomchat.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机连接表：userId -> (connId -> Channel)。
 *
 * <p>鉴权（把 userId 写到 channel 属性上）和注册（放进连接表）是两步：握手阶段只做前者，
 * WebSocket 握手完成后才注册，注册后才会收到广播。</p>
 */
@Slf4j
@Component
public class SessionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");
    public static final AttributeKey<Long> ATTR_ACCESS_EXP_MS = AttributeKey.valueOf("aexp");
    public static final AttributeKey<Boolean> ATTR_REGISTERED = AttributeKey.valueOf("chat:registered");

    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, Channel>> userChannels = new ConcurrentHashMap<>();

    public static String connectionId(Channel ch) {
        return ch.id().asShortText();
    }

    public void authenticate(Channel ch, long userId, Long accessExpMs) {
        ch.attr(ATTR_USER_ID).set(userId);
        ch.attr(ATTR_ACCESS_EXP_MS).set(accessExpMs);
    }

    /**
     * 放进连接表。同一 channel 只注册一次，重复调用返回 false。
     */
    public boolean register(Channel ch) {
        Long userId = ch.attr(ATTR_USER_ID).get();
        if (userId == null) {
            return false;
        }
        Boolean prev = ch.attr(ATTR_REGISTERED).setIfAbsent(Boolean.TRUE);
        if (prev != null) {
            return false;
        }
        userChannels.computeIfAbsent(userId, k -> new ConcurrentHashMap<>())
                .put(connectionId(ch), ch);
        return true;
    }

    /**
     * 从连接表移除。返回 true 表示这次调用真的移除了（channelInactive 与 exceptionCaught 可能都会调到）。
     */
    public boolean unbind(Channel ch) {
        Long userId = ch.attr(ATTR_USER_ID).get();
        if (userId == null) {
            return false;
        }
        boolean removed = false;
        ConcurrentHashMap<String, Channel> map = userChannels.get(userId);
        if (map != null) {
            removed = map.remove(connectionId(ch), ch);
            if (map.isEmpty()) {
                userChannels.remove(userId, map);
            }
        }
        return removed;
    }

    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_USER_ID).get() != null;
    }

    public boolean isRegistered(Channel ch) {
        return Boolean.TRUE.equals(ch.attr(ATTR_REGISTERED).get());
    }

    public Long userId(Channel ch) {
        return ch.attr(ATTR_USER_ID).get();
    }

    public Long getAccessExpMs(Channel ch) {
        return ch.attr(ATTR_ACCESS_EXP_MS).get();
    }

    public List<Channel> getChannels(long userId) {
        ConcurrentHashMap<String, Channel> map = userChannels.get(userId);
        if (map == null || map.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(map.values());
    }

    public Collection<Channel> getAllChannels() {
        List<Channel> all = new ArrayList<>();
        for (Map<String, Channel> map : userChannels.values()) {
            all.addAll(map.values());
        }
        return all;
    }

    /**
     * 关闭该用户在本机的所有连接（清扫判定为僵尸连接时使用）。
     */
    public int closeUser(long userId) {
        int n = 0;
        for (Channel ch : getChannels(userId)) {
            if (ch != null) {
                ch.close();
                n++;
            }
        }
        if (n > 0) {
            log.info("closed stale channels: userId={}, count={}", userId, n);
        }
        return n;
    }
}
