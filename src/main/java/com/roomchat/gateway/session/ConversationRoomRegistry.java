package com.roomchat.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 会话房间：conversationId -> 订阅的 channel 集合。只是广播分组，不改变持久化的成员关系。
 */
@Component
public class ConversationRoomRegistry {

    private static final AttributeKey<Set<Long>> ATTR_ROOMS = AttributeKey.valueOf("chat:rooms");

    private final ConcurrentHashMap<Long, Set<Channel>> rooms = new ConcurrentHashMap<>();

    public boolean join(long conversationId, Channel ch) {
        if (ch == null || !ch.isActive()) {
            return false;
        }
        boolean[] added = new boolean[1];
        rooms.compute(conversationId, (k, members) -> {
            Set<Channel> set = members == null ? ConcurrentHashMap.newKeySet() : members;
            added[0] = set.add(ch);
            return set;
        });
        roomsOf0(ch).add(conversationId);
        return added[0];
    }

    public boolean leave(long conversationId, Channel ch) {
        boolean[] removed = new boolean[1];
        rooms.computeIfPresent(conversationId, (k, members) -> {
            removed[0] = members.remove(ch);
            return members.isEmpty() ? null : members;
        });
        roomsOf0(ch).remove(conversationId);
        return removed[0];
    }

    /**
     * 断线时调用：退出该 channel 所在的全部房间。
     */
    public Set<Long> leaveAll(Channel ch) {
        Set<Long> joined = Set.copyOf(roomsOf0(ch));
        for (Long conversationId : joined) {
            leave(conversationId, ch);
        }
        return joined;
    }

    public List<Channel> members(long conversationId) {
        Set<Channel> members = rooms.get(conversationId);
        if (members == null || members.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(members);
    }

    public boolean isMember(long conversationId, Channel ch) {
        Set<Channel> members = rooms.get(conversationId);
        return members != null && members.contains(ch);
    }

    public Set<Long> roomsOf(Channel ch) {
        return Set.copyOf(roomsOf0(ch));
    }

    private static Set<Long> roomsOf0(Channel ch) {
        Attribute<Set<Long>> attr = ch.attr(ATTR_ROOMS);
        Set<Long> existing = attr.get();
        if (existing != null) {
            return existing;
        }
        Set<Long> created = ConcurrentHashMap.newKeySet();
        Set<Long> raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
