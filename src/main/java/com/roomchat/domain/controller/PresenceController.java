package com.roomchat.domain.controller;

import com.roomchat.auth.web.AuthContext;
import com.roomchat.common.api.ApiCodes;
import com.roomchat.common.api.Result;
import com.roomchat.common.error.ChatException;
import com.roomchat.gateway.presence.LastActiveStore;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.presence.PresenceSnapshot;
import com.roomchat.gateway.presence.PresenceStats;
import com.roomchat.gateway.presence.PresenceStatus;
import com.roomchat.gateway.presence.PresenceView;
import com.roomchat.gateway.presence.TypingRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/presence")
public class PresenceController {

    static final int MAX_QUERY_USERS = 200;

    private final PresenceRegistry presenceRegistry;
    private final TypingRegistry typingRegistry;
    private final LastActiveStore lastActiveStore;

    @GetMapping
    public Result<List<PresenceView>> query(@RequestParam("userIds") List<Long> userIds) {
        if (AuthContext.getUserId() == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        if (userIds.size() > MAX_QUERY_USERS) {
            throw ChatException.validation("too_many_user_ids");
        }
        List<PresenceView> out = new ArrayList<>();
        for (Long userId : new LinkedHashSet<>(userIds)) {
            if (userId == null || userId <= 0) {
                continue;
            }
            PresenceSnapshot snapshot = presenceRegistry.snapshot(userId);
            if (snapshot != null) {
                out.add(PresenceView.of(snapshot));
            } else {
                // 内存里没有（重启/已清理）时退回持久化的最后活跃时间
                out.add(new PresenceView(userId, PresenceStatus.OFFLINE, lastActiveStore.get(userId), null));
            }
        }
        return Result.ok(out);
    }

    @GetMapping("/stats")
    public Result<PresenceStats> stats() {
        if (AuthContext.getUserId() == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        long now = System.currentTimeMillis();
        return Result.ok(presenceRegistry.stats(now, typingRegistry.activeCount(now)));
    }
}
