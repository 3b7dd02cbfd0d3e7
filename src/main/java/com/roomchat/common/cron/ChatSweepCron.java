package com.roomchat.common.cron;

import com.roomchat.gateway.config.PresenceProperties;
import com.roomchat.gateway.presence.PresenceRegistry;
import com.roomchat.gateway.ws.WsConnectionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 周期清扫：心跳超时的在线状态、过期的输入中、过久的离线记录。
 *
 * <p>每一步独立 try/catch：失败只记 warn，不影响其他步骤，下一轮自愈。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatSweepCron {

    private final WsConnectionService connectionService;
    private final PresenceRegistry presenceRegistry;
    private final PresenceProperties props;

    @Scheduled(fixedDelayString = "${chat.presence.sweep-fixed-delay-ms:30000}")
    public void sweep() {
        long now = System.currentTimeMillis();

        try {
            int forced = connectionService.sweepStalePresence(now, props.staleAfterMsEffective());
            if (forced > 0) {
                log.info("stale presence swept: count={}", forced);
            }
        } catch (Exception e) {
            log.warn("presence sweep failed: {}", e.toString());
        }

        try {
            int expired = connectionService.sweepTyping(now);
            if (expired > 0) {
                log.debug("typing swept: count={}", expired);
            }
        } catch (Exception e) {
            log.warn("typing sweep failed: {}", e.toString());
        }

        try {
            int pruned = presenceRegistry.pruneOffline(now, props.offlineRetentionMsEffective());
            if (pruned > 0) {
                log.debug("offline presence pruned: count={}", pruned);
            }
        } catch (Exception e) {
            log.warn("offline prune failed: {}", e.toString());
        }
    }
}
