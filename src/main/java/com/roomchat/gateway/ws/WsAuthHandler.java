package com.roomchat.gateway.ws;

import com.roomchat.auth.service.JwtService;
import com.roomchat.common.error.ChatErrorCode;
import com.roomchat.gateway.session.SessionRegistry;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * auth 帧：握手时没带 token 的连接用首帧鉴权。成功后注册为在线连接，失败回 error 并断开。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsAuthHandler {

    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final WsConnectionService connectionService;
    private final WsWriter wsWriter;

    public void handleAuth(ChannelHandlerContext ctx, WsEnvelope msg) {
        Channel ch = ctx.channel();

        if (sessionRegistry.isAuthed(ch)) {
            // 握手阶段已鉴权：注册过的连接重复 auth 只回 connected
            if (!connectionService.register(ch)) {
                WsEnvelope connected = WsEvents.base(WsEventTypes.CONNECTED);
                connected.userId = sessionRegistry.userId(ch);
                wsWriter.write(ctx, connected);
            }
            return;
        }

        if (msg.token == null || msg.token.isBlank()) {
            wsWriter.writeError(ctx, ChatErrorCode.AUTHENTICATION_FAILED, "missing_token", null, null);
            ctx.close();
            return;
        }

        try {
            Jws<Claims> jws = jwtService.parseAccessToken(msg.token);
            long userId = jwtService.getUserId(jws.getPayload());
            Long expMs = jws.getPayload().getExpiration() == null ? null : jws.getPayload().getExpiration().getTime();
            sessionRegistry.authenticate(ch, userId, expMs);
        } catch (Exception e) {
            log.debug("ws auth failed: channel={}, err={}", SessionRegistry.connectionId(ch), e.toString());
            wsWriter.writeError(ctx, ChatErrorCode.AUTHENTICATION_FAILED, "invalid_token", null, null);
            ctx.close();
            return;
        }

        connectionService.register(ch);
    }
}
