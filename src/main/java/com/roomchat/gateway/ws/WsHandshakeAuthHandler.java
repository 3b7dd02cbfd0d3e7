package com.roomchat.gateway.ws;

import com.roomchat.auth.service.JwtService;
import com.roomchat.gateway.session.SessionRegistry;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;

import java.util.List;
import java.util.Map;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>从 Authorization: Bearer &lt;token&gt; 或 query 参数 token/accessToken 里取 accessToken</li>
 *   <li>token 有效：把 userId 与过期时间绑定到 channel，握手完成后直接注册</li>
 *   <li>token 无效：401 并断开，后续 handler 不会运行</li>
 *   <li>没有 token：放行，由首个 auth 帧完成鉴权（受 auth 超时约束）</li>
 * </ul>
 */
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService, SessionRegistry sessionRegistry) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath) || sessionRegistry.isAuthed(ctx.channel())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            Claims claims = jws.getPayload();

            long userId = jwtService.getUserId(claims);
            Long expMs = claims.getExpiration() == null ? null : claims.getExpiration().getTime();

            sessionRegistry.authenticate(ctx.channel(), userId, expMs);
            ctx.fireChannelRead(req.retain());
        } catch (Exception e) {
            writeUnauthorizedAndClose(ctx, "invalid_access_token");
        }
    }

    private String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }

        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String fromToken = first(params, "token");
        if (fromToken != null && !fromToken.isBlank()) {
            return fromToken;
        }
        return first(params, "accessToken");
    }

    private String first(Map<String, List<String>> params, String key) {
        List<String> list = params.get(key);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private void writeUnauthorizedAndClose(ChannelHandlerContext ctx, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.UNAUTHORIZED,
                Unpooled.wrappedBuffer(bytes)
        );
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
