package com.roomchat.gateway.ws;

import com.roomchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * WS 心跳处理：
 * - 客户端 ping -> 服务端 pong（并刷新在线 lastSeen）
 * - 服务端 WRITER_IDLE -> 刷新 lastSeen 并发出 WS 协议层 ping
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsPingHandler {

    private final SessionRegistry sessionRegistry;
    private final WsConnectionService connectionService;
    private final WsWriter wsWriter;

    public void handleClientPing(ChannelHandlerContext ctx) {
        Long userId = sessionRegistry.userId(ctx.channel());
        if (userId != null) {
            connectionService.touch(userId);
        }
        wsWriter.write(ctx, WsEvents.base(WsEventTypes.PONG));
    }

    public void onWriterIdle(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        Long userId = sessionRegistry.userId(ch);
        if (userId != null && ch.isActive()) {
            // 协议层 pong 到不了 WsFrameHandler，这里刷新 lastSeen，避免仅靠客户端心跳
            connectionService.touch(userId);
        }
        // 正常在线的客户端会自动回 pong，产生读事件；僵尸连接则等 READER_IDLE 清理
        ctx.writeAndFlush(new PingWebSocketFrame()).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("ws ping failed: channel={}, err={}", SessionRegistry.connectionId(ch), String.valueOf(f.cause()));
            }
        });
    }
}
