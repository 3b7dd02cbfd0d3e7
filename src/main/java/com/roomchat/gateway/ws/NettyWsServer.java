package com.roomchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.auth.service.JwtService;
import com.roomchat.gateway.config.GatewayProperties;
import com.roomchat.gateway.session.SessionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@RequiredArgsConstructor
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;
    private final WsConnectionService connectionService;
    private final WsAuthHandler authHandler;
    private final WsPingHandler pingHandler;
    private final WsPresenceHandler presenceHandler;
    private final WsMessageHandler messageHandler;
    private final WsConversationHandler conversationHandler;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", props.hostEffective(), props.port(), path);

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) HTTP 编解码 + 聚合：握手阶段是 HTTP 协议
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(props.maxFrameBytesEffective()));

                        // 2) 空闲检测：READER_IDLE 断开僵尸连接，WRITER_IDLE 发 WS ping
                        p.addLast(new IdleStateHandler(props.readerIdleSecondsEffective(), props.writerIdleSecondsEffective(), 0));

                        // 3) 握手鉴权：带 token 时在 HTTP Upgrade 阶段校验，无效直接 401
                        p.addLast(new WsHandshakeAuthHandler(path, jwtService, sessionRegistry));

                        // 4) WebSocket 协议处理（握手、协议层 ping/pong、close）
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 5) 未带 token 的连接必须在窗口内发 auth 帧
                        p.addLast(new WsAuthTimeoutHandler(sessionRegistry, wsWriter, props.authTimeoutMsEffective()));

                        // 6) 业务帧
                        p.addLast(new WsFrameHandler(objectMapper, sessionRegistry, wsWriter, connectionService,
                                authHandler, pingHandler, presenceHandler, messageHandler, conversationHandler));
                    }
                });

        try {
            serverChannel = b.bind(props.hostEffective(), props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.hostEffective(), props.port(), path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MIN_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
