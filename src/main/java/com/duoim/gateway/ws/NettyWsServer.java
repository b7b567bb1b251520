package com.duoim.gateway.ws;

import com.duoim.auth.service.TrustedIdentityResolver;
import com.duoim.domain.service.MessagingFacade;
import com.duoim.gateway.config.GatewayProperties;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "im.gateway.ws", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final TrustedIdentityResolver identityResolver;
    private final MessagingFacade facade;
    private final WsWriter wsWriter;
    private final WsPingHandler pingHandler;
    private final Executor dbExecutor;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         TrustedIdentityResolver identityResolver,
                         MessagingFacade facade,
                         WsWriter wsWriter,
                         WsPingHandler pingHandler,
                         @Qualifier("imDbExecutor") Executor dbExecutor) {
        this.props = props;
        this.identityResolver = identityResolver;
        this.facade = facade;
        this.wsWriter = wsWriter;
        this.pingHandler = pingHandler;
        this.dbExecutor = dbExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path);

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
                        // 握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        p.addLast(new IdleStateHandler(props.readerIdleSecondsEffective(),
                                props.writerIdleSecondsEffective(), 0, TimeUnit.SECONDS));
                        p.addLast(new WsHandshakeAuthHandler(path, identityResolver));
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));
                        p.addLast(new WsFrameHandler(facade, wsWriter, pingHandler, dbExecutor,
                                props.maxPendingFramesEffective()));
                    }
                });

        try {
            serverChannel = b.bind(props.hostEffective(), props.portEffective()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (RuntimeException e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path, e);
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
        // 晚于其它组件启动、早于它们停止
        return Integer.MAX_VALUE - 100;
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
