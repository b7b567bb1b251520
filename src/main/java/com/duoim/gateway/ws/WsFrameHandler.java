package com.duoim.gateway.ws;

import com.duoim.common.exception.ImException;
import com.duoim.domain.service.MessagingFacade;
import com.duoim.gateway.session.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 业务帧处理：每个客户端 TextWebSocketFrame 是一段 JSON（{@link WsEnvelope}）。
 *
 * <p>userId 只取握手时绑定到 channel 上的身份，帧里的 userId 一律忽略。
 * JOIN_CHAT / LEAVE_CHAT / TYPING / STOP_TYPING 需要成员校验（可能查库），
 * 通过 {@link WsChannelSerialQueue} 按到达顺序投递到 DB 线程池，不阻塞 eventLoop。</p>
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final MessagingFacade facade;
    private final WsWriter wsWriter;
    private final WsPingHandler pingHandler;
    private final Executor dbExecutor;
    private final int maxPendingFrames;

    public WsFrameHandler(MessagingFacade facade,
                          WsWriter wsWriter,
                          WsPingHandler pingHandler,
                          Executor dbExecutor,
                          int maxPendingFrames) {
        this.facade = facade;
        this.wsWriter = wsWriter;
        this.pingHandler = pingHandler;
        this.dbExecutor = dbExecutor;
        this.maxPendingFrames = maxPendingFrames;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        Channel ch = ctx.channel();
        Long userId = ch.attr(ConnectionRegistry.ATTR_USER_ID).get();
        if (userId == null) {
            wsWriter.writeError(ch, "unauthorized", null);
            ctx.close();
            return;
        }

        WsEnvelope msg;
        try {
            msg = wsWriter.decode(frame.text());
        } catch (JsonProcessingException e) {
            wsWriter.writeError(ch, "bad_json", null);
            return;
        }
        if (msg.type == null) {
            wsWriter.writeError(ch, "missing_type", null);
            return;
        }
        log.debug("ws frame: type={}, userId={}, chatId={}", msg.type, userId, msg.chatId);

        switch (msg.type) {
            case WsFrameTypes.PING -> pingHandler.handleClientPing(ch);
            case WsFrameTypes.JOIN_CHAT -> dispatch(ch, msg, () -> {
                facade.joinChat(userId, msg.chatId, ch);
                wsWriter.write(ch, WsEnvelope.of(WsFrameTypes.JOIN_OK, msg.chatId));
            });
            case WsFrameTypes.LEAVE_CHAT -> dispatch(ch, msg, () -> facade.leaveChat(msg.chatId, ch));
            case WsFrameTypes.TYPING -> dispatch(ch, msg, () -> facade.typing(userId, msg.chatId, ch));
            case WsFrameTypes.STOP_TYPING -> dispatch(ch, msg, () -> facade.stopTyping(userId, msg.chatId));
            default -> wsWriter.writeError(ch, "unknown_type", msg.chatId);
        }
    }

    private void dispatch(Channel ch, WsEnvelope msg, Runnable action) {
        if (msg.chatId == null || msg.chatId <= 0) {
            wsWriter.writeError(ch, "missing_chat_id", null);
            return;
        }
        WsChannelSerialQueue.tryEnqueue(ch, () -> CompletableFuture.runAsync(action, dbExecutor), maxPendingFrames)
                .whenComplete((v, e) -> {
                    if (e != null) {
                        onFrameFailure(ch, msg, e);
                    }
                });
    }

    private void onFrameFailure(Channel ch, WsEnvelope msg, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof ImException ie) {
            log.debug("ws frame rejected: type={}, chatId={}, reason={}", msg.type, msg.chatId, ie.getReason());
            wsWriter.writeError(ch, ie.getReason(), msg.chatId);
            return;
        }
        if (cause instanceof RejectedExecutionException) {
            log.warn("ws frame dropped, server busy: type={}, chatId={}, channel={}", msg.type, msg.chatId, ch);
            wsWriter.writeError(ch, "server_busy", msg.chatId);
            return;
        }
        log.error("ws frame failed: type={}, chatId={}", msg.type, msg.chatId, cause);
        wsWriter.writeError(ch, "internal_error", msg.chatId);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Long userId = ctx.channel().attr(ConnectionRegistry.ATTR_USER_ID).get();
            if (userId == null) {
                ctx.close();
                return;
            }
            facade.connect(userId, ctx.channel());
            return;
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.READER_IDLE) {
            // 一段时间没有收到任何数据：客户端断网 / 异常退出，直接关闭
            log.info("ws reader idle, closing: channel={}", ctx.channel());
            ctx.close();
            return;
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.WRITER_IDLE) {
            pingHandler.onWriterIdle(ctx.channel());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        facade.disconnect(ctx.channel());
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("ws channel error, closing: channel={}, err={}", ctx.channel(), cause.toString());
        ctx.close();
    }
}
