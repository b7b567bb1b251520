package com.duoim.gateway.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.channels.ClosedChannelException;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化 / 错误回包
 * - 保证 writeAndFlush 在对应 channel 的 eventLoop 上执行
 * - 写失败只记日志，不抛给调用方
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;

    public String encode(WsEnvelope env) {
        try {
            return objectMapper.writeValueAsString(env);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("ws encode failed: type=" + env.getType(), e);
        }
    }

    public WsEnvelope decode(String raw) throws JsonProcessingException {
        return objectMapper.readValue(raw, WsEnvelope.class);
    }

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        return writeText(ch, encode(env));
    }

    public ChannelFuture writeError(Channel ch, String reason, Long chatId) {
        WsEnvelope err = WsEnvelope.of(WsFrameTypes.ERROR, chatId);
        err.reason = reason;
        return write(ch, err);
    }

    public ChannelFuture writeText(Channel ch, String json) {
        if (!ch.isActive()) {
            log.debug("ws write skipped, channel closed: {}", ch);
            return ch.newFailedFuture(new ClosedChannelException());
        }
        if (ch.eventLoop().inEventLoop()) {
            return doWrite(ch, json);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> doWrite(ch, json).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (RuntimeException e) {
            log.debug("ws write rejected by event loop: channel={}, err={}", ch, e.toString());
            promise.setFailure(e);
        }
        return promise;
    }

    private ChannelFuture doWrite(Channel ch, String json) {
        ChannelFuture f = ch.writeAndFlush(new TextWebSocketFrame(json));
        f.addListener(done -> {
            if (!done.isSuccess()) {
                if (ch.isActive()) {
                    log.warn("ws write failed: channel={}, err={}", ch, String.valueOf(done.cause()));
                } else {
                    log.debug("ws write failed on closed channel: channel={}", ch);
                }
            }
        });
        return f;
    }
}
