package com.duoim.gateway.ws;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * WS 心跳：
 * - 客户端 PING -> 服务端 PONG
 * - 服务端 WRITER_IDLE -> 协议层 ping + JSON PING，让正常连接持续产生读事件，僵尸连接由 READER_IDLE 清理
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPingHandler {

    private final WsWriter wsWriter;

    public void handleClientPing(Channel ch) {
        wsWriter.write(ch, WsEnvelope.of(WsFrameTypes.PONG));
    }

    public void onWriterIdle(Channel ch) {
        if (!ch.isActive()) {
            return;
        }
        ch.writeAndFlush(new PingWebSocketFrame()).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("ws ping frame failed: channel={}, err={}", ch, String.valueOf(f.cause()));
            }
        });
        wsWriter.write(ch, WsEnvelope.of(WsFrameTypes.PING));
    }
}
