package com.duoim.gateway.ws;

import com.duoim.auth.service.TrustedIdentityResolver;
import com.duoim.gateway.session.ConnectionRegistry;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * WebSocket 握手阶段（HTTP Upgrade）识别身份：
 * <ul>
 *   <li>优先读取上游网关注入的可信身份头（默认 X-User-Id）</li>
 *   <li>仅本地开发且显式开启时，允许 query 参数 userId</li>
 *   <li>识别成功把 userId 绑定到 channel，否则回 401 并关闭</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final TrustedIdentityResolver identityResolver;

    public WsHandshakeAuthHandler(String wsPath, TrustedIdentityResolver identityResolver) {
        this.wsPath = wsPath;
        this.identityResolver = identityResolver;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            writeAndClose(ctx, HttpResponseStatus.NOT_FOUND, "not_found");
            return;
        }

        Long userId = identityResolver.parseUserId(req.headers().get(identityResolver.headerName()));
        if (userId == null && identityResolver.allowQueryUserId()) {
            List<String> values = new QueryStringDecoder(uri).parameters().get("userId");
            if (values != null && !values.isEmpty()) {
                userId = identityResolver.parseUserId(values.get(0));
            }
        }
        if (userId == null) {
            log.debug("ws handshake rejected, no identity: remote={}", ctx.channel().remoteAddress());
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "unauthorized");
            return;
        }

        ctx.channel().attr(ConnectionRegistry.ATTR_USER_ID).set(userId);
        ctx.fireChannelRead(req.retain());
    }

    private void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp).addListener(ChannelFutureListener.CLOSE);
    }
}
