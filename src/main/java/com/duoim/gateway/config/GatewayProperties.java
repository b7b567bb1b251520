package com.duoim.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Netty WebSocket 网关配置（im.gateway.ws.*）。
 */
@ConfigurationProperties(prefix = "im.gateway.ws")
public record GatewayProperties(
        Boolean enabled,
        String host,
        Integer port,
        String path,
        Integer readerIdleSeconds,
        Integer writerIdleSeconds,
        Integer maxFrameBytes,
        Integer maxPendingFrames
) {

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host;
    }

    public int portEffective() {
        return port == null || port <= 0 ? 9001 : port;
    }

    public String pathEffective() {
        if (path == null || path.isBlank()) {
            return "/ws";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    /** 多久收不到任何数据就关闭连接。 */
    public int readerIdleSecondsEffective() {
        return readerIdleSeconds == null || readerIdleSeconds <= 0 ? 90 : readerIdleSeconds;
    }

    /** 多久没写出数据就发一次服务端 PING。 */
    public int writerIdleSecondsEffective() {
        return writerIdleSeconds == null || writerIdleSeconds <= 0 ? 30 : writerIdleSeconds;
    }

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null || maxFrameBytes <= 0 ? 65536 : maxFrameBytes;
    }

    /** 单连接待处理入站帧上限，超出回 ERROR。 */
    public int maxPendingFramesEffective() {
        return maxPendingFrames == null || maxPendingFrames <= 0 ? 256 : maxPendingFrames;
    }
}
