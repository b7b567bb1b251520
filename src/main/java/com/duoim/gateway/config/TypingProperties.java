package com.duoim.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.typing")
public record TypingProperties(Long idleTimeoutMs) {

    /**
     * 最后一次 TYPING 之后多久自动判定为停止输入。
     */
    public long idleTimeoutMsEffective() {
        return idleTimeoutMs == null || idleTimeoutMs <= 0 ? 2000L : idleTimeoutMs;
    }
}
