package com.duoim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话写入相关配置（im.chat.*）。
 */
@ConfigurationProperties(prefix = "im.chat")
public record ChatProperties(
        Write write,
        Message message
) {

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 3000;
    public static final int DEFAULT_MAX_TEXT_LENGTH = 4096;

    /**
     * @param lockTimeoutMs 等待会话写锁的上限；超时返回可重试错误
     */
    public record Write(Long lockTimeoutMs) {
    }

    public record Message(Integer maxTextLength) {
    }

    public long lockTimeoutMsEffective() {
        Long v = write == null ? null : write.lockTimeoutMs();
        if (v == null || v <= 0) {
            return DEFAULT_LOCK_TIMEOUT_MS;
        }
        return v;
    }

    public int maxTextLengthEffective() {
        Integer v = message == null ? null : message.maxTextLength();
        if (v == null || v <= 0) {
            return DEFAULT_MAX_TEXT_LENGTH;
        }
        // 不能超过 t_message.content 的列宽
        return Math.min(v, DEFAULT_MAX_TEXT_LENGTH);
    }
}
