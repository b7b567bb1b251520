package com.duoim.domain.cache;

import com.duoim.domain.config.ClientMsgIdCaffeineProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 基于 Caffeine 的发送幂等：(senderId + clientMsgId) -> 已落库的 messageId。
 *
 * <p>只在会话写锁内读写，同一会话的并发重试不会各自落库。</p>
 */
@Component
public class ClientMsgIdIdempotency {

    @Getter
    private final ClientMsgIdCaffeineProperties props;

    private final Cache<String, Long> cache;

    public ClientMsgIdIdempotency(ClientMsgIdCaffeineProperties props) {
        this.props = props;
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getExpireAfterWriteSeconds())))
                .build();
    }

    /**
     * @return 未启用或 clientMsgId 为空时返回 null，表示不做幂等
     */
    public String key(long senderId, String clientMsgId) {
        if (!props.isEnabled() || clientMsgId == null || clientMsgId.isBlank()) {
            return null;
        }
        return senderId + "-" + clientMsgId;
    }

    public Long get(String key) {
        return key == null ? null : cache.getIfPresent(key);
    }

    public void put(String key, long messageId) {
        if (key != null) {
            cache.put(key, messageId);
        }
    }
}
