package com.duoim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.caffeine.client-msg-id")
public class ClientMsgIdCaffeineProperties {

    /** 是否启用发送幂等缓存。关闭后 clientMsgId 被忽略。 */
    private boolean enabled = true;

    private int initialCapacity = 128;

    private long maximumSize = 100_000;

    /** 重试窗口（秒），按写入时间过期。 */
    private long expireAfterWriteSeconds = 1800;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterWriteSeconds() {
        return expireAfterWriteSeconds;
    }

    public void setExpireAfterWriteSeconds(long expireAfterWriteSeconds) {
        this.expireAfterWriteSeconds = expireAfterWriteSeconds;
    }
}
