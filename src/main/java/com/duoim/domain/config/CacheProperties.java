package com.duoim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.cache")
public class CacheProperties {

    private final ChatParticipants chatParticipants = new ChatParticipants();

    public ChatParticipants getChatParticipants() {
        return chatParticipants;
    }

    /**
     * 会话参与者缓存。参与者在会话创建后不再变化，因此只按容量和空闲时间淘汰。
     */
    public static class ChatParticipants {

        private boolean enabled = true;

        private long maximumSize = 100_000;

        private long expireAfterAccessSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public long getExpireAfterAccessSeconds() {
            return expireAfterAccessSeconds;
        }

        public void setExpireAfterAccessSeconds(long expireAfterAccessSeconds) {
            this.expireAfterAccessSeconds = expireAfterAccessSeconds;
        }
    }
}
