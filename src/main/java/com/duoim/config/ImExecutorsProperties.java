package com.duoim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 业务线程池配置。
 *
 * <ul>
 *   <li>db：WS 帧里需要查库的动作（JOIN_CHAT / TYPING 的成员校验）在这里执行，不占 Netty eventLoop。</li>
 *   <li>typing：输入状态超时定时器的线程数。</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "im.executors")
public record ImExecutorsProperties(Db db, Typing typing) {

    public Db dbEffective() {
        return db == null ? new Db(null, null, null) : db;
    }

    public Typing typingEffective() {
        return typing == null ? new Typing(null) : typing;
    }

    public record Db(Integer corePoolSize, Integer maxPoolSize, Integer queueCapacity) {

        public int corePoolSizeEffective() {
            return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
        }

        /** 不会小于 core。 */
        public int maxPoolSizeEffective() {
            int max = maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
            return Math.max(max, corePoolSizeEffective());
        }

        public int queueCapacityEffective() {
            return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
        }
    }

    public record Typing(Integer timerThreads) {

        public int timerThreadsEffective() {
            return timerThreads == null ? 1 : Math.max(1, timerThreads);
        }
    }
}
