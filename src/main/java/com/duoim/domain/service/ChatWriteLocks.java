package com.duoim.domain.service;

import com.duoim.common.exception.StoreUnavailableException;
import com.duoim.domain.config.ChatProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 会话级写锁：同一会话的追加消息与已读批处理串行执行，不同会话互不影响。
 *
 * <p>锁对象按 chatId 池化（weakValues）：没有线程持有或等待时即可被回收。</p>
 */
@Slf4j
@Component
public class ChatWriteLocks {

    private final LoadingCache<Long, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(chatId -> new ReentrantLock());

    private final long timeoutMs;

    public ChatWriteLocks(ChatProperties props) {
        this.timeoutMs = props.lockTimeoutMsEffective();
    }

    /**
     * 持有 chatId 的写锁执行 action。等待超过上限时抛出可重试的 {@link StoreUnavailableException}。
     */
    public <T> T withLock(long chatId, Supplier<T> action) {
        ReentrantLock lock = locks.get(chatId);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("interrupted", e);
        }
        if (!acquired) {
            log.warn("chat write lock timeout: chatId={}, timeoutMs={}", chatId, timeoutMs);
            throw new StoreUnavailableException("chat_busy");
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
