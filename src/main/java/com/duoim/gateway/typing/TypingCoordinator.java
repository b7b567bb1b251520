package com.duoim.gateway.typing;

import com.duoim.gateway.config.TypingProperties;
import io.netty.channel.Channel;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * “正在输入”去抖：每个 (chatId, userId) 一个两态状态机 IDLE / TYPING。
 *
 * <ul>
 *   <li>IDLE + typing：进入 TYPING，通知 userTyping，启动超时定时器。</li>
 *   <li>TYPING + typing：只重置定时器。</li>
 *   <li>TYPING + stopTyping / 超时 / 发起连接断开：回到 IDLE，通知 userStoppedTyping。</li>
 *   <li>IDLE + stopTyping：忽略。</li>
 * </ul>
 *
 * <p>状态切换都在该 key 的 TypingState 监视器内完成。每次布置定时器都带 generation，
 * 触发时 generation 已变化（被取消或重置）就直接返回。回到 IDLE 的状态对象会从 map 移除并标记 retired，
 * 后来者拿到 retired 对象时重新 computeIfAbsent。</p>
 */
@Slf4j
@Component
public class TypingCoordinator {

    private record Key(long chatId, long userId) {
    }

    private static final class TypingState {
        boolean typing;
        long generation;
        ScheduledFuture<?> timeout;
        Channel origin;
        boolean retired;
    }

    private final ConcurrentHashMap<Key, TypingState> states = new ConcurrentHashMap<>();
    private final List<TypingListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService scheduler;
    private final long timeoutMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public TypingCoordinator(TypingProperties props,
                             @Qualifier("imTypingScheduler") ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        this.timeoutMs = props.idleTimeoutMsEffective();
    }

    public void addListener(TypingListener listener) {
        listeners.add(listener);
    }

    public void typing(long chatId, long userId, Channel origin) {
        if (closed.get()) {
            return;
        }
        Key key = new Key(chatId, userId);
        while (true) {
            TypingState st = states.computeIfAbsent(key, k -> new TypingState());
            synchronized (st) {
                if (st.retired) {
                    continue;
                }
                st.origin = origin;
                cancelTimer(st);
                long gen = ++st.generation;
                try {
                    st.timeout = scheduler.schedule(() -> onTimeout(key, st, gen), timeoutMs, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    // 调度器已关闭（应用停机中）
                    log.debug("typing timer rejected: chatId={}, userId={}", chatId, userId);
                    retire(key, st);
                    return;
                }
                if (!st.typing) {
                    st.typing = true;
                    log.debug("typing started: chatId={}, userId={}", chatId, userId);
                    emitTyping(chatId, userId, origin);
                }
                return;
            }
        }
    }

    public void stopTyping(long chatId, long userId) {
        Key key = new Key(chatId, userId);
        TypingState st = states.get(key);
        if (st == null) {
            return;
        }
        synchronized (st) {
            if (st.retired || !st.typing) {
                return;
            }
            toIdle(key, st, "stop");
        }
    }

    /**
     * 连接断开：由它最后驱动、仍处于 TYPING 的 key 全部按 stopTyping 处理。
     */
    public void onDisconnect(Channel ch) {
        for (Map.Entry<Key, TypingState> e : states.entrySet()) {
            TypingState st = e.getValue();
            if (st.origin != ch) {
                continue;
            }
            synchronized (st) {
                if (st.retired || !st.typing || st.origin != ch) {
                    continue;
                }
                toIdle(e.getKey(), st, "disconnect");
            }
        }
    }

    public boolean isTyping(long chatId, long userId) {
        TypingState st = states.get(new Key(chatId, userId));
        if (st == null) {
            return false;
        }
        synchronized (st) {
            return !st.retired && st.typing;
        }
    }

    /** 取消所有待触发的定时器，之后的 typing 调用被忽略。 */
    @PreDestroy
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int cancelled = 0;
        for (Map.Entry<Key, TypingState> e : states.entrySet()) {
            TypingState st = e.getValue();
            synchronized (st) {
                if (!st.retired) {
                    cancelTimer(st);
                    retire(e.getKey(), st);
                    cancelled++;
                }
            }
        }
        log.info("typing coordinator shut down, cancelled {} pending timers", cancelled);
    }

    private void onTimeout(Key key, TypingState st, long gen) {
        synchronized (st) {
            if (st.retired || st.generation != gen || !st.typing) {
                return;
            }
            st.timeout = null;
            toIdle(key, st, "timeout");
        }
    }

    // 调用方持有 st 的监视器
    private void toIdle(Key key, TypingState st, String cause) {
        cancelTimer(st);
        st.typing = false;
        Channel origin = st.origin;
        retire(key, st);
        log.debug("typing stopped: chatId={}, userId={}, cause={}", key.chatId(), key.userId(), cause);
        emitStopped(key.chatId(), key.userId(), origin);
    }

    private void retire(Key key, TypingState st) {
        st.generation++;
        st.retired = true;
        states.remove(key, st);
    }

    private static void cancelTimer(TypingState st) {
        if (st.timeout != null) {
            st.timeout.cancel(false);
            st.timeout = null;
        }
    }

    private void emitTyping(long chatId, long userId, Channel origin) {
        for (TypingListener l : listeners) {
            try {
                l.onUserTyping(chatId, userId, origin);
            } catch (RuntimeException e) {
                log.warn("typing listener failed: chatId={}, userId={}", chatId, userId, e);
            }
        }
    }

    private void emitStopped(long chatId, long userId, Channel origin) {
        for (TypingListener l : listeners) {
            try {
                l.onUserStoppedTyping(chatId, userId, origin);
            } catch (RuntimeException e) {
                log.warn("typing listener failed: chatId={}, userId={}", chatId, userId, e);
            }
        }
    }
}
