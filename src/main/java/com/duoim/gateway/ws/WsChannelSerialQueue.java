package com.duoim.gateway.ws;

import io.netty.channel.Channel;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 每个 Channel 一条串行队列（Future 链）：同一连接的入站帧严格按到达顺序处理，即使处理本身在 DB 线程池上异步执行。
 *
 * <p>链尾会吞掉上一个任务的异常，保证后续任务继续执行；返回给调用方的 future 保留异常。</p>
 */
public final class WsChannelSerialQueue {

    private static final AttributeKey<AtomicReference<CompletableFuture<Void>>> ATTR_TAIL =
            AttributeKey.valueOf("duoim:ws:serial:tail");
    private static final AttributeKey<AtomicInteger> ATTR_PENDING =
            AttributeKey.valueOf("duoim:ws:serial:pending");

    private WsChannelSerialQueue() {
    }

    public static CompletableFuture<Void> enqueue(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");
        AtomicReference<CompletableFuture<Void>> tail = attr(channel, ATTR_TAIL,
                () -> new AtomicReference<>(CompletableFuture.completedFuture(null)));
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);
        while (true) {
            CompletableFuture<Void> prev = tail.get();
            CompletableFuture<Void> next = prev
                    .handle((v, e) -> null)
                    .thenCompose(ignored -> run(task));
            if (tail.compareAndSet(prev, next.handle((v, e) -> null))) {
                pending.incrementAndGet();
                next.whenComplete((v, e) -> pending.decrementAndGet());
                return next;
            }
        }
    }

    /**
     * 待处理数达到上限时直接返回失败（RejectedExecutionException），不入队。
     */
    public static CompletableFuture<Void> tryEnqueue(Channel channel, Supplier<? extends CompletionStage<?>> task, int maxPending) {
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);
        if (pending.get() >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("too_many_pending_frames"));
        }
        return enqueue(channel, task);
    }

    public static int pending(Channel channel) {
        return attr(channel, ATTR_PENDING, AtomicInteger::new).get();
    }

    private static CompletableFuture<Void> run(Supplier<? extends CompletionStage<?>> task) {
        try {
            CompletionStage<?> stage = task.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture().thenApply(v -> null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> T attr(Channel channel, AttributeKey<T> key, Supplier<T> factory) {
        Attribute<T> attr = channel.attr(key);
        T existing = attr.get();
        if (existing != null) {
            return existing;
        }
        T created = factory.get();
        T raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
