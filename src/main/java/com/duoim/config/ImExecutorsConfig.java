package com.duoim.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(ImExecutorsProperties.class)
public class ImExecutorsConfig {

    @Bean("imDbExecutor")
    @Primary
    public Executor imDbExecutor(ImExecutorsProperties props) {
        ImExecutorsProperties.Db db = props.dbEffective();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("im-db-");
        executor.setCorePoolSize(db.corePoolSizeEffective());
        executor.setMaxPoolSize(db.maxPoolSizeEffective());
        executor.setQueueCapacity(db.queueCapacityEffective());
        // 队列满直接拒绝：调用方回 ERROR 帧，而不是在 eventLoop 上同步执行
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * 输入状态去抖定时器。定时任务只做状态切换和投递广播，默认单线程足够。
     */
    @Bean(name = "imTypingScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService imTypingScheduler(ImExecutorsProperties props) {
        AtomicInteger seq = new AtomicInteger();
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
                props.typingEffective().timerThreadsEffective(),
                r -> {
                    Thread t = new Thread(r, "im-typing-timer-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
        // 被取消的超时任务立即出队，频繁重置定时器时不堆积
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
