package com.helpdesk.session.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 会话清理专用调度线程池（单线程，守护线程，不阻塞 JVM 退出）
 */
@Configuration
public class SessionSweepSchedulerConfig {

    public static final String SWEEP_SCHEDULER_BEAN = "sessionSweepScheduler";

    @Bean(name = SWEEP_SCHEDULER_BEAN, destroyMethod = "shutdown")
    public ScheduledExecutorService sessionSweepScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "session-sweep-" + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, tf);
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }
}
