package com.helpdesk.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 过期会话清理任务：按固定间隔调用 {@link SessionRegistry#sweepExpired()}。
 *
 * 单次清理抛出的异常只记录日志，不会终止后续调度。
 */
@Slf4j
public class SessionSweeper {

    private final SessionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Duration interval;

    private ScheduledFuture<?> task;

    public SessionSweeper(SessionRegistry registry, ScheduledExecutorService scheduler, Duration interval) {
        this.registry = registry;
        this.scheduler = scheduler;
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("sweep interval must be positive");
        }
        this.interval = interval;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        long millis = interval.toMillis();
        task = scheduler.scheduleAtFixedRate(this::sweepOnce, millis, millis, TimeUnit.MILLISECONDS);
        log.info("远程会话清理任务已启动: interval={}", interval);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        task = null;
        log.info("远程会话清理任务已停止");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    void sweepOnce() {
        try {
            int removed = registry.sweepExpired();
            log.debug("会话清理完成: removed={}", removed);
        } catch (RuntimeException e) {
            // 吞掉异常：scheduleAtFixedRate 遇到异常会取消后续执行
            log.error("会话清理失败", e);
        }
    }
}
