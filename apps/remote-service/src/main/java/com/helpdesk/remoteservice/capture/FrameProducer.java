package com.helpdesk.remoteservice.capture;

import com.helpdesk.remoteservice.desktop.DesktopUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 屏幕帧生产者。
 *
 * 职责：
 * - 维护观看者集合：第一个观看者加入时启动捕获循环，最后一个离开时停止。
 * - 捕获循环按 fps 节拍抓屏、缩放、编码，覆盖“最新一帧”缓冲。
 * - 观看者按需拉取最新帧（拉模式，不主动推送）。
 *
 * 单帧失败（编码异常等）只跳过本帧；图形环境不可用时循环终止并标记 halted。
 * 每次启动都创建新的 {@link CaptureLoop}，旧循环的停止标志与新循环互不影响，
 * 因此停止后立即重启不会出现两个循环同时运行。
 */
@Slf4j
public class FrameProducer {

    private final ScreenSource screenSource;
    private final FrameEncoder encoder;
    private final ExecutorService executor;
    private final Clock clock;
    private final int fps;
    private final int quality;
    private final Duration shutdownTimeout;

    /** 观看者（连接 ID），由 this 监视器保护 */
    private final Set<String> readers = new HashSet<>();
    /** 当前循环，由 this 监视器保护 */
    private CaptureLoop loop;
    private volatile boolean halted;

    private final ReadWriteLock frameLock = new ReentrantReadWriteLock();
    /** 最新一帧，由 frameLock 保护 */
    private Frame latest;

    public FrameProducer(ScreenSource screenSource, FrameEncoder encoder, ExecutorService executor,
                         Clock clock, int fps, int quality, Duration shutdownTimeout) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive");
        }
        this.screenSource = screenSource;
        this.encoder = encoder;
        this.executor = executor;
        this.clock = clock;
        this.fps = fps;
        this.quality = quality;
        this.shutdownTimeout = shutdownTimeout;
    }

    /* =========================
     * 观看者管理
     * ========================= */

    /**
     * 添加观看者；循环未运行时（首次或此前 halted）启动循环。重复添加无副作用。
     */
    public synchronized void addReader(String readerId) {
        readers.add(readerId);
        if (loop == null || !loop.active) {
            startLoop();
        }
        log.debug("添加屏幕观看者: reader={}, readers={}", readerId, readers.size());
    }

    /**
     * 移除观看者；最后一个离开时停止循环。移除不存在的观看者无副作用。
     */
    public synchronized void removeReader(String readerId) {
        if (!readers.remove(readerId)) {
            return;
        }
        log.debug("移除屏幕观看者: reader={}, readers={}", readerId, readers.size());
        if (readers.isEmpty()) {
            stopLoop();
        }
    }

    public synchronized boolean hasReader(String readerId) {
        return readers.contains(readerId);
    }

    public synchronized int readerCount() {
        return readers.size();
    }

    public synchronized boolean isRunning() {
        return loop != null && loop.active;
    }

    /* =========================
     * 帧读取
     * ========================= */

    /**
     * @return 最新一帧；尚未成功捕获过任何帧时为空
     */
    public Optional<Frame> latestFrame() {
        frameLock.readLock().lock();
        try {
            return Optional.ofNullable(latest);
        } finally {
            frameLock.readLock().unlock();
        }
    }

    public CaptureStats stats() {
        synchronized (this) {
            return new CaptureStats(isRunning(), readers.size(), fps, quality, halted);
        }
    }

    /**
     * 捕获并编码一帧，成功后替换最新帧；失败时保留上一帧。
     */
    void captureOnce() throws IOException {
        BufferedImage raw = screenSource.capture();
        FrameEncoder.EncodedImage encoded = encoder.encode(raw);
        Frame frame = new Frame(encoded.bytes(), encoded.width(), encoded.height(), clock.instant());
        frameLock.writeLock().lock();
        try {
            latest = frame;
        } finally {
            frameLock.writeLock().unlock();
        }
    }

    /**
     * 停止循环并等待其退出（最长 shutdownTimeout），随后关闭线程池
     */
    public void shutdown() {
        CaptureLoop current;
        synchronized (this) {
            readers.clear();
            current = loop;
            stopLoop();
        }
        if (current != null) {
            current.awaitExit(shutdownTimeout);
        }
        executor.shutdown();
    }

    /* =========================
     * 循环控制（调用方持有 this 监视器）
     * ========================= */

    private void startLoop() {
        halted = false;
        CaptureLoop next = new CaptureLoop();
        next.future = executor.submit(next);
        loop = next;
        log.info("屏幕捕获已启动: fps={}, quality={}", fps, quality);
    }

    private void stopLoop() {
        if (loop == null) {
            return;
        }
        loop.active = false;
        loop = null;
        log.info("屏幕捕获已停止");
    }

    private final class CaptureLoop implements Runnable {

        private volatile boolean active = true;
        private volatile Future<?> future;

        @Override
        public void run() {
            long frameNanos = TimeUnit.SECONDS.toNanos(1) / fps;
            while (active) {
                long started = System.nanoTime();
                try {
                    captureOnce();
                } catch (DesktopUnavailableException e) {
                    log.error("图形环境不可用，屏幕捕获终止: {}", e.getMessage());
                    halted = true;
                    active = false;
                    return;
                } catch (IOException | RuntimeException e) {
                    log.warn("屏幕捕获失败，跳过本帧", e);
                }
                long remaining = frameNanos - (System.nanoTime() - started);
                if (remaining > 0) {
                    try {
                        TimeUnit.NANOSECONDS.sleep(remaining);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        active = false;
                        return;
                    }
                }
            }
        }

        void awaitExit(Duration timeout) {
            Future<?> f = future;
            if (f == null) {
                return;
            }
            try {
                f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("屏幕捕获线程未在 {} 内退出，强制中断", timeout);
                f.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.warn("屏幕捕获线程异常退出", e.getCause());
            }
        }
    }
}
