package com.helpdesk.remoteservice.capture;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 屏幕捕获装配：专用单线程执行器 + FrameProducer
 */
@Configuration
@EnableConfigurationProperties(CaptureProperties.class)
public class CaptureConfig {

    public static final String CAPTURE_EXECUTOR_BEAN = "frameCaptureExecutor";

    /**
     * 捕获循环线程（守护线程）。关闭由 FrameProducer#shutdown 负责。
     */
    @Bean(name = CAPTURE_EXECUTOR_BEAN, destroyMethod = "")
    public ExecutorService frameCaptureExecutor() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "frame-capture-" + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return Executors.newSingleThreadExecutor(tf);
    }

    @Bean(destroyMethod = "shutdown")
    public FrameProducer frameProducer(ScreenSource screenSource,
                                       @Qualifier(CAPTURE_EXECUTOR_BEAN) ExecutorService executor,
                                       Clock clock,
                                       CaptureProperties props) {
        FrameEncoder encoder = new FrameEncoder(props.getMaxWidth(), props.getQuality(), props.getFormat());
        return new FrameProducer(screenSource, encoder, executor, clock,
                props.getFps(), props.getQuality(), props.getShutdownTimeout());
    }
}
