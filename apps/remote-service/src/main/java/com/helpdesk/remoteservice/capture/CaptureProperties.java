package com.helpdesk.remoteservice.capture;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 屏幕捕获配置（前缀 remote.capture）
 */
@ConfigurationProperties(prefix = "remote.capture")
public class CaptureProperties {

    /** 目标帧率 */
    private int fps = 15;

    /** 编码质量 1-100 */
    private int quality = 70;

    /** 超过该宽度时按比例缩小 */
    private int maxWidth = 1920;

    /** ImageIO 格式名 */
    private String format = "jpg";

    /** 停止捕获时等待当前帧完成的最长时间 */
    private Duration shutdownTimeout = Duration.ofSeconds(2);

    public int getFps() {
        return fps;
    }

    public void setFps(int fps) {
        this.fps = fps;
    }

    public int getQuality() {
        return quality;
    }

    public void setQuality(int quality) {
        this.quality = quality;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
