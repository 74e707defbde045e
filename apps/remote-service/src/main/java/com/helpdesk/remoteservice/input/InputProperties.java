package com.helpdesk.remoteservice.input;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 输入注入配置（前缀 remote.input）
 */
@ConfigurationProperties(prefix = "remote.input")
public class InputProperties {

    /** 文本输入时相邻字符的间隔 */
    private Duration typeInterval = Duration.ofMillis(10);

    /** java.awt.Robot 每个事件后的自动延迟 */
    private Duration autoDelay = Duration.ZERO;

    public Duration getTypeInterval() {
        return typeInterval;
    }

    public void setTypeInterval(Duration typeInterval) {
        this.typeInterval = typeInterval;
    }

    public Duration getAutoDelay() {
        return autoDelay;
    }

    public void setAutoDelay(Duration autoDelay) {
        this.autoDelay = autoDelay;
    }
}
