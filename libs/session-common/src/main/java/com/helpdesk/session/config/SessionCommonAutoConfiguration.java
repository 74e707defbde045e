package com.helpdesk.session.config;

import com.helpdesk.session.SessionRegistry;
import com.helpdesk.session.SessionSweeper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 远程会话自动配置入口。
 *
 * 引入 session-common 即获得：SessionRegistry、过期清理任务及其调度线程池。
 * 设置 remote.session.enabled=false 可整体关闭。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "remote.session", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RemoteSessionProperties.class)
@Import(SessionSweepSchedulerConfig.class)
public class SessionCommonAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock remoteSessionClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRegistry sessionRegistry(Clock clock, RemoteSessionProperties properties) {
        return new SessionRegistry(clock, properties.getTtl(), properties.getMaxAuthFailures());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public SessionSweeper sessionSweeper(SessionRegistry registry,
                                         @Qualifier(SessionSweepSchedulerConfig.SWEEP_SCHEDULER_BEAN)
                                         ScheduledExecutorService scheduler,
                                         RemoteSessionProperties properties) {
        return new SessionSweeper(registry, scheduler, properties.getSweepInterval());
    }
}
