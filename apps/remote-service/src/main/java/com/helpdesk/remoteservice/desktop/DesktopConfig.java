package com.helpdesk.remoteservice.desktop;

import com.helpdesk.remoteservice.input.InputProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 本机桌面装配：同一个 AwtDesktop 同时提供 ScreenSource 与 InputDevice
 */
@Configuration
public class DesktopConfig {

    @Bean
    public AwtDesktop awtDesktop(InputProperties inputProperties) {
        return new AwtDesktop(inputProperties.getTypeInterval(), inputProperties.getAutoDelay());
    }
}
