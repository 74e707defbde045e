package com.helpdesk.remoteservice.input;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(InputProperties.class)
public class InputConfig {

    @Bean
    public InputAuthorizer inputAuthorizer(InputDevice inputDevice) {
        return new InputAuthorizer(inputDevice);
    }
}
