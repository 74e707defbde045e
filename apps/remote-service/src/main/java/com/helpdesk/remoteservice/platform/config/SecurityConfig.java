package com.helpdesk.remoteservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 安全配置（Resource Server）
 * -------------------------------------------------------
 *  - /api/** 需要 JWT（创建会话、查询、统计）；员工角色由 StaffGuard 在接口内校验。
 *  - /ws/** 放行：终端用户没有 JWT，靠会话令牌在 STOMP 层接入；员工 JWT 在 CONNECT 帧里校验。
 *  - /actuator/health、/actuator/info 放行。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                        .requestMatchers("/ws/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(Customizer.withDefaults()));
        return http.build();
    }
}
