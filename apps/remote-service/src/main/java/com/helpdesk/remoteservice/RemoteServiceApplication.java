package com.helpdesk.remoteservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * remote-service 启动入口。
 *
 * 屏幕捕获与输入注入依赖本机图形环境，关闭 Spring Boot 默认的 headless 模式。
 */
@SpringBootApplication
public class RemoteServiceApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(RemoteServiceApplication.class);
        app.setHeadless(false);
        app.run(args);
    }
}
