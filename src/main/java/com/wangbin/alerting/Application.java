package com.wangbin.alerting;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@Slf4j
public class Application {

    public static void main(String[] args) {
        log.info("=== 开始启动告警发布服务 ===");
        SpringApplication.run(Application.class, args);
        log.info("=== 告警发布服务启动成功 ===");
    }
}
