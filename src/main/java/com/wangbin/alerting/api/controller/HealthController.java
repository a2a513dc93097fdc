package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.monitor.health.ServiceHealth;
import com.wangbin.alerting.monitor.health.SystemHealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 服务健康检查接口。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SystemHealthService systemHealthService;

    @GetMapping("/health")
    public ResponseEntity<ServiceHealth> health() {
        ServiceHealth health = systemHealthService.getSystemHealth();
        return ResponseEntity.status(health.isAcceptingAlerts() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(health);
    }
}
