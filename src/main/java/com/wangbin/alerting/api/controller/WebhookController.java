package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.api.dto.WebhookResponse;
import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.core.processor.WebhookOrchestrator;
import com.wangbin.alerting.core.processor.WebhookProcessingResult;
import com.wangbin.alerting.core.storage.AlertStorage;
import com.wangbin.alerting.core.webhook.WebhookRequest;
import com.wangbin.alerting.core.webhook.WebhookValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 告警接收接口
 *
 * 批次状态映射为 200 / 207 / 500，校验失败由全局异常处理返回 400。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookValidator validator;
    private final WebhookOrchestrator orchestrator;
    private final AlertStorage alertStorage;

    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> receive(@RequestBody WebhookRequest request) {
        List<Alert> alerts = validator.toAlerts(request);
        log.debug("收到Webhook: receiver={}, alerts={}", request.getReceiver(), alerts.size());

        WebhookProcessingResult result = orchestrator.processWebhook(request.getReceiver(), alerts);
        return ResponseEntity.status(result.getStatus().getHttpStatus())
                .body(WebhookResponse.from(result));
    }

    @GetMapping("/alerts/recent")
    public List<Alert> recent(@RequestParam(defaultValue = "50") int limit) {
        return alertStorage.recent(Math.max(1, Math.min(limit, 1000)));
    }
}
