package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.web.result.ApiResult;
import com.wangbin.alerting.core.classifier.ClassificationService;
import com.wangbin.alerting.core.classifier.ClassificationStats;
import com.wangbin.alerting.core.webhook.WebhookRequest;
import com.wangbin.alerting.core.webhook.WebhookValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/classification")
@RequiredArgsConstructor
public class ClassificationController {

    private final ClassificationService classificationService;
    private final WebhookValidator validator;

    @GetMapping("/stats")
    public ClassificationStats stats() {
        return classificationService.getStats();
    }

    @DeleteMapping("/cache/{fingerprint}")
    public ApiResult<Boolean> invalidate(@PathVariable String fingerprint) {
        return ApiResult.success(classificationService.invalidate(fingerprint));
    }

    /**
     * 对单条 Alertmanager 格式告警做一次分类
     */
    @PostMapping("/classify")
    public Classification classify(@RequestBody WebhookRequest.AlertItem item) {
        WebhookRequest request = WebhookRequest.builder().alerts(List.of(item)).build();
        Alert alert = validator.toAlerts(request).get(0);
        return classificationService.classify(alert);
    }
}
