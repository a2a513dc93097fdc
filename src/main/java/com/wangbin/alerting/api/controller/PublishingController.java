package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.api.dto.DeadLetterResponse;
import com.wangbin.alerting.api.dto.ModeResponse;
import com.wangbin.alerting.api.dto.PublishResultDto;
import com.wangbin.alerting.api.dto.TargetResponse;
import com.wangbin.alerting.common.domain.entity.PublishResult;
import com.wangbin.alerting.common.web.result.ApiResult;
import com.wangbin.alerting.core.mode.ModeManager;
import com.wangbin.alerting.core.publish.ParallelPublisher;
import com.wangbin.alerting.core.publish.PublisherStats;
import com.wangbin.alerting.core.publish.dlq.DeadLetterService;
import com.wangbin.alerting.core.publish.dlq.DeadLetterStats;
import com.wangbin.alerting.core.target.TargetRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 发布模式、目标与死信管理接口
 */
@Slf4j
@RestController
@RequestMapping("/publishing")
@RequiredArgsConstructor
public class PublishingController {

    private final ModeManager modeManager;
    private final TargetRegistry targetRegistry;
    private final ParallelPublisher publisher;
    private final DeadLetterService deadLetterService;

    @GetMapping("/mode")
    public ModeResponse mode() {
        return ModeResponse.from(modeManager.getModeMetrics(), modeManager.now());
    }

    @GetMapping("/mode/history")
    public List<ModeResponse.Transition> modeHistory() {
        return ModeResponse.Transition.fromHistory(modeManager.getModeMetrics().getHistory());
    }

    @GetMapping("/targets")
    public Map<String, Object> targets() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("targets", targetRegistry.snapshot().stream()
                .map(TargetResponse::from).collect(Collectors.toList()));
        result.put("refresh", targetRegistry.getRefreshStatus());
        return result;
    }

    @PostMapping("/targets/refresh")
    public ApiResult<TargetRegistry.RefreshStatus> refreshTargets() {
        boolean ok = targetRegistry.refresh();
        // 刷新后立即重新评估模式，不等下一次定时检查
        modeManager.evaluate();
        TargetRegistry.RefreshStatus status = targetRegistry.getRefreshStatus();
        return ok ? ApiResult.success("目标列表已刷新", status)
                : ApiResult.success("目标发现失败，保留旧列表", status);
    }

    @GetMapping("/stats")
    public PublisherStats stats() {
        return publisher.getStats();
    }

    @GetMapping("/dlq")
    public List<DeadLetterResponse> deadLetters(@RequestParam(required = false) String target,
                                                @RequestParam(defaultValue = "100") int limit) {
        return deadLetterService.list(target, limit).stream()
                .map(DeadLetterResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/dlq/stats")
    public DeadLetterStats deadLetterStats() {
        return deadLetterService.getStats();
    }

    @PostMapping("/dlq/{id}/replay")
    public ApiResult<PublishResultDto> replay(@PathVariable String id) {
        PublishResult result = deadLetterService.replay(id);
        return ApiResult.success(result.isSuccess() ? "重放成功" : "重放失败", PublishResultDto.from(result));
    }

    @DeleteMapping("/dlq")
    public ApiResult<Integer> clearDeadLetters() {
        return ApiResult.success("死信队列已清空", deadLetterService.clear());
    }
}
