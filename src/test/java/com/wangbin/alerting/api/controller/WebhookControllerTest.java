package com.wangbin.alerting.api.controller;

import com.wangbin.alerting.common.domain.enums.BatchStatus;
import com.wangbin.alerting.common.domain.enums.PublishingMode;
import com.wangbin.alerting.common.exception.GlobalExceptionHandler;
import com.wangbin.alerting.core.processor.WebhookOrchestrator;
import com.wangbin.alerting.core.processor.WebhookProcessingResult;
import com.wangbin.alerting.core.storage.InMemoryAlertStorage;
import com.wangbin.alerting.core.webhook.WebhookValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WebhookControllerTest {

    private static final String BODY = "{"
            + "\"version\":\"4\",\"receiver\":\"classifier\",\"status\":\"firing\","
            + "\"alerts\":[{\"status\":\"firing\","
            + "\"labels\":{\"alertname\":\"NodeDown\",\"severity\":\"critical\"},"
            + "\"annotations\":{\"summary\":\"node down\"},"
            + "\"startsAt\":\"2024-05-01T10:00:00Z\",\"endsAt\":\"0001-01-01T00:00:00Z\","
            + "\"generatorURL\":\"http://prometheus/graph\"}]}";

    private WebhookOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(WebhookOrchestrator.class);
        WebhookController controller = new WebhookController(new WebhookValidator(100, Clock.systemUTC()),
                orchestrator, new InMemoryAlertStorage(10));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static WebhookProcessingResult result(BatchStatus status) {
        return WebhookProcessingResult.builder()
                .status(status)
                .message(status.getCode())
                .receiver("classifier")
                .alertResults(List.of())
                .summary(WebhookProcessingResult.Summary.builder().received(1).build())
                .publishingSummary(WebhookProcessingResult.PublishingSummary.builder()
                        .mode(PublishingMode.NORMAL)
                        .enabledTargets(2)
                        .build())
                .build();
    }

    @Test
    void successfulBatchReturns200() throws Exception {
        when(orchestrator.processWebhook(eq("classifier"), anyList())).thenReturn(result(BatchStatus.SUCCESS));

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.receiver").value("classifier"))
                .andExpect(jsonPath("$.summary.received").value(1))
                .andExpect(jsonPath("$.publishing_summary.mode").value("normal"));
    }

    @Test
    void partialBatchReturns207() throws Exception {
        when(orchestrator.processWebhook(eq("classifier"), anyList())).thenReturn(result(BatchStatus.PARTIAL));

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().is(207))
                .andExpect(jsonPath("$.status").value("partial"));
    }

    @Test
    void failedBatchReturns500() throws Exception {
        when(orchestrator.processWebhook(eq("classifier"), anyList())).thenReturn(result(BatchStatus.FAILED));

        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void emptyAlertListIsRejectedBeforeProcessing() throws Exception {
        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"receiver\":\"classifier\",\"alerts\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(2000));

        verify(orchestrator, never()).processWebhook(eq("classifier"), anyList());
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mockMvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void recentAlertsStartEmpty() throws Exception {
        mockMvc.perform(get("/alerts/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
