package com.wangbin.alerting.core.classifier.provider;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.wangbin.alerting.common.domain.entity.Alert;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.common.utils.JsonUtil;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于HTTP的外部分类服务客户端
 *
 * 请求体为告警JSON，响应格式:
 * {"severity":"critical","category":"database","confidence":0.92,"reasoning":"...","recommendations":["..."]}
 */
@Slf4j
@Component
public class HttpClassificationProvider implements ClassificationProvider {

    private final ClassificationProperties properties;

    public HttpClassificationProvider(ClassificationProperties properties) {
        this.properties = properties;
    }

    @Override
    public Classification classify(Alert alert, Duration timeout) throws ClassificationProviderException {
        log.debug("调用分类服务: fingerprint={}, timeout={}ms", alert.getFingerprint(), timeout.toMillis());
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<String> request = new HttpEntity<>(JsonUtil.toJsonString(buildRequest(alert)), headers);

        RestTemplate restTemplate = createClient(timeout);
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    properties.getProviderUrl(), HttpMethod.POST, request, String.class);
            return parseResponse(response.getBody());
        } catch (RestClientResponseException e) {
            throw new ClassificationProviderException(
                    "分类服务返回错误状态: " + e.getStatusCode().value(), e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new ClassificationProviderException("分类服务不可达: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "http";
    }

    /**
     * 读超时取本次调用的超时，连接超时另受 connect-timeout 限制；均至少1ms，避免0被当作无限等待
     */
    private RestTemplate createClient(Duration timeout) {
        long readMillis = Math.max(1, timeout == null ? properties.getTimeout().toMillis() : timeout.toMillis());
        long connectMillis = Math.max(1, Math.min(readMillis, properties.getConnectTimeout().toMillis()));
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectMillis);
        factory.setReadTimeout((int) readMillis);
        return new RestTemplate(factory);
    }

    private Map<String, Object> buildRequest(Alert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fingerprint", alert.getFingerprint());
        body.put("status", alert.getStatus().getCode());
        body.put("labels", alert.getLabels());
        body.put("annotations", alert.getAnnotations());
        body.put("startsAt", alert.getStartsAt() != null ? alert.getStartsAt().toString() : null);
        body.put("endsAt", alert.getEndsAt() != null ? alert.getEndsAt().toString() : null);
        return body;
    }

    Classification parseResponse(String body) throws ClassificationProviderException {
        JSONObject json = JsonUtil.parseJsonObject(body);
        if (json == null) {
            throw new ClassificationProviderException("分类服务响应不是有效JSON");
        }
        if (!json.containsKey("severity")) {
            throw new ClassificationProviderException("分类服务响应缺少severity字段");
        }

        List<String> recommendations = new ArrayList<>();
        JSONArray array = json.getJSONArray("recommendations");
        if (array != null) {
            for (int i = 0; i < array.size(); i++) {
                recommendations.add(array.getString(i));
            }
        }

        Double confidence = json.getDouble("confidence");
        return Classification.builder()
                .severity(Severity.fromCode(json.getString("severity")))
                .category(json.getString("category"))
                .confidence(confidence != null ? confidence : 0.0)
                .reasoning(json.getString("reasoning"))
                .recommendations(recommendations)
                .source(ClassificationSource.PROVIDER)
                .build();
    }
}
