package com.wangbin.alerting.core.publish.sender;

import com.wangbin.alerting.common.domain.entity.Target;
import com.wangbin.alerting.common.domain.enums.PublishErrorCode;
import com.wangbin.alerting.core.publish.config.PublishingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * 基于RestTemplate的HTTP投递
 *
 * 每次调用按传入的超时创建请求工厂，连接与读取超时都不超过调用方剩余的截止时间。
 */
@Slf4j
@Component
public class HttpTargetSender implements TargetSender {

    private static final String USER_AGENT = "AlertPublisher/1.0";

    private final PublishingProperties properties;

    public HttpTargetSender(PublishingProperties properties) {
        this.properties = properties;
    }

    @Override
    public int send(Target target, String payload, Duration timeout) throws TargetDeliveryException {
        if (target.getUrl() == null || target.getUrl().isBlank()) {
            throw new TargetDeliveryException(PublishErrorCode.CLIENT_ERROR, 0,
                    "目标未配置URL: " + target.getName());
        }

        int timeoutMillis = effectiveTimeoutMillis(timeout);
        RestTemplate client = createClient(timeoutMillis);
        HttpEntity<String> request = new HttpEntity<>(payload, buildHeaders(target));

        try {
            ResponseEntity<String> response = client.exchange(target.getUrl(), HttpMethod.POST, request, String.class);
            int status = response.getStatusCode().value();
            log.debug("目标投递成功: target={}, status={}", target.getName(), status);
            return status;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw TargetDeliveryException.ofStatus(status, "目标返回错误状态: " + status);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TargetDeliveryException(PublishErrorCode.TIMEOUT,
                        "目标投递超时(" + timeoutMillis + "ms)", e);
            }
            throw new TargetDeliveryException(PublishErrorCode.CONNECTION_ERROR, "目标连接失败: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TargetDeliveryException(PublishErrorCode.UNKNOWN_ERROR, "目标投递异常: " + e.getMessage(), e);
        }
    }

    /**
     * 单次超时取传入值与目标超时的较小者；0 在 HttpURLConnection 中表示无限等待，因此至少为1ms
     */
    int effectiveTimeoutMillis(Duration timeout) {
        long limit = properties.getTargetTimeout().toMillis();
        long requested = timeout == null ? limit : Math.min(timeout.toMillis(), limit);
        return (int) Math.max(1, requested);
    }

    private static RestTemplate createClient(int timeoutMillis) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMillis);
        factory.setReadTimeout(timeoutMillis);
        return new RestTemplate(factory);
    }

    private HttpHeaders buildHeaders(Target target) {
        HttpHeaders headers = new HttpHeaders();
        target.getHeaders().forEach(headers::set);
        if (!headers.containsKey(HttpHeaders.CONTENT_TYPE)) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (!headers.containsKey(HttpHeaders.USER_AGENT)) {
            headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        }
        return headers;
    }
}
