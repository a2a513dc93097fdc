package com.wangbin.alerting.core.classifier.provider;

import com.sun.net.httpserver.HttpServer;
import com.wangbin.alerting.common.domain.entity.Classification;
import com.wangbin.alerting.common.domain.enums.ClassificationSource;
import com.wangbin.alerting.common.domain.enums.Severity;
import com.wangbin.alerting.core.classifier.config.ClassificationProperties;
import com.wangbin.alerting.support.TestAlerts;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class HttpClassificationProviderTest {

    private final HttpClassificationProvider provider = new HttpClassificationProvider(new ClassificationProperties());

    @Test
    void parsesProviderResponse() throws ClassificationProviderException {
        Classification c = provider.parseResponse("{\"severity\":\"critical\",\"category\":\"database\","
                + "\"confidence\":0.92,\"reasoning\":\"replication broken\","
                + "\"recommendations\":[\"check replica\",\"page dba\"]}");

        assertEquals(Severity.CRITICAL, c.getSeverity());
        assertEquals("database", c.getCategory());
        assertEquals(0.92, c.getConfidence(), 1e-9);
        assertEquals(ClassificationSource.PROVIDER, c.getSource());
        assertEquals(List.of("check replica", "page dba"), c.getRecommendations());
    }

    @Test
    void unknownSeverityAndOutOfRangeConfidenceAreNormalised() throws ClassificationProviderException {
        Classification c = provider.parseResponse("{\"severity\":\"sev0\",\"confidence\":1.7}");

        assertEquals(Severity.UNKNOWN, c.getSeverity());
        assertEquals(1.0, c.getConfidence(), 1e-9);
        assertEquals("general", c.getCategory());
    }

    @Test
    void invalidBodyIsRejected() {
        assertThrows(ClassificationProviderException.class, () -> provider.parseResponse("not json"));
        assertThrows(ClassificationProviderException.class, () -> provider.parseResponse("{\"category\":\"x\"}"));
    }

    @Test
    void slowProviderIsAbandonedAtCallerTimeout() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/classify", exchange -> {
            exchange.getRequestBody().readAllBytes();
            try {
                Thread.sleep(3000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            byte[] body = "{\"severity\":\"critical\"}".getBytes();
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        ExecutorService serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        try {
            ClassificationProperties properties = new ClassificationProperties();
            properties.setProviderUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/classify");
            properties.setTimeout(Duration.ofSeconds(10));
            HttpClassificationProvider slowProvider = new HttpClassificationProvider(properties);

            long start = System.nanoTime();
            assertThrows(ClassificationProviderException.class,
                    () -> slowProvider.classify(TestAlerts.alert("HighCPU", "warning"), Duration.ofMillis(300)));
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMillis < 1500, "耗时 " + elapsedMillis + "ms");
        } finally {
            server.stop(0);
            serverExecutor.shutdownNow();
        }
    }
}
