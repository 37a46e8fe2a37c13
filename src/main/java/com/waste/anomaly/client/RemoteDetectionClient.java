package com.waste.anomaly.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waste.anomaly.config.DetectionConfig;
import com.waste.anomaly.model.DetectionOutcome;
import com.waste.anomaly.model.Verdict;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the detection endpoint over HTTP under a hard deadline.
 *
 * The call runs on a dedicated worker and is cancelled once the deadline passes; the socket read
 * timeout matches the deadline so a hung endpoint cannot pin the worker either. Timeouts, transport
 * errors, error statuses and responses missing any verdict field all come back as
 * {@link DetectionOutcome.Unavailable}.
 */
@Component
@ConditionalOnProperty(prefix = "detection.remote", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RemoteDetectionClient implements DetectionClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteDetectionClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final long timeoutMs;
    private final ExecutorService executor;

    public RemoteDetectionClient(DetectionConfig config, ObjectMapper objectMapper) {
        DetectionConfig.Remote remote = config.getRemote();
        this.objectMapper = objectMapper;
        this.url = remote.getUrl();
        this.timeoutMs = remote.getTimeoutMs();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(Math.min(remote.getConnectTimeoutMs(), timeoutMs)));
        requestFactory.setReadTimeout(Duration.ofMillis(timeoutMs));
        this.restClient = RestClient.builder().requestFactory(requestFactory).build();

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "detection-call-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Remote detection client configured: url={}, timeoutMs={}", url, timeoutMs);
    }

    @Override
    @Observed(name = "detection.remote.call", contextualName = "remote-detection")
    public DetectionOutcome detect(String subjectId, double currentQuantity, List<Double> history) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("subjectId", subjectId);
        requestBody.put("currentQuantity", currentQuantity);
        requestBody.put("history", history != null ? history : List.of());

        Future<String> call;
        try {
            call = executor.submit(() -> post(requestBody));
        } catch (RuntimeException e) {
            return unavailable(subjectId, "detection worker rejected call: " + e.getMessage());
        }

        try {
            String body = call.get(timeoutMs, TimeUnit.MILLISECONDS);
            return parseVerdict(subjectId, body);
        } catch (TimeoutException e) {
            call.cancel(true);
            return unavailable(subjectId, "deadline of " + timeoutMs + " ms exceeded");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return unavailable(subjectId, "interrupted while waiting for detection");
        } catch (ExecutionException e) {
            return unavailable(subjectId, describe(e.getCause()));
        }
    }

    private String post(Map<String, Object> requestBody) {
        return restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(requestBody)
                .retrieve()
                .body(String.class);
    }

    DetectionOutcome parseVerdict(String subjectId, String body) {
        if (body == null || body.isBlank()) {
            return unavailable(subjectId, "empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return unavailable(subjectId, "unparseable response: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return unavailable(subjectId, "malformed response: not a JSON object");
        }

        JsonNode flag = root.get("isAnomaly");
        JsonNode zScore = root.get("zScore");
        JsonNode mean = root.get("mean");
        JsonNode stdDev = root.get("stdDev");
        if (flag == null || !flag.isBoolean()) {
            return unavailable(subjectId, "malformed response: isAnomaly missing or not boolean");
        }
        if (!isNumber(zScore) || !isNumber(mean) || !isNumber(stdDev)) {
            return unavailable(subjectId, "malformed response: zScore, mean and stdDev must be numbers");
        }

        return DetectionOutcome.detected(new Verdict(
                flag.booleanValue(), zScore.doubleValue(), mean.doubleValue(), stdDev.doubleValue()));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber();
    }

    private static String describe(Throwable cause) {
        if (cause instanceof RestClientResponseException rre) {
            return "detection endpoint returned " + rre.getStatusCode().value() + ": " + rre.getStatusText();
        }
        if (cause == null) {
            return "unknown detection failure";
        }
        return "transport failure: " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static DetectionOutcome unavailable(String subjectId, String reason) {
        log.warn("Detection unavailable for subject={}: {}", subjectId, reason);
        return DetectionOutcome.unavailable(reason);
    }
}
