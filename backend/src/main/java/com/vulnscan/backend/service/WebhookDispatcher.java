package com.vulnscan.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.dto.DeliveryResult;
import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Webhook;
import com.vulnscan.backend.repository.WebhookRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Delivers signed event envelopes to an organization's webhooks. Deliveries run in parallel, each
 * bounded by its own timeout, and every webhook gets its own result.
 */
@Slf4j
@Service
public class WebhookDispatcher {

    public static final String EVENT_SCAN_COMPLETED = "scan.completed";
    public static final String EVENT_SCAN_FAILED = "scan.failed";
    public static final String EVENT_VULN_CRITICAL = "vulnerability.critical";
    public static final String EVENT_VULN_HIGH = "vulnerability.high";
    public static final String EVENT_ASSET_DISCOVERED = "asset.discovered";
    public static final String EVENT_TEST = "webhook.test";

    static final String EVENT_HEADER = "X-Webhook-Event";
    private static final int MAX_BODY_IN_ERROR = 200;
    private static final int MAX_ERROR_LENGTH = 500;

    private final WebhookRepository webhookRepository;
    private final WebhookSigner signer;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Executor webhookExecutor;
    private final VulnScanProperties properties;
    private final MetricsService metricsService;

    public WebhookDispatcher(WebhookRepository webhookRepository,
                             WebhookSigner signer,
                             @Qualifier("webhookRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             @Qualifier("webhookExecutor") Executor webhookExecutor,
                             VulnScanProperties properties,
                             MetricsService metricsService) {
        this.webhookRepository = webhookRepository;
        this.signer = signer;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.webhookExecutor = webhookExecutor;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    public List<DeliveryResult> dispatch(Long organizationId, String event, Object data) {
        List<Webhook> webhooks = webhookRepository.findByOrganizationIdAndActiveTrue(organizationId).stream()
                .filter(webhook -> webhook.isSubscribedTo(event))
                .toList();
        if (webhooks.isEmpty()) {
            return List.of();
        }
        String body = envelope(event, data);

        List<CompletableFuture<DeliveryResult>> futures = new ArrayList<>();
        for (Webhook webhook : webhooks) {
            futures.add(deliverAsync(webhook, event, body));
        }

        List<DeliveryResult> results = futures.stream().map(CompletableFuture::join).toList();
        Instant now = Instant.now();
        for (DeliveryResult result : results) {
            record(result, now);
        }
        long delivered = results.stream().filter(DeliveryResult::isDelivered).count();
        log.info("Webhook event {} for org {}: {}/{} delivered", event, organizationId, delivered, results.size());
        return results;
    }

    /**
     * Sends a {@code webhook.test} envelope to one webhook of the organization.
     */
    public DeliveryResult sendTest(Long organizationId, Long webhookId) {
        Webhook webhook = webhookRepository.findById(webhookId)
                .filter(w -> w.getOrganizationId().equals(organizationId))
                .orElseThrow(() -> new NotFoundException("Webhook not found"));
        Map<String, Object> data = Map.of("message", "This is a test webhook delivery from VulnScan");
        DeliveryResult result = deliverAsync(webhook, EVENT_TEST, envelope(EVENT_TEST, data)).join();
        record(result, Instant.now());
        return result;
    }

    /**
     * Unsigned one-off delivery to a bare URL, used by alert rules with a webhook channel.
     */
    public DeliveryResult deliverToUrl(String url, String event, Object data) {
        Webhook adhoc = Webhook.builder().url(url).build();
        DeliveryResult result = deliverAsync(adhoc, event, envelope(event, data)).join();
        metricsService.recordWebhookDelivery(result.isDelivered());
        return result;
    }

    String envelope(String event, Object data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event", event);
        envelope.put("timestamp", Instant.now().toString());
        envelope.put("data", data);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload for " + event + " is not serializable", e);
        }
    }

    // Connect and read timeouts each restart per attempt/chunk; this bounds the whole delivery.
    private CompletableFuture<DeliveryResult> deliverAsync(Webhook webhook, String event, String body) {
        long timeoutMs = properties.getWebhooks().getTimeoutMs();
        return CompletableFuture
                .supplyAsync(() -> deliver(webhook, event, body), webhookExecutor)
                .completeOnTimeout(DeliveryResult.failed(webhook.getId(), null,
                        "Timed out after " + timeoutMs + "ms"), timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> DeliveryResult.failed(webhook.getId(), null, errorText(ex)));
    }

    private DeliveryResult deliver(Webhook webhook, String event, String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set(HttpHeaders.USER_AGENT, properties.getWebhooks().getUserAgent());
            headers.set(EVENT_HEADER, event);
            customHeaders(webhook).forEach(headers::set);
            if (webhook.getSecret() != null && !webhook.getSecret().isBlank()) {
                headers.set(WebhookSigner.HEADER, signer.sign(webhook.getSecret(), body));
            }
            ResponseEntity<String> response = restTemplate.exchange(webhook.getUrl(), HttpMethod.POST,
                    new HttpEntity<>(body, headers), String.class);
            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                return DeliveryResult.delivered(webhook.getId(), status);
            }
            return DeliveryResult.failed(webhook.getId(), status, "HTTP " + status + ": " + abbreviate(response.getBody()));
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            return DeliveryResult.failed(webhook.getId(), status,
                    "HTTP " + status + ": " + abbreviate(e.getResponseBodyAsString()));
        } catch (Exception e) {
            log.warn("Webhook delivery to {} failed: {}", webhook.getUrl(), e.getMessage());
            return DeliveryResult.failed(webhook.getId(), null, errorText(e));
        }
    }

    private Map<String, String> customHeaders(Webhook webhook) {
        if (webhook.getHeaders() == null || webhook.getHeaders().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(webhook.getHeaders(), new TypeReference<Map<String, String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Ignoring invalid custom headers on webhook {}", webhook.getId());
            return Map.of();
        }
    }

    private void record(DeliveryResult result, Instant now) {
        metricsService.recordWebhookDelivery(result.isDelivered());
        if (result.webhookId() == null) {
            return;
        }
        try {
            webhookRepository.recordDelivery(result.webhookId(), now, result.error());
        } catch (Exception e) {
            log.warn("Failed to record delivery outcome for webhook {}: {}", result.webhookId(), e.getMessage());
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_IN_ERROR ? body.substring(0, MAX_BODY_IN_ERROR) : body;
    }

    private static String errorText(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
