package com.vulnscan.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.config.VulnScanProperties;
import com.vulnscan.backend.dto.CreateWebhookRequest;
import com.vulnscan.backend.dto.WebhookResponse;
import com.vulnscan.backend.exception.BadRequestException;
import com.vulnscan.backend.model.Webhook;
import com.vulnscan.backend.repository.WebhookRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;

@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookService {

    private final WebhookRepository webhookRepository;
    private final VulnScanProperties properties;
    private final ObjectMapper objectMapper;

    @Transactional
    public WebhookResponse register(Long organizationId, CreateWebhookRequest request) {
        int max = properties.getWebhooks().getMaxPerOrganization();
        if (webhookRepository.countByOrganizationId(organizationId) >= max) {
            throw new BadRequestException("Maximum " + max + " webhooks per organization");
        }
        String headers = null;
        if (request.getHeaders() != null && !request.getHeaders().isEmpty()) {
            try {
                headers = objectMapper.writeValueAsString(request.getHeaders());
            } catch (JsonProcessingException e) {
                throw new BadRequestException("Invalid webhook headers");
            }
        }
        Webhook webhook = webhookRepository.save(Webhook.builder()
                .organizationId(organizationId)
                .name(request.getName())
                .url(request.getUrl())
                .secret(request.getSecret() == null || request.getSecret().isBlank() ? null : request.getSecret())
                .events(new ArrayList<>(request.getEvents()))
                .headers(headers)
                .active(true)
                .createdAt(Instant.now())
                .build());
        log.info("Webhook {} registered for org {} events={}", webhook.getId(), organizationId, webhook.getEvents());
        return toResponse(webhook);
    }

    static WebhookResponse toResponse(Webhook webhook) {
        return WebhookResponse.builder()
                .id(webhook.getId())
                .name(webhook.getName())
                .url(webhook.getUrl())
                .signed(webhook.getSecret() != null)
                .events(webhook.getEvents())
                .active(webhook.isActive())
                .lastTriggeredAt(webhook.getLastTriggeredAt())
                .lastError(webhook.getLastError())
                .createdAt(webhook.getCreatedAt())
                .build();
    }
}
