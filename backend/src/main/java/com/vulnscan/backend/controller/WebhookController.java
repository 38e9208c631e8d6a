package com.vulnscan.backend.controller;

import com.vulnscan.backend.dto.CreateWebhookRequest;
import com.vulnscan.backend.dto.DeliveryResult;
import com.vulnscan.backend.dto.WebhookResponse;
import com.vulnscan.backend.service.WebhookDispatcher;
import com.vulnscan.backend.service.WebhookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks")
public class WebhookController {

    private final WebhookDispatcher webhookDispatcher;
    private final WebhookService webhookService;

    @PostMapping
    @Operation(summary = "Register a webhook (max 20 per organization)")
    public ResponseEntity<WebhookResponse> register(@RequestHeader(ScanController.ORG_HEADER) Long organizationId,
                                                    @Valid @RequestBody CreateWebhookRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(webhookService.register(organizationId, request));
    }

    @PostMapping("/{id}/test")
    @Operation(summary = "Send a webhook.test delivery")
    public ResponseEntity<DeliveryResult> test(@RequestHeader(ScanController.ORG_HEADER) Long organizationId,
                                               @PathVariable Long id) {
        return ResponseEntity.ok(webhookDispatcher.sendTest(organizationId, id));
    }
}
