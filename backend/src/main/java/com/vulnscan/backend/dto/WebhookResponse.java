package com.vulnscan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookResponse {
    private Long id;
    private String name;
    private String url;
    private boolean signed;
    private List<String> events;
    private boolean active;
    private Instant lastTriggeredAt;
    private String lastError;
    private Instant createdAt;
}
