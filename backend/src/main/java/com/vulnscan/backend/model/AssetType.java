package com.vulnscan.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum AssetType {
    SUBDOMAIN,
    IP_ADDRESS,
    URL,
    API_ENDPOINT,
    PORT,
    TECHNOLOGY;

    /**
     * Maps the engine's asset type names onto stored types. Empty for anything unrecognised.
     */
    public static Optional<AssetType> fromEngine(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SUBDOMAIN", "DOMAIN" -> Optional.of(SUBDOMAIN);
            case "IP", "IP_ADDRESS" -> Optional.of(IP_ADDRESS);
            case "URL" -> Optional.of(URL);
            case "ENDPOINT", "API_ENDPOINT" -> Optional.of(API_ENDPOINT);
            case "PORT" -> Optional.of(PORT);
            case "TECHNOLOGY", "TECH" -> Optional.of(TECHNOLOGY);
            default -> Optional.empty();
        };
    }
}
