package com.vulnscan.backend.model;

import java.util.Locale;
import java.util.Map;

public enum VulnCategory {
    SQL_INJECTION,
    XSS_REFLECTED,
    XSS_STORED,
    SSRF,
    LFI,
    RFI,
    COMMAND_INJECTION,
    PATH_TRAVERSAL,
    OPEN_REDIRECT,
    CSRF,
    IDOR,
    CORS_MISCONFIG,
    SECURITY_HEADERS,
    SSL_TLS,
    CERT_ISSUE,
    INFO_DISCLOSURE,
    DIRECTORY_LISTING,
    SENSITIVE_FILE,
    OUTDATED_SOFTWARE,
    DEFAULT_CREDENTIALS,
    EMAIL_SECURITY,
    COOKIE_SECURITY,
    HTTP_METHODS,
    OTHER;

    // Engine-side names that differ from ours.
    private static final Map<String, VulnCategory> ALIASES = Map.ofEntries(
            Map.entry("SQLI", SQL_INJECTION),
            Map.entry("XSS", XSS_REFLECTED),
            Map.entry("CROSS_SITE_SCRIPTING", XSS_REFLECTED),
            Map.entry("CMD_INJECTION", COMMAND_INJECTION),
            Map.entry("REDIRECT", OPEN_REDIRECT),
            Map.entry("CORS", CORS_MISCONFIG),
            Map.entry("HEADERS", SECURITY_HEADERS),
            Map.entry("SSL", SSL_TLS),
            Map.entry("TLS", SSL_TLS),
            Map.entry("CERTIFICATE", CERT_ISSUE),
            Map.entry("INFORMATION_DISCLOSURE", INFO_DISCLOSURE),
            Map.entry("SENSITIVE_FILES", SENSITIVE_FILE),
            Map.entry("DEFAULT_CREDS", DEFAULT_CREDENTIALS),
            Map.entry("EMAIL", EMAIL_SECURITY),
            Map.entry("COOKIE", COOKIE_SECURITY),
            Map.entry("COOKIES", COOKIE_SECURITY)
    );

    /**
     * Resolves an engine category. Returns null when nothing matches so callers can log the drift
     * before falling back to {@link #OTHER}.
     */
    public static VulnCategory resolve(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (VulnCategory category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return ALIASES.get(normalized);
    }
}
