package com.vulnscan.backend.model;

import java.util.List;

/**
 * Named bundles of engine modules. CUSTOM carries no default modules; the caller supplies them.
 */
public enum ScanProfile {
    QUICK(300, List.of(
            "header_check", "ssl_check", "sensitive_files", "port_scan_top20")),
    STANDARD(1200, List.of(
            "subdomain_enum", "port_scan_top100", "tech_detect", "header_check", "ssl_check",
            "cors_check", "cookie_check", "sensitive_files", "directory_listing", "sqli_scan",
            "xss_scan", "open_redirect", "email_security")),
    DEEP(3600, List.of(
            "subdomain_enum", "subdomain_bruteforce", "port_scan_full", "tech_detect", "header_check",
            "ssl_check", "cors_check", "cookie_check", "sensitive_files", "directory_enum",
            "directory_listing", "sqli_scan", "xss_scan", "ssrf_scan", "path_traversal",
            "open_redirect", "http_methods", "info_disclosure", "email_security", "service_version")),
    CUSTOM(0, List.of());

    private final int estimatedDurationSeconds;
    private final List<String> modules;

    ScanProfile(int estimatedDurationSeconds, List<String> modules) {
        this.estimatedDurationSeconds = estimatedDurationSeconds;
        this.modules = modules;
    }

    public int getEstimatedDurationSeconds() {
        return estimatedDurationSeconds;
    }

    public List<String> getModules() {
        return modules;
    }

    public List<String> resolveModules(List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            return List.copyOf(requested);
        }
        return modules;
    }
}
