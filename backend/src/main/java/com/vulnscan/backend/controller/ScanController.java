package com.vulnscan.backend.controller;

import com.vulnscan.backend.config.RequestCorrelationFilter;
import com.vulnscan.backend.dto.CreateScanRequest;
import com.vulnscan.backend.dto.ScanDiff;
import com.vulnscan.backend.dto.ScanResponse;
import com.vulnscan.backend.service.ScanService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/scans")
@RequiredArgsConstructor
@Tag(name = "Scans")
public class ScanController {

    static final String ORG_HEADER = RequestCorrelationFilter.ORGANIZATION_HEADER;
    static final String USER_HEADER = RequestCorrelationFilter.USER_HEADER;

    private final ScanService scanService;

    @PostMapping
    @Operation(summary = "Queue an on-demand scan for a verified target")
    @ApiResponse(responseCode = "201", description = "Scan queued")
    @ApiResponse(responseCode = "403", description = "Monthly scan quota exhausted")
    @ApiResponse(responseCode = "409", description = "A scan is already queued or running for the target")
    public ResponseEntity<ScanResponse> create(@RequestHeader(ORG_HEADER) Long organizationId,
                                               @RequestHeader(USER_HEADER) Long userId,
                                               @Valid @RequestBody CreateScanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scanService.createOnDemand(organizationId, userId, request));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get scan status and counts")
    public ResponseEntity<ScanResponse> get(@RequestHeader(ORG_HEADER) Long organizationId, @PathVariable Long id) {
        return ResponseEntity.ok(scanService.getScan(organizationId, id));
    }

    @PostMapping("/{id}/cancel")
    @Operation(summary = "Cancel a queued or running scan")
    @ApiResponse(responseCode = "409", description = "Scan already finished")
    public ResponseEntity<ScanResponse> cancel(@RequestHeader(ORG_HEADER) Long organizationId, @PathVariable Long id) {
        return ResponseEntity.ok(scanService.cancel(organizationId, id));
    }

    @GetMapping("/{id}/diff")
    @Operation(summary = "Compare with the previous completed scan of the same target")
    public ResponseEntity<ScanDiff> diff(@RequestHeader(ORG_HEADER) Long organizationId, @PathVariable Long id) {
        return ResponseEntity.ok(scanService.diff(organizationId, id));
    }
}
