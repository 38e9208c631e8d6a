package com.vulnscan.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Field changes applied together with a scan status transition. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanUpdate {

    private Instant startedAt;
    private Instant completedAt;
    private Integer progress;
    private String errorMessage;

    public static ScanUpdate none() {
        return new ScanUpdate();
    }

    public static ScanUpdate started(Instant now) {
        return ScanUpdate.builder().startedAt(now).progress(0).build();
    }

    public static ScanUpdate completed(Instant now) {
        return ScanUpdate.builder().completedAt(now).progress(100).build();
    }

    public static ScanUpdate failed(Instant now, String errorMessage) {
        return ScanUpdate.builder().completedAt(now).errorMessage(errorMessage).build();
    }

    public static ScanUpdate cancelled(Instant now) {
        return ScanUpdate.builder().completedAt(now).build();
    }
}
