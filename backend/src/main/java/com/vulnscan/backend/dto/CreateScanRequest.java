package com.vulnscan.backend.dto;

import com.vulnscan.backend.model.ScanProfile;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScanRequest {

    @NotNull
    private Long targetId;

    private ScanProfile profile;

    @Size(max = 50)
    private List<String> modules;
}
