package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.CreateScanRequest;
import com.vulnscan.backend.dto.ScanDiff;
import com.vulnscan.backend.dto.ScanResponse;
import com.vulnscan.backend.exception.BadRequestException;
import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanProfile;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.TargetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Organization-scoped entry points behind the scans API.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanService {

    private final TargetRepository targetRepository;
    private final ScanRepository scanRepository;
    private final ScanRecordService scanRecordService;
    private final ScanDiffService scanDiffService;

    public ScanResponse createOnDemand(Long organizationId, Long userId, CreateScanRequest request) {
        Target target = targetRepository.findByIdAndOrganizationId(request.getTargetId(), organizationId)
                .orElseThrow(() -> new NotFoundException("Target not found"));
        if (!target.isActive()) {
            throw new BadRequestException("Target is not active");
        }
        if (target.getVerificationStatus() != Target.VerificationStatus.VERIFIED) {
            throw new BadRequestException("Target must be verified before scanning");
        }
        ScanProfile profile = request.getProfile() != null ? request.getProfile() : target.getScanProfile();
        List<String> requested = request.getModules();
        if (profile == ScanProfile.CUSTOM && (requested == null || requested.isEmpty())) {
            throw new BadRequestException("CUSTOM profile requires at least one module");
        }
        List<String> modules = profile.resolveModules(requested);
        Scan scan = scanRecordService.create(target, profile, modules, userId, Scan.Type.ON_DEMAND);
        return toResponse(scan);
    }

    public ScanResponse getScan(Long organizationId, Long scanId) {
        return toResponse(findScan(organizationId, scanId));
    }

    public ScanResponse cancel(Long organizationId, Long scanId) {
        findScan(organizationId, scanId);
        Scan cancelled = scanRecordService.cancel(scanId);
        log.info("Scan {} cancelled by operator", scanId);
        return toResponse(cancelled);
    }

    public ScanDiff diff(Long organizationId, Long scanId) {
        return scanDiffService.diff(findScan(organizationId, scanId));
    }

    private Scan findScan(Long organizationId, Long scanId) {
        return scanRepository.findById(scanId)
                .filter(scan -> scan.getOrganizationId().equals(organizationId))
                .orElseThrow(() -> new NotFoundException("Scan not found"));
    }

    static ScanResponse toResponse(Scan scan) {
        return ScanResponse.builder()
                .id(scan.getId())
                .targetId(scan.getTargetId())
                .type(scan.getType().name())
                .profile(scan.getProfile().name())
                .modules(scan.getModules())
                .status(scan.getStatus().name())
                .progress(scan.getProgress())
                .currentModule(scan.getCurrentModule())
                .createdAt(scan.getCreatedAt())
                .startedAt(scan.getStartedAt())
                .completedAt(scan.getCompletedAt())
                .durationSeconds(scan.getDurationSeconds())
                .errorMessage(scan.getErrorMessage())
                .totalAssets(scan.getTotalAssets())
                .newAssets(scan.getNewAssets())
                .totalVulns(scan.getTotalVulns())
                .criticalCount(scan.getCriticalCount())
                .highCount(scan.getHighCount())
                .mediumCount(scan.getMediumCount())
                .lowCount(scan.getLowCount())
                .infoCount(scan.getInfoCount())
                .build();
    }
}
