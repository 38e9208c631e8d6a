package com.vulnscan.backend.service;

import com.vulnscan.backend.dto.DiffFinding;
import com.vulnscan.backend.dto.ScanDiff;
import com.vulnscan.backend.exception.BadRequestException;
import com.vulnscan.backend.exception.NotFoundException;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.model.VulnFinding;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.repository.VulnFindingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares a completed scan with the previous completed scan of the same target. Findings are matched
 * by fingerprint, never by row id.
 */
@Service
@RequiredArgsConstructor
public class ScanDiffService {

    static final String NO_PREVIOUS = "No previous scan to compare";

    private final ScanRepository scanRepository;
    private final TargetRepository targetRepository;
    private final VulnFindingRepository vulnFindingRepository;

    @Transactional(readOnly = true)
    public ScanDiff diff(Long scanId) {
        Scan current = scanRepository.findById(scanId)
                .orElseThrow(() -> new NotFoundException("Scan not found"));
        return diff(current);
    }

    @Transactional(readOnly = true)
    public ScanDiff diff(Scan current) {
        if (current.getStatus() != Scan.Status.COMPLETED || current.getCompletedAt() == null) {
            throw new BadRequestException("Scan must be completed to compute a diff");
        }
        String targetValue = targetRepository.findById(current.getTargetId()).map(Target::getValue).orElse(null);
        List<VulnFinding> currentFindings = vulnFindingRepository.findByScanId(current.getId());

        Scan previous = scanRepository
                .findFirstByTargetIdAndStatusAndCompletedAtBeforeAndIdNotOrderByCompletedAtDesc(
                        current.getTargetId(), Scan.Status.COMPLETED, current.getCompletedAt(), current.getId())
                .orElse(null);
        if (previous == null) {
            return ScanDiff.builder()
                    .currentScanId(current.getId())
                    .targetId(current.getTargetId())
                    .targetValue(targetValue)
                    .hasPrevious(false)
                    .message(NO_PREVIOUS)
                    .summary(ScanDiff.Summary.builder()
                            .currentTotal(currentFindings.size())
                            .build())
                    .newFindings(List.of())
                    .fixedFindings(List.of())
                    .build();
        }

        ScanDiff diff = compare(currentFindings, vulnFindingRepository.findByScanId(previous.getId()));
        diff.setCurrentScanId(current.getId());
        diff.setPreviousScanId(previous.getId());
        diff.setTargetId(current.getTargetId());
        diff.setTargetValue(targetValue);
        return diff;
    }

    /**
     * New = current findings whose fingerprint is absent from previous; fixed = the reverse;
     * unchanged = current findings that are not new.
     */
    public static ScanDiff compare(List<VulnFinding> current, List<VulnFinding> previous) {
        Set<String> previousKeys = previous.stream().map(ScanDiffService::fingerprint).collect(Collectors.toSet());
        Set<String> currentKeys = current.stream().map(ScanDiffService::fingerprint).collect(Collectors.toSet());

        List<DiffFinding> added = current.stream()
                .filter(f -> !previousKeys.contains(fingerprint(f)))
                .map(ScanDiffService::toDiffFinding)
                .toList();
        List<DiffFinding> fixed = previous.stream()
                .filter(f -> !currentKeys.contains(fingerprint(f)))
                .map(ScanDiffService::toDiffFinding)
                .toList();

        return ScanDiff.builder()
                .hasPrevious(true)
                .summary(ScanDiff.Summary.builder()
                        .currentTotal(current.size())
                        .previousTotal(previous.size())
                        .newCount(added.size())
                        .fixedCount(fixed.size())
                        .unchanged(current.size() - added.size())
                        .build())
                .newFindings(added)
                .fixedFindings(fixed)
                .build();
    }

    public static String fingerprint(VulnFinding finding) {
        String category = finding.getCategory() == null ? "" : finding.getCategory().name();
        String url = finding.getAffectedUrl() == null ? "" : finding.getAffectedUrl();
        return finding.getTitle() + "|" + category + "|" + url;
    }

    private static DiffFinding toDiffFinding(VulnFinding finding) {
        return DiffFinding.builder()
                .id(finding.getId())
                .title(finding.getTitle())
                .severity(finding.getSeverity() == null ? null : finding.getSeverity().name())
                .category(finding.getCategory() == null ? null : finding.getCategory().name())
                .affectedUrl(finding.getAffectedUrl())
                .fingerprint(fingerprint(finding))
                .build();
    }
}
