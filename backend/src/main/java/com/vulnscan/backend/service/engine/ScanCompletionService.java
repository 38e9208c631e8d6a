package com.vulnscan.backend.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.dto.ScanUpdate;
import com.vulnscan.backend.event.ScanCompletedEvent;
import com.vulnscan.backend.event.ScanFailedEvent;
import com.vulnscan.backend.model.Asset;
import com.vulnscan.backend.model.AssetType;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanResult;
import com.vulnscan.backend.model.Severity;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.model.VulnCategory;
import com.vulnscan.backend.model.VulnFinding;
import com.vulnscan.backend.repository.AssetRepository;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.ScanResultRepository;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.repository.VulnFindingRepository;
import com.vulnscan.backend.service.MetricsService;
import com.vulnscan.backend.service.ScanRecordService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies terminal engine results. Each call is one transaction: either every asset, finding, the
 * result snapshot and the status change are written, or none are.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanCompletionService {

    static final String DEFAULT_ENGINE_ERROR = "Scanner engine error";
    private static final int MAX_NOTABLE_FINDINGS = 20;
    private static final int MAX_AFFECTED_URL_LENGTH = 2000;

    private final ScanRepository scanRepository;
    private final TargetRepository targetRepository;
    private final AssetRepository assetRepository;
    private final VulnFindingRepository vulnFindingRepository;
    private final ScanResultRepository scanResultRepository;
    private final ScanRecordService scanRecordService;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;

    /**
     * Persists a COMPLETED result. Empty when the scan is unknown or no longer RUNNING, which covers
     * redelivered messages and results that arrive after a cancel.
     */
    @Transactional
    public Optional<ScanCompletedEvent> complete(EngineResultMessage message, String rawPayload) {
        Scan scan = scanRepository.findByIdForUpdate(message.getScanId()).orElse(null);
        if (scan == null) {
            log.warn("COMPLETED result for unknown scan {}", message.getScanId());
            return Optional.empty();
        }
        if (scan.getStatus() != Scan.Status.RUNNING) {
            log.info("Discarding COMPLETED result for scan {} in status {}", scan.getId(), scan.getStatus());
            return Optional.empty();
        }

        Instant now = Instant.now();
        AssetUpsert assets = upsertAssets(scan, message.getAssets(), now);
        List<VulnFinding> findings = buildFindings(scan, message.getFindings(), assets.byValue(), now);
        vulnFindingRepository.saveAll(findings);

        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (VulnFinding finding : findings) {
            counts.merge(finding.getSeverity(), 1, Integer::sum);
        }

        scanResultRepository.save(ScanResult.builder()
                .scanId(scan.getId())
                .resultData(rawPayload)
                .assetsFound(assets.byKey().size())
                .vulnsFound(findings.size())
                .createdAt(now)
                .build());

        scan.setTotalAssets(assets.byKey().size());
        scan.setNewAssets(assets.created());
        scan.setTotalVulns(findings.size());
        scan.setCriticalCount(counts.getOrDefault(Severity.CRITICAL, 0));
        scan.setHighCount(counts.getOrDefault(Severity.HIGH, 0));
        scan.setMediumCount(counts.getOrDefault(Severity.MEDIUM, 0));
        scan.setLowCount(counts.getOrDefault(Severity.LOW, 0));
        scan.setInfoCount(counts.getOrDefault(Severity.INFO, 0));
        scanRecordService.applyTransition(scan, Scan.Status.COMPLETED, ScanUpdate.completed(now));

        log.info("Scan {} results saved assets={} newAssets={} findings={} critical={} high={}",
                scan.getId(), scan.getTotalAssets(), scan.getNewAssets(), scan.getTotalVulns(),
                scan.getCriticalCount(), scan.getHighCount());

        List<ScanCompletedEvent.FindingSnapshot> notable = findings.stream()
                .filter(f -> f.getSeverity().isAlertWorthy())
                .sorted(Comparator.comparingInt((VulnFinding f) -> f.getSeverity().getRank()).reversed())
                .limit(MAX_NOTABLE_FINDINGS)
                .map(f -> new ScanCompletedEvent.FindingSnapshot(f.getTitle(), f.getSeverity(),
                        f.getCategory(), f.getAffectedUrl()))
                .toList();

        return Optional.of(new ScanCompletedEvent(scan.getId(), scan.getTargetId(), scan.getOrganizationId(),
                targetValue(scan), scan.getCreatedById(), counts, findings.size(), scan.getTotalAssets(),
                scan.getNewAssets(), notable, now));
    }

    /**
     * Applies an engine FAILED report to a RUNNING scan.
     */
    @Transactional
    public Optional<ScanFailedEvent> fail(Long scanId, String error) {
        Scan scan = scanRepository.findByIdForUpdate(scanId).orElse(null);
        if (scan == null) {
            log.warn("FAILED result for unknown scan {}", scanId);
            return Optional.empty();
        }
        if (scan.getStatus() != Scan.Status.RUNNING) {
            log.info("Discarding FAILED result for scan {} in status {}", scanId, scan.getStatus());
            return Optional.empty();
        }
        Instant now = Instant.now();
        String message = error == null || error.isBlank() ? DEFAULT_ENGINE_ERROR : error;
        scanRecordService.applyTransition(scan, Scan.Status.FAILED, ScanUpdate.failed(now, message));
        log.error("Scan {} failed in engine: {}", scanId, message);
        return Optional.of(new ScanFailedEvent(scan.getId(), scan.getTargetId(), scan.getOrganizationId(),
                targetValue(scan), scan.getCreatedById(), scan.getErrorMessage(), now));
    }

    private AssetUpsert upsertAssets(Scan scan, List<EngineAsset> incoming, Instant now) {
        Map<String, Asset> byKey = new LinkedHashMap<>();
        Map<String, Asset> byValue = new LinkedHashMap<>();
        int created = 0;
        if (incoming == null) {
            return new AssetUpsert(byKey, byValue, 0);
        }
        for (EngineAsset engineAsset : incoming) {
            if (engineAsset == null || engineAsset.getValue() == null || engineAsset.getValue().isBlank()) {
                continue;
            }
            Optional<AssetType> type = AssetType.fromEngine(engineAsset.getType());
            if (type.isEmpty()) {
                log.warn("Skipping asset with unknown type '{}' on scan {}", engineAsset.getType(), scan.getId());
                continue;
            }
            String value = truncate(engineAsset.getValue().trim(), Asset.MAX_VALUE_LENGTH);
            String key = type.get() + "|" + value;
            if (byKey.containsKey(key)) {
                continue;
            }
            Asset asset = assetRepository.findByTargetIdAndTypeAndValue(scan.getTargetId(), type.get(), value)
                    .orElse(null);
            if (asset == null) {
                asset = Asset.builder()
                        .targetId(scan.getTargetId())
                        .type(type.get())
                        .value(value)
                        .firstSeenAt(now)
                        .build();
                created++;
            }
            asset.setLastSeenAt(now);
            String metadata = writeMetadata(engineAsset.getMetadata());
            if (metadata != null) {
                asset.setMetadata(metadata);
            }
            asset = assetRepository.save(asset);
            byKey.put(key, asset);
            byValue.putIfAbsent(value, asset);
        }
        return new AssetUpsert(byKey, byValue, created);
    }

    private List<VulnFinding> buildFindings(Scan scan, List<EngineFinding> incoming,
                                            Map<String, Asset> assetsByValue, Instant now) {
        List<VulnFinding> findings = new ArrayList<>();
        if (incoming == null) {
            return findings;
        }
        for (EngineFinding engineFinding : incoming) {
            if (engineFinding == null) {
                continue;
            }
            String title = engineFinding.getTitle() == null || engineFinding.getTitle().isBlank()
                    ? "Untitled finding" : engineFinding.getTitle();
            String affectedUrl = engineFinding.resolveAffectedUrl();
            if (affectedUrl != null) {
                affectedUrl = truncate(affectedUrl, MAX_AFFECTED_URL_LENGTH);
            }
            Asset asset = affectedUrl == null ? null : assetsByValue.get(affectedUrl);
            findings.add(VulnFinding.builder()
                    .scanId(scan.getId())
                    .targetId(scan.getTargetId())
                    .assetId(asset == null ? null : asset.getId())
                    .title(truncate(title, 500))
                    .description(engineFinding.getDescription())
                    .severity(mapSeverity(scan.getId(), engineFinding.getSeverity()))
                    .cvssScore(engineFinding.getCvssScore())
                    .category(mapCategory(scan.getId(), engineFinding.getCategory()))
                    .cveId(engineFinding.getCveId())
                    .affectedUrl(affectedUrl)
                    .evidence(engineFinding.getEvidence())
                    .remediation(engineFinding.getSolution())
                    .references(engineFinding.getReferences() == null
                            ? new ArrayList<>() : new ArrayList<>(engineFinding.getReferences()))
                    .firstFoundAt(now)
                    .lastFoundAt(now)
                    .build());
        }
        return findings;
    }

    Severity mapSeverity(Long scanId, String raw) {
        Severity severity = Severity.fromString(raw);
        if (severity == null) {
            log.warn("Unknown severity '{}' on scan {}, recording as INFO", raw, scanId);
            return Severity.INFO;
        }
        return severity;
    }

    VulnCategory mapCategory(Long scanId, String raw) {
        VulnCategory category = VulnCategory.resolve(raw);
        if (category == null) {
            log.warn("Unknown vulnerability category '{}' on scan {}, recording as OTHER", raw, scanId);
            metricsService.incrementUnknownCategory();
            return VulnCategory.OTHER;
        }
        return category;
    }

    private String targetValue(Scan scan) {
        return targetRepository.findById(scan.getTargetId()).map(Target::getValue).orElse(null);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unserializable asset metadata: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }

    private record AssetUpsert(Map<String, Asset> byKey, Map<String, Asset> byValue, int created) {
    }
}
