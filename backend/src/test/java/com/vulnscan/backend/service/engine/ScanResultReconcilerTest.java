package com.vulnscan.backend.service.engine;

import com.vulnscan.backend.event.ScanCompletedEvent;
import com.vulnscan.backend.event.ScanFailedEvent;
import com.vulnscan.backend.model.Asset;
import com.vulnscan.backend.model.Organization;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanProfile;
import com.vulnscan.backend.model.Severity;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.model.VulnCategory;
import com.vulnscan.backend.model.VulnFinding;
import com.vulnscan.backend.repository.AssetRepository;
import com.vulnscan.backend.repository.OrganizationRepository;
import com.vulnscan.backend.repository.ScanJobRepository;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.ScanResultRepository;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.repository.VulnFindingRepository;
import com.vulnscan.backend.service.MetricsService;
import com.vulnscan.backend.service.ScanOutcomeFanOut;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
class ScanResultReconcilerTest {

    @MockBean
    private ScanTaskPublisher scanTaskPublisher;

    @MockBean
    private ScanOutcomeFanOut scanOutcomeFanOut;

    @MockBean
    private MetricsService metricsService;

    @Autowired
    private ScanResultReconciler reconciler;

    @Autowired
    private ScanRepository scanRepository;

    @Autowired
    private ScanJobRepository scanJobRepository;

    @Autowired
    private ScanResultRepository scanResultRepository;

    @Autowired
    private VulnFindingRepository vulnFindingRepository;

    @Autowired
    private AssetRepository assetRepository;

    @Autowired
    private TargetRepository targetRepository;

    @Autowired
    private OrganizationRepository organizationRepository;

    private Target target;

    @BeforeEach
    void setup() {
        vulnFindingRepository.deleteAll();
        scanResultRepository.deleteAll();
        assetRepository.deleteAll();
        scanJobRepository.deleteAll();
        scanRepository.deleteAll();
        targetRepository.deleteAll();
        organizationRepository.deleteAll();

        Organization org = organizationRepository.save(Organization.builder().name("Acme").build());
        target = targetRepository.save(Target.builder()
                .organizationId(org.getId())
                .value("acme.example.com")
                .verificationStatus(Target.VerificationStatus.VERIFIED)
                .build());
    }

    @Test
    void completedResultPersistsFindingsAssetsAndFansOutOnce() {
        Scan scan = runningScan();

        ScanResultReconciler.Outcome outcome = reconciler.handle(completedPayload(scan.getId()));

        assertThat(outcome).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);
        Scan updated = scanRepository.findById(scan.getId()).orElseThrow();
        assertThat(updated.getStatus()).isEqualTo(Scan.Status.COMPLETED);
        assertThat(updated.getProgress()).isEqualTo(100);
        assertThat(updated.getCompletedAt()).isNotNull();
        assertThat(updated.getTotalVulns()).isEqualTo(2);
        assertThat(updated.getCriticalCount()).isEqualTo(1);
        assertThat(updated.getLowCount()).isEqualTo(1);
        assertThat(updated.getTotalAssets()).isEqualTo(1);
        assertThat(updated.getNewAssets()).isEqualTo(1);

        List<Asset> assets = assetRepository.findByTargetId(target.getId());
        assertThat(assets).hasSize(1);
        List<VulnFinding> findings = vulnFindingRepository.findByScanId(scan.getId());
        assertThat(findings).hasSize(2);
        assertThat(findings).extracting(VulnFinding::getSeverity)
                .containsExactlyInAnyOrder(Severity.CRITICAL, Severity.LOW);
        assertThat(scanResultRepository.existsByScanId(scan.getId())).isTrue();

        ArgumentCaptor<ScanCompletedEvent> captor = ArgumentCaptor.forClass(ScanCompletedEvent.class);
        verify(scanOutcomeFanOut, times(1)).onScanCompleted(captor.capture());
        assertThat(captor.getValue().hasCriticalOrHigh()).isTrue();
        assertThat(captor.getValue().notableFindings()).hasSize(1);
    }

    @Test
    void redeliveredCompletedResultIsIgnored() {
        Scan scan = runningScan();
        String payload = completedPayload(scan.getId());

        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);
        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.IGNORED);

        assertThat(vulnFindingRepository.countByScanId(scan.getId())).isEqualTo(2);
        assertThat(assetRepository.countByTargetId(target.getId())).isEqualTo(1);
        verify(scanOutcomeFanOut, times(1)).onScanCompleted(any());
    }

    @Test
    void resultForCancelledScanIsDiscarded() {
        Scan scan = runningScan();
        scan.setStatus(Scan.Status.CANCELLED);
        scan.setCompletedAt(Instant.now());
        scanRepository.save(scan);

        ScanResultReconciler.Outcome outcome = reconciler.handle(completedPayload(scan.getId()));

        assertThat(outcome).isEqualTo(ScanResultReconciler.Outcome.IGNORED);
        assertThat(scanRepository.findById(scan.getId()).orElseThrow().getStatus()).isEqualTo(Scan.Status.CANCELLED);
        assertThat(vulnFindingRepository.countByScanId(scan.getId())).isZero();
        verify(scanOutcomeFanOut, never()).onScanCompleted(any());
    }

    @Test
    void malformedMessagesAreDroppedWithoutSideEffects() {
        Scan scan = runningScan();

        assertThat(reconciler.handle("{not json")).isEqualTo(ScanResultReconciler.Outcome.DROPPED);
        assertThat(reconciler.handle("{\"status\":\"COMPLETED\"}")).isEqualTo(ScanResultReconciler.Outcome.DROPPED);
        assertThat(reconciler.handle("{\"scanId\":" + scan.getId() + ",\"status\":\"EXPLODED\"}"))
                .isEqualTo(ScanResultReconciler.Outcome.DROPPED);
        assertThat(reconciler.handle("{\"scanId\":" + scan.getId() + ",\"status\":\"PROGRESS\"}"))
                .isEqualTo(ScanResultReconciler.Outcome.DROPPED);

        assertThat(scanRepository.findById(scan.getId()).orElseThrow().getStatus()).isEqualTo(Scan.Status.RUNNING);
    }

    @Test
    void progressIsAppliedAndNeverGoesBackwards() {
        Scan scan = runningScan();

        assertThat(reconciler.handle(progressPayload(scan.getId(), 40, "ssl_check")))
                .isEqualTo(ScanResultReconciler.Outcome.PROGRESS_APPLIED);
        assertThat(reconciler.handle(progressPayload(scan.getId(), 25, "header_check")))
                .isEqualTo(ScanResultReconciler.Outcome.IGNORED);

        Scan updated = scanRepository.findById(scan.getId()).orElseThrow();
        assertThat(updated.getProgress()).isEqualTo(40);
        assertThat(updated.getCurrentModule()).isEqualTo("ssl_check");
    }

    @Test
    void unknownCategoryAndSeverityFallBack() {
        Scan scan = runningScan();
        String payload = "{\"scanId\":" + scan.getId() + ",\"status\":\"COMPLETED\",\"assets\":[]," +
                "\"findings\":[{\"title\":\"Strange thing\",\"severity\":\"apocalyptic\",\"category\":\"quantum_leak\"," +
                "\"affectedUrl\":\"https://acme.example.com/x\"}]}";

        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);

        VulnFinding finding = vulnFindingRepository.findByScanId(scan.getId()).get(0);
        assertThat(finding.getCategory()).isEqualTo(VulnCategory.OTHER);
        assertThat(finding.getSeverity()).isEqualTo(Severity.INFO);
    }

    @Test
    void engineFailureMarksScanFailed() {
        Scan scan = runningScan();

        ScanResultReconciler.Outcome outcome = reconciler.handle(
                "{\"scanId\":" + scan.getId() + ",\"status\":\"FAILED\",\"error\":\"DNS resolution failed\"}");

        assertThat(outcome).isEqualTo(ScanResultReconciler.Outcome.FAILED);
        Scan updated = scanRepository.findById(scan.getId()).orElseThrow();
        assertThat(updated.getStatus()).isEqualTo(Scan.Status.FAILED);
        assertThat(updated.getErrorMessage()).isEqualTo("DNS resolution failed");
        verify(scanOutcomeFanOut, times(1)).onScanFailed(any(ScanFailedEvent.class));
    }

    @Test
    void longAssetValuesAndCveListsAreStored() {
        Scan scan = runningScan();
        String longUrl = "https://acme.example.com/" + "a".repeat(1200);
        String oversizedUrl = "https://acme.example.com/" + "b".repeat(2500);
        String cves = "CVE-2021-44228, CVE-2021-45046, CVE-2021-45105";
        String payload = "{\"scanId\":" + scan.getId() + ",\"status\":\"COMPLETED\"," +
                "\"assets\":[{\"type\":\"url\",\"value\":\"" + longUrl + "\"}," +
                "{\"type\":\"url\",\"value\":\"" + oversizedUrl + "\"}]," +
                "\"findings\":[{\"title\":\"Log4Shell\",\"severity\":\"critical\",\"category\":\"rce\"," +
                "\"cveId\":\"" + cves + "\",\"affectedUrl\":\"" + longUrl + "\"}]}";

        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);

        assertThat(scanRepository.findById(scan.getId()).orElseThrow().getStatus()).isEqualTo(Scan.Status.COMPLETED);
        List<Asset> assets = assetRepository.findByTargetId(target.getId());
        assertThat(assets).extracting(Asset::getValue)
                .containsExactlyInAnyOrder(longUrl, oversizedUrl.substring(0, Asset.MAX_VALUE_LENGTH));
        Asset longAsset = assets.stream().filter(a -> a.getValue().equals(longUrl)).findFirst().orElseThrow();

        VulnFinding finding = vulnFindingRepository.findByScanId(scan.getId()).get(0);
        assertThat(finding.getCveId()).isEqualTo(cves);
        assertThat(finding.getAffectedUrl()).isEqualTo(longUrl);
        assertThat(finding.getAssetId()).isEqualTo(longAsset.getId());
    }

    @Test
    void assetSeenAgainOnLaterScanIsUpdatedNotDuplicated() {
        Scan first = runningScan();
        assertThat(reconciler.handle(completedPayload(first.getId()))).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);

        Asset existing = assetRepository.findByTargetId(target.getId()).get(0);
        Instant firstSeen = existing.getFirstSeenAt();
        Instant earlier = Instant.now().minus(1, ChronoUnit.DAYS);
        existing.setLastSeenAt(earlier);
        assetRepository.save(existing);

        Scan second = runningScan();
        assertThat(reconciler.handle(completedPayload(second.getId()))).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);

        List<Asset> assets = assetRepository.findByTargetId(target.getId());
        assertThat(assets).hasSize(1);
        assertThat(assets.get(0).getId()).isEqualTo(existing.getId());
        assertThat(assets.get(0).getLastSeenAt()).isAfter(earlier);
        assertThat(assets.get(0).getFirstSeenAt()).isEqualTo(firstSeen);

        Scan updated = scanRepository.findById(second.getId()).orElseThrow();
        assertThat(updated.getTotalAssets()).isEqualTo(1);
        assertThat(updated.getNewAssets()).isZero();
        assertThat(vulnFindingRepository.findByScanId(second.getId()))
                .extracting(VulnFinding::getAssetId)
                .contains(existing.getId());
    }

    @Test
    void failureWhileCompletingRollsBackAndRedeliveryCompletes() {
        Scan scan = runningScan();
        String payload = completedPayload(scan.getId());
        doThrow(new IllegalStateException("connection reset")).doNothing()
                .when(metricsService).incrementScansCompleted();

        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.ERROR);

        Scan afterFailure = scanRepository.findById(scan.getId()).orElseThrow();
        assertThat(afterFailure.getStatus()).isEqualTo(Scan.Status.RUNNING);
        assertThat(afterFailure.getCompletedAt()).isNull();
        assertThat(vulnFindingRepository.countByScanId(scan.getId())).isZero();
        assertThat(assetRepository.countByTargetId(target.getId())).isZero();
        assertThat(scanResultRepository.existsByScanId(scan.getId())).isFalse();
        verify(scanOutcomeFanOut, never()).onScanCompleted(any());

        assertThat(reconciler.handle(payload)).isEqualTo(ScanResultReconciler.Outcome.COMPLETED);

        Scan completed = scanRepository.findById(scan.getId()).orElseThrow();
        assertThat(completed.getStatus()).isEqualTo(Scan.Status.COMPLETED);
        assertThat(vulnFindingRepository.countByScanId(scan.getId())).isEqualTo(2);
        assertThat(assetRepository.countByTargetId(target.getId())).isEqualTo(1);
        verify(scanOutcomeFanOut, times(1)).onScanCompleted(any());
    }

    private Scan runningScan() {
        Instant now = Instant.now();
        return scanRepository.save(Scan.builder()
                .targetId(target.getId())
                .organizationId(target.getOrganizationId())
                .createdById(1L)
                .profile(ScanProfile.QUICK)
                .status(Scan.Status.RUNNING)
                .progress(10)
                .startedAt(now.minusSeconds(120))
                .createdAt(now.minusSeconds(130))
                .updatedAt(now)
                .build());
    }

    private static String completedPayload(Long scanId) {
        return "{\"scanId\":" + scanId + ",\"status\":\"COMPLETED\"," +
                "\"assets\":[{\"type\":\"subdomain\",\"value\":\"api.acme.example.com\"}," +
                "{\"type\":\"subdomain\",\"value\":\"api.acme.example.com\"}]," +
                "\"findings\":[" +
                "{\"title\":\"SQL injection in search\",\"severity\":\"critical\",\"category\":\"sqli\"," +
                "\"affectedUrl\":\"https://api.acme.example.com/search\"}," +
                "{\"title\":\"Missing X-Frame-Options\",\"severity\":\"low\",\"category\":\"security_headers\"," +
                "\"affectedComponent\":\"https://api.acme.example.com\"}]}";
    }

    private static String progressPayload(Long scanId, int progress, String module) {
        return "{\"scanId\":" + scanId + ",\"status\":\"PROGRESS\",\"progress\":" + progress +
                ",\"currentModule\":\"" + module + "\"}";
    }
}
