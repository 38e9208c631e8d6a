package com.vulnscan.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vulnscan.backend.dto.CreateScanRequest;
import com.vulnscan.backend.model.Organization;
import com.vulnscan.backend.model.Scan;
import com.vulnscan.backend.model.ScanProfile;
import com.vulnscan.backend.model.Target;
import com.vulnscan.backend.repository.OrganizationRepository;
import com.vulnscan.backend.repository.ScanJobRepository;
import com.vulnscan.backend.repository.ScanRepository;
import com.vulnscan.backend.repository.TargetRepository;
import com.vulnscan.backend.service.engine.ScanTaskPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ScanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScanTaskPublisher scanTaskPublisher;

    @Autowired
    private OrganizationRepository organizationRepository;

    @Autowired
    private TargetRepository targetRepository;

    @Autowired
    private ScanRepository scanRepository;

    @Autowired
    private ScanJobRepository scanJobRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Organization org;
    private Organization otherOrg;
    private Target verified;

    @BeforeEach
    void setup() {
        scanJobRepository.deleteAll();
        scanRepository.deleteAll();
        targetRepository.deleteAll();
        organizationRepository.deleteAll();

        org = organizationRepository.save(Organization.builder().name("Acme").build());
        otherOrg = organizationRepository.save(Organization.builder().name("Globex").build());
        verified = targetRepository.save(Target.builder()
                .organizationId(org.getId())
                .value("acme.example.com")
                .verificationStatus(Target.VerificationStatus.VERIFIED)
                .build());
    }

    @Test
    void createReturns201AndQueuesScan() throws Exception {
        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, org.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(verified.getId(), ScanProfile.QUICK)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.targetId").value(verified.getId()))
                .andExpect(jsonPath("$.profile").value("QUICK"))
                .andExpect(jsonPath("$.type").value("ON_DEMAND"));

        assertThat(scanRepository.countByTargetIdAndStatusIn(verified.getId(), Scan.Status.inFlight())).isEqualTo(1);
    }

    @Test
    void targetOfAnotherOrganizationIsNotFound() throws Exception {
        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, otherOrg.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(verified.getId(), ScanProfile.QUICK)))
                .andExpect(status().isNotFound());
    }

    @Test
    void secondScanWhileInFlightIsConflict() throws Exception {
        Instant now = Instant.now();
        scanRepository.save(Scan.builder()
                .targetId(verified.getId())
                .organizationId(org.getId())
                .createdById(7L)
                .profile(ScanProfile.QUICK)
                .status(Scan.Status.QUEUED)
                .createdAt(now)
                .updatedAt(now)
                .build());

        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, org.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(verified.getId(), ScanProfile.QUICK)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value(409));
    }

    @Test
    void exhaustedQuotaIsForbidden() throws Exception {
        org.setMaxScansPerMonth(2);
        org.setScansUsed(2);
        organizationRepository.save(org);

        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, org.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(verified.getId(), ScanProfile.QUICK)))
                .andExpect(status().isForbidden());

        assertThat(scanRepository.count()).isZero();
        assertThat(organizationRepository.findById(org.getId()).orElseThrow().getScansUsed()).isEqualTo(2);
    }

    @Test
    void unverifiedTargetAndEmptyCustomProfileAreBadRequests() throws Exception {
        Target pending = targetRepository.save(Target.builder()
                .organizationId(org.getId())
                .value("pending.example.com")
                .build());

        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, org.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(pending.getId(), ScanProfile.QUICK)))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/scans")
                        .header(ScanController.ORG_HEADER, org.getId())
                        .header(ScanController.USER_HEADER, 7L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(verified.getId(), ScanProfile.CUSTOM)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingOrganizationHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/scans/1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void cancelFinishedScanIsConflict() throws Exception {
        Instant now = Instant.now();
        Scan done = scanRepository.save(Scan.builder()
                .targetId(verified.getId())
                .organizationId(org.getId())
                .createdById(7L)
                .profile(ScanProfile.QUICK)
                .status(Scan.Status.COMPLETED)
                .progress(100)
                .completedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build());

        mockMvc.perform(post("/api/scans/" + done.getId() + "/cancel")
                        .header(ScanController.ORG_HEADER, org.getId()))
                .andExpect(status().isConflict());
    }

    @Test
    void diffWithoutPreviousScanReportsNoPrevious() throws Exception {
        Instant now = Instant.now();
        Scan done = scanRepository.save(Scan.builder()
                .targetId(verified.getId())
                .organizationId(org.getId())
                .createdById(7L)
                .profile(ScanProfile.QUICK)
                .status(Scan.Status.COMPLETED)
                .progress(100)
                .completedAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build());

        mockMvc.perform(get("/api/scans/" + done.getId() + "/diff")
                        .header(ScanController.ORG_HEADER, org.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hasPrevious").value(false))
                .andExpect(jsonPath("$.message").value("No previous scan to compare"));
    }

    private String body(Long targetId, ScanProfile profile) throws Exception {
        return objectMapper.writeValueAsString(CreateScanRequest.builder()
                .targetId(targetId)
                .profile(profile)
                .modules(List.of())
                .build());
    }
}
