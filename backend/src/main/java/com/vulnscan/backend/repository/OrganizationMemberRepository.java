package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.OrganizationMember;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface OrganizationMemberRepository extends JpaRepository<OrganizationMember, Long> {

    List<OrganizationMember> findByOrganizationId(Long organizationId);

    Optional<OrganizationMember> findFirstByOrganizationIdAndRoleOrderByIdAsc(Long organizationId,
                                                                             OrganizationMember.Role role);
}
