package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface OrganizationRepository extends JpaRepository<Organization, Long> {

    /**
     * Increments usage only while it is below the limit. Returns the number of rows updated (0 or 1).
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Organization o SET o.scansUsed = o.scansUsed + 1 WHERE o.id = :id AND o.scansUsed < :limit")
    int incrementUsageBelowLimit(@Param("id") Long id, @Param("limit") int limit);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Organization o SET o.scansUsed = o.scansUsed + 1 WHERE o.id = :id")
    int incrementUsage(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query("UPDATE Organization o SET o.scansUsed = 0 WHERE o.scansUsed <> 0")
    int resetAllUsage();
}
