package com.vulnscan.backend.repository;

import com.vulnscan.backend.model.Asset;
import com.vulnscan.backend.model.AssetType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AssetRepository extends JpaRepository<Asset, Long> {

    Optional<Asset> findByTargetIdAndTypeAndValue(Long targetId, AssetType type, String value);

    List<Asset> findByTargetId(Long targetId);

    long countByTargetId(Long targetId);
}
