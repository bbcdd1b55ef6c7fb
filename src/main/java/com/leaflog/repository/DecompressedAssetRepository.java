package com.leaflog.repository;

import com.leaflog.model.DecompressedAsset;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DecompressedAssetRepository extends JpaRepository<DecompressedAsset, String> {
}
