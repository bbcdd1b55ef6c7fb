package com.leaflog.repository;

import com.leaflog.model.NftMetadata;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NftMetadataRepository extends JpaRepository<NftMetadata, String> {
}
