package com.leaflog.repository;

import com.leaflog.model.LeafSchemaRecord;
import com.leaflog.model.LeafSchemaRecordId;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LeafSchemaRecordRepository extends JpaRepository<LeafSchemaRecord, LeafSchemaRecordId> {
}
