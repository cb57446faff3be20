package com.wpanther.fpolifecycle.repository;

import com.wpanther.fpolifecycle.entity.AuditLogEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogEntryRepository extends JpaRepository<AuditLogEntry, Long> {

    /**
     * Ledger of one organization, oldest first
     */
    Page<AuditLogEntry> findByOrganizationIdOrderByPerformedAtAscIdAsc(String organizationId, Pageable pageable);

    List<AuditLogEntry> findByOrganizationIdOrderByPerformedAtAscIdAsc(String organizationId);

    long countByOrganizationId(String organizationId);
}
