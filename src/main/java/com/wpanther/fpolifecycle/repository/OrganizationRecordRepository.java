package com.wpanther.fpolifecycle.repository;

import com.wpanther.fpolifecycle.entity.FpoStatus;
import com.wpanther.fpolifecycle.entity.OrganizationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrganizationRecordRepository extends JpaRepository<OrganizationRecord, String> {

    /**
     * Find a record that has not been erased
     */
    Optional<OrganizationRecord> findByIdAndDeletedAtIsNull(String id);

    /**
     * Registration numbers are unique among live records
     */
    boolean existsByRegistrationNumberAndDeletedAtIsNull(String registrationNumber);

    Optional<OrganizationRecord> findByAaaOrgIdAndDeletedAtIsNull(String aaaOrgId);

    /**
     * Includes erased records, which keep their AAA organization id
     */
    boolean existsByAaaOrgId(String aaaOrgId);

    /**
     * Failed setups that are still below the attempt cap and past their backoff
     */
    List<OrganizationRecord> findByStatusAndSetupAttemptsLessThanAndLastSetupAtBeforeAndDeletedAtIsNull(
            FpoStatus status, int setupAttempts, Instant lastSetupAt);
}
