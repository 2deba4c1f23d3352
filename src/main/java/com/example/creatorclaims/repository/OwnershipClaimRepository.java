package com.example.creatorclaims.repository;

import com.example.creatorclaims.domain.OwnershipClaim;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface OwnershipClaimRepository extends JpaRepository<OwnershipClaim, String> {

    /**
     * Loads a claim row and holds a write lock on it until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM OwnershipClaim c WHERE c.videoFingerprint = :fingerprint")
    Optional<OwnershipClaim> findForUpdate(@Param("fingerprint") String fingerprint);
}
