package com.batterysmart.swap_ledger.driver;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DriverRepository extends JpaRepository<DriverEntity, UUID> {

    Optional<DriverEntity> findByPhoneNumber(String phoneNumber);

    /**
     * Serializes writers acting for the same driver (swaps, leave requests).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DriverEntity d WHERE d.id = :id")
    Optional<DriverEntity> findByIdForUpdate(@Param("id") UUID id);
}
