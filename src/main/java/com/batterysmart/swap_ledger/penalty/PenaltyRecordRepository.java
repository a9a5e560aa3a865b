package com.batterysmart.swap_ledger.penalty;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PenaltyRecordRepository extends JpaRepository<PenaltyRecordEntity, UUID> {

    Optional<PenaltyRecordEntity> findBySubscriptionIdAndReason(UUID subscriptionId, PenaltyReason reason);

    List<PenaltyRecordEntity> findByDriverIdOrderByCreatedAtDesc(UUID driverId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PenaltyRecordEntity p WHERE p.id = :id")
    Optional<PenaltyRecordEntity> findByIdForUpdate(@Param("id") UUID id);
}
