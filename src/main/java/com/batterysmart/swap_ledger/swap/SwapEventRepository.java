package com.batterysmart.swap_ledger.swap;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SwapEventRepository extends JpaRepository<SwapEventEntity, UUID> {

    Optional<SwapEventEntity> findByIdempotencyKey(String idempotencyKey);

    @Query("SELECT s.id FROM SwapEventEntity s WHERE s.idempotencyKey = :key")
    Optional<UUID> findIdByIdempotencyKey(@Param("key") String idempotencyKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SwapEventEntity s WHERE s.id = :id")
    Optional<SwapEventEntity> findByIdForUpdate(@Param("id") UUID id);

    long countByDriverId(UUID driverId);
}
