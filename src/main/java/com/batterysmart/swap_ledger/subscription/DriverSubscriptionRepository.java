package com.batterysmart.swap_ledger.subscription;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DriverSubscriptionRepository extends JpaRepository<DriverSubscriptionEntity, UUID> {

    /**
     * Active subscriptions still in their validity window, newest first.
     * More than one row means the one-active-subscription invariant is broken.
     */
    @Query("SELECT s FROM DriverSubscriptionEntity s WHERE s.driverId = :driverId " +
           "AND s.status = :status AND s.endDate >= :today " +
           "ORDER BY s.startDate DESC, s.createdAt DESC")
    List<DriverSubscriptionEntity> findCurrent(@Param("driverId") UUID driverId,
                                               @Param("status") SubscriptionStatus status,
                                               @Param("today") LocalDate today);

    /**
     * Same ordering as {@link #findCurrent}, ids only, so the caller can lock
     * the winning row without loading stale copies into the session first.
     */
    @Query("SELECT s.id FROM DriverSubscriptionEntity s WHERE s.driverId = :driverId " +
           "AND s.status = :status AND s.endDate >= :today " +
           "ORDER BY s.startDate DESC, s.createdAt DESC")
    List<UUID> findCurrentIds(@Param("driverId") UUID driverId,
                              @Param("status") SubscriptionStatus status,
                              @Param("today") LocalDate today);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DriverSubscriptionEntity s WHERE s.id = :id")
    Optional<DriverSubscriptionEntity> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DriverSubscriptionEntity s WHERE s.driverId = :driverId AND s.status = :status")
    List<DriverSubscriptionEntity> findByDriverIdAndStatusForUpdate(@Param("driverId") UUID driverId,
                                                                    @Param("status") SubscriptionStatus status);

    /**
     * Every subscription of the driver, in any status, that still has a
     * battery out. Newest first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DriverSubscriptionEntity s WHERE s.driverId = :driverId " +
           "AND s.batteryId IS NOT NULL AND s.batteryReturned = false " +
           "ORDER BY s.startDate DESC, s.createdAt DESC")
    List<DriverSubscriptionEntity> findHoldingBatteryForUpdate(@Param("driverId") UUID driverId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DriverSubscriptionEntity s WHERE s.driverId = :driverId " +
           "AND s.batteryId = :batteryId AND s.batteryReturned = false")
    List<DriverSubscriptionEntity> findHoldingBatteryForUpdate(@Param("driverId") UUID driverId,
                                                               @Param("batteryId") String batteryId);

    @Query("SELECT s.driverId FROM DriverSubscriptionEntity s WHERE s.id = :id")
    Optional<UUID> findDriverIdById(@Param("id") UUID id);

    Optional<DriverSubscriptionEntity> findFirstByDriverIdOrderByStartDateDescCreatedAtDesc(UUID driverId);

    @Query("SELECT s.id FROM DriverSubscriptionEntity s WHERE s.status = :status AND s.endDate < :date")
    List<UUID> findIdsByStatusAndEndDateBefore(@Param("status") SubscriptionStatus status,
                                               @Param("date") LocalDate date);

    /**
     * Subscriptions whose validity ended before {@code cutoff} while the
     * driver still holds the battery.
     */
    @Query("SELECT s.id FROM DriverSubscriptionEntity s WHERE s.batteryId IS NOT NULL " +
           "AND s.batteryReturned = false AND s.endDate < :cutoff")
    List<UUID> findUnreturnedEndedBefore(@Param("cutoff") LocalDate cutoff);
}
