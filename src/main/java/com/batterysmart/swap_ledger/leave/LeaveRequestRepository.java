package com.batterysmart.swap_ledger.leave;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequestEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LeaveRequestEntity l WHERE l.id = :id")
    Optional<LeaveRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT l.driverId FROM LeaveRequestEntity l WHERE l.id = :id")
    Optional<UUID> findDriverIdById(@Param("id") UUID id);

    /**
     * Requests in the given states whose inclusive date range intersects
     * [start, end].
     */
    @Query("SELECT COUNT(l) FROM LeaveRequestEntity l WHERE l.driverId = :driverId " +
           "AND l.status IN :statuses AND l.startDate <= :end AND l.endDate >= :start")
    long countOverlapping(@Param("driverId") UUID driverId,
                          @Param("statuses") Collection<LeaveStatus> statuses,
                          @Param("start") LocalDate start,
                          @Param("end") LocalDate end);

    List<LeaveRequestEntity> findByDriverIdAndStatusOrderByStartDateAsc(UUID driverId, LeaveStatus status);

    List<LeaveRequestEntity> findByDriverIdAndStatusAndEndDateGreaterThanEqualOrderByStartDateAsc(
        UUID driverId, LeaveStatus status, LocalDate date);

    long countByDriverIdAndStatus(UUID driverId, LeaveStatus status);
}
