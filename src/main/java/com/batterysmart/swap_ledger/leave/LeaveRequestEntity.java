package com.batterysmart.swap_ledger.leave;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "driver_leaves")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LeaveRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "driver_id", nullable = false, updatable = false)
    private UUID driverId;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false, updatable = false)
    private LocalDate endDate;

    @Column(updatable = false)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LeaveStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "processed_by", length = 100)
    private String processedBy;

    static LeaveRequestEntity fromDomain(LeaveRequest request) {
        return new LeaveRequestEntity(
            request.getId(),
            request.getDriverId(),
            request.getStartDate(),
            request.getEndDate(),
            request.getReason(),
            request.getStatus(),
            request.getCreatedAt(),
            request.getProcessedAt(),
            request.getProcessedBy()
        );
    }

    public LeaveRequest toDomain() {
        return new LeaveRequest(id, driverId, startDate, endDate, reason, status, createdAt, processedAt, processedBy);
    }

    void updateFromDomain(LeaveRequest request) {
        this.status = request.getStatus();
        this.processedAt = request.getProcessedAt();
        this.processedBy = request.getProcessedBy();
    }
}
