package com.batterysmart.swap_ledger.driver;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the drivers table. Rows are created through
 * {@link DriverService#register} (insert-if-absent by phone number).
 */
@Entity
@Table(name = "drivers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DriverEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "phone_number", nullable = false, updatable = false, length = 15)
    private String phoneNumber;

    @Column(name = "name", length = 100)
    private String name;

    @Column(name = "email")
    private String email;

    @Column(name = "preferred_language", nullable = false, length = 10)
    private String preferredLanguage;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "vehicle_number", length = 20)
    private String vehicleNumber;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Driver toDomain() {
        return new Driver(
            id,
            phoneNumber,
            name,
            email,
            Language.fromCode(preferredLanguage),
            city,
            vehicleNumber,
            active,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only language, active flag and updated_at change after registration.
     */
    void updateFromDomain(Driver driver) {
        this.preferredLanguage = driver.getPreferredLanguage().getCode();
        this.active = driver.isActive();
        this.updatedAt = driver.getUpdatedAt();
    }
}
