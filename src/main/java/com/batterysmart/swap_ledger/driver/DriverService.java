package com.batterysmart.swap_ledger.driver;

import com.batterysmart.swap_ledger.config.TransactionLockTimeout;
import com.batterysmart.swap_ledger.exception.ConflictException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.UUID;

/**
 * Driver lookup and registration.
 *
 * Inactive drivers are invisible to every lookup: the ledger treats them as
 * not found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriverService {

    private final DriverRepository driverRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionLockTimeout lockTimeout;
    private final Clock clock;

    /**
     * Looks up an active driver by phone number in any common notation.
     *
     * @throws com.batterysmart.swap_ledger.exception.InvalidInputException if the number is malformed
     * @throws NotFoundException if no active driver owns the number
     */
    @Transactional(readOnly = true)
    public Driver getDriver(String phoneNumber) {
        String normalized = PhoneNumbers.normalize(phoneNumber);
        return driverRepository.findByPhoneNumber(normalized)
            .map(DriverEntity::toDomain)
            .filter(Driver::isActive)
            .orElseThrow(() -> new NotFoundException("Driver", normalized));
    }

    @Transactional(readOnly = true)
    public Driver getDriver(UUID driverId) {
        return driverRepository.findById(driverId)
            .map(DriverEntity::toDomain)
            .filter(Driver::isActive)
            .orElseThrow(() -> new NotFoundException("Driver", driverId));
    }

    /**
     * Registers a driver, or returns the existing one when the phone number
     * is already known. Safe under concurrent registration of the same number.
     */
    @Transactional
    public RegistrationResult register(String phoneNumber, String name, String email,
                                       String languageCode, String city, String vehicleNumber) {
        String normalized = PhoneNumbers.normalize(phoneNumber);
        Language language = Language.fromCode(languageCode);
        Timestamp now = Timestamp.from(clock.instant());

        int inserted = jdbcTemplate.update(
            "INSERT INTO drivers (id, phone_number, name, email, preferred_language, city, vehicle_number, " +
            "is_active, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, TRUE, ?, ?) " +
            "ON CONFLICT (phone_number) DO NOTHING",
            UUID.randomUUID(), normalized, name, email, language.getCode(), city, vehicleNumber, now, now
        );

        Driver driver = driverRepository.findByPhoneNumber(normalized)
            .map(DriverEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException("Driver vanished after insert: " + normalized));

        if (!driver.isActive()) {
            throw new ConflictException("Driver " + normalized + " is deactivated");
        }

        if (inserted == 1) {
            log.info("Registered driver {} in {}", driver.getId(), city);
        }
        return new RegistrationResult(driver, inserted == 1);
    }

    @Transactional
    public Driver updateLanguage(String phoneNumber, String languageCode) {
        Language language = Language.fromCode(languageCode);
        Driver driver = getDriver(phoneNumber);

        DriverEntity entity = driverRepository.findById(driver.getId())
            .orElseThrow(() -> new NotFoundException("Driver", driver.getId()));
        Driver updated = driver.withLanguage(language, clock.instant());
        entity.updateFromDomain(updated);
        driverRepository.save(entity);
        return updated;
    }

    @Transactional
    public Driver deactivate(UUID driverId) {
        DriverEntity entity = driverRepository.findById(driverId)
            .orElseThrow(() -> new NotFoundException("Driver", driverId));
        Driver current = entity.toDomain();
        if (!current.isActive()) {
            return current;
        }

        Driver updated = current.deactivate(clock.instant());
        entity.updateFromDomain(updated);
        driverRepository.save(entity);
        log.info("Deactivated driver {}", driverId);
        return updated;
    }

    /**
     * Locks the driver row for the rest of the caller's transaction.
     * Every writer that must serialize per driver goes through here first.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Driver lockActiveDriver(UUID driverId) {
        lockTimeout.apply();
        return driverRepository.findByIdForUpdate(driverId)
            .map(DriverEntity::toDomain)
            .filter(Driver::isActive)
            .orElseThrow(() -> new NotFoundException("Driver", driverId));
    }

    public record RegistrationResult(Driver driver, boolean created) {
    }
}
