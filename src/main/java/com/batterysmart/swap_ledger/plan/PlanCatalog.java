package com.batterysmart.swap_ledger.plan;

import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Catalog of subscription plans, keyed by code.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanCatalog {

    private final SubscriptionPlanRepository planRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SubscriptionPlan findByCode(String code) {
        String normalized = normalizeCode(code);
        return planRepository.findByCode(normalized)
            .map(SubscriptionPlanEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Plan", normalized));
    }

    @Transactional(readOnly = true)
    public SubscriptionPlan findById(UUID planId) {
        return planRepository.findById(planId)
            .map(SubscriptionPlanEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Plan", planId));
    }

    /**
     * Active plans, cheapest first.
     */
    @Transactional(readOnly = true)
    public List<SubscriptionPlan> listActive() {
        return planRepository.findByActiveTrueOrderByPriceAsc()
            .stream()
            .map(SubscriptionPlanEntity::toDomain)
            .toList();
    }

    /**
     * Inserts the plan or updates the existing row with the same code.
     * Existing subscriptions keep pointing at the same plan id.
     */
    @Transactional
    public SubscriptionPlan upsert(PlanDefinition definition) {
        validate(definition);
        String code = normalizeCode(definition.getCode());
        Timestamp now = Timestamp.from(clock.instant());

        jdbcTemplate.update(
            "INSERT INTO subscription_plans (id, code, name, price, validity_days, swaps_included, " +
            "swaps_per_day, extra_swap_price, gst_percentage, description, is_active, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (code) DO UPDATE SET name = EXCLUDED.name, price = EXCLUDED.price, " +
            "validity_days = EXCLUDED.validity_days, swaps_included = EXCLUDED.swaps_included, " +
            "swaps_per_day = EXCLUDED.swaps_per_day, extra_swap_price = EXCLUDED.extra_swap_price, " +
            "gst_percentage = EXCLUDED.gst_percentage, description = EXCLUDED.description, " +
            "is_active = EXCLUDED.is_active, updated_at = EXCLUDED.updated_at",
            UUID.randomUUID(), code, definition.getName(), definition.getPrice(),
            definition.getValidityDays(), definition.getSwapsIncluded(), definition.getSwapsPerDay(),
            definition.getExtraSwapPrice(), definition.getGstPercentage(), definition.getDescription(),
            definition.isActive(), now, now
        );

        log.info("Upserted plan {}", code);
        return findByCode(code);
    }

    private void validate(PlanDefinition definition) {
        if (definition.getCode() == null || definition.getCode().isBlank()) {
            throw new InvalidInputException("code", "Plan code is required");
        }
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidInputException("name", "Plan name is required");
        }
        requireNonNegative("price", definition.getPrice());
        requireNonNegative("extraSwapPrice", definition.getExtraSwapPrice());
        requireNonNegative("gstPercentage", definition.getGstPercentage());
        if (definition.getValidityDays() <= 0) {
            throw new InvalidInputException("validityDays", "Validity must be at least one day");
        }
        if (definition.getSwapsIncluded() < SubscriptionPlan.UNLIMITED) {
            throw new InvalidInputException("swapsIncluded", "Swaps included must be -1 (unlimited) or more");
        }
        if (definition.getSwapsPerDay() < SubscriptionPlan.UNLIMITED) {
            throw new InvalidInputException("swapsPerDay", "Swaps per day must be -1 (unlimited) or more");
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidInputException(field, field + " must be zero or more");
        }
    }

    private static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("code", "Plan code is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
