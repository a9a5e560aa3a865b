package com.batterysmart.swap_ledger.leave;

import com.batterysmart.swap_ledger.config.LedgerProperties;
import com.batterysmart.swap_ledger.config.TransactionLockTimeout;
import com.batterysmart.swap_ledger.exception.LeaveAllowanceExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Monthly leave allowance per driver.
 *
 * Balances are created lazily. Creation is an upsert that does nothing on
 * conflict, so two first-time callers for the same month both end up
 * reading the single row that won.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LeaveLedger {

    private static final String SELECT_BALANCE =
        "SELECT id, driver_id, month_year, total_leaves, used_leaves FROM leave_balance " +
        "WHERE driver_id = ? AND month_year = ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionLockTimeout lockTimeout;
    private final LedgerProperties properties;
    private final Clock clock;

    @Transactional
    public LeaveBalance getOrCreate(UUID driverId, YearMonth month) {
        String monthKey = monthKey(month);
        Timestamp now = Timestamp.from(clock.instant());

        int inserted = jdbcTemplate.update(
            "INSERT INTO leave_balance (id, driver_id, month_year, total_leaves, used_leaves, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, 0, ?, ?) ON CONFLICT (driver_id, month_year) DO NOTHING",
            UUID.randomUUID(), driverId, monthKey, properties.getLeave().getMonthlyAllowance(), now, now);
        if (inserted == 1) {
            log.debug("Opened leave balance {} for driver {}", monthKey, driverId);
        }

        return jdbcTemplate.queryForObject(SELECT_BALANCE, balanceRowMapper(), driverId, monthKey);
    }

    /**
     * Charges {@code days} to the driver's balance for {@code month}, holding
     * the balance row lock until the caller's transaction ends.
     *
     * @throws LeaveAllowanceExceededException if fewer than {@code days} remain
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LeaveBalance consume(UUID driverId, YearMonth month, int days) {
        String monthKey = monthKey(month);
        getOrCreate(driverId, month);

        lockTimeout.apply();
        LeaveBalance balance = jdbcTemplate.queryForObject(
            SELECT_BALANCE + " FOR UPDATE", balanceRowMapper(), driverId, monthKey);

        if (balance.getRemaining() < days) {
            throw new LeaveAllowanceExceededException(monthKey, days, balance.getRemaining());
        }

        jdbcTemplate.update(
            "UPDATE leave_balance SET used_leaves = used_leaves + ?, updated_at = ? WHERE id = ?",
            days, Timestamp.from(clock.instant()), balance.getId());

        return new LeaveBalance(balance.getId(), driverId, monthKey, balance.getTotalLeaves(),
            balance.getUsedLeaves() + days);
    }

    static String monthKey(YearMonth month) {
        return month.toString();
    }

    private RowMapper<LeaveBalance> balanceRowMapper() {
        return (rs, rowNum) -> new LeaveBalance(
            rs.getObject("id", UUID.class),
            rs.getObject("driver_id", UUID.class),
            rs.getString("month_year"),
            rs.getInt("total_leaves"),
            rs.getInt("used_leaves")
        );
    }
}
