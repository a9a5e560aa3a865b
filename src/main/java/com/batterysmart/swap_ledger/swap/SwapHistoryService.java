package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.driver.DriverService;
import com.batterysmart.swap_ledger.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SwapHistoryService {

    static final int DEFAULT_LIMIT = 20;
    private static final int MAX_LIMIT = 200;

    private static final String HISTORY_SELECT =
        "SELECT sw.id, sw.swap_time, sw.station_id, st.code AS station_code, st.name AS station_name, " +
        "sw.subscription_id, sw.old_battery_id, sw.new_battery_id, sw.old_battery_charge, " +
        "sw.new_battery_charge, sw.is_subscription_swap, sw.charge_amount, sw.status, i.invoice_number " +
        "FROM swaps sw " +
        "JOIN stations st ON st.id = sw.station_id " +
        "LEFT JOIN invoices i ON i.swap_id = sw.id ";

    private static final String TOTALS_SELECT =
        "SELECT COUNT(*) AS swaps, COALESCE(SUM(sw.charge_amount), 0) AS charged, " +
        "COUNT(*) FILTER (WHERE sw.charge_amount = 0) AS free " +
        "FROM swaps sw ";

    private final JdbcTemplate jdbcTemplate;
    private final DriverService driverService;
    private final Clock clock;

    /**
     * Swaps in a named period, or in [from, to] when the period is CUSTOM
     * (or absent and dates are given). Both bounds are inclusive dates.
     * The page holds at most {@code limit} rows; the totals cover the whole
     * window.
     *
     * @throws InvalidInputException if the range is inverted or incomplete
     */
    @Transactional(readOnly = true)
    public SwapHistory listSwapHistory(UUID driverId, HistoryPeriod period, LocalDate from, LocalDate to,
                                       Integer limit) {
        driverService.getDriver(driverId);
        LocalDate today = LocalDate.now(clock);

        HistoryPeriod effective = period != null ? period
            : (from != null || to != null) ? HistoryPeriod.CUSTOM : HistoryPeriod.TODAY;

        LocalDate start;
        LocalDate end;
        if (effective == HistoryPeriod.CUSTOM) {
            if (from == null) {
                throw new InvalidInputException("from", "A custom range needs a start date");
            }
            start = from;
            end = to != null ? to : today;
        } else {
            start = effective.startFrom(today);
            end = effective.endFrom(today);
        }
        if (start != null && end.isBefore(start)) {
            throw new InvalidInputException("to", "End date " + end + " is before start date " + start);
        }

        int rows = limit == null ? DEFAULT_LIMIT : limit;
        if (rows <= 0) {
            throw new InvalidInputException("limit", "Limit must be at least 1");
        }

        List<Object> args = new ArrayList<>();
        String window = window(driverId, start, end, args);

        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(Math.min(rows, MAX_LIMIT));
        List<SwapHistory.Entry> swaps = jdbcTemplate.query(
            HISTORY_SELECT + window + "ORDER BY sw.swap_time DESC, sw.id LIMIT ?",
            entryRowMapper(),
            pageArgs.toArray());

        SwapHistory.Totals totals = jdbcTemplate.queryForObject(
            TOTALS_SELECT + window,
            (rs, rowNum) -> new SwapHistory.Totals(
                rs.getInt("swaps"),
                rs.getBigDecimal("charged").setScale(2),
                rs.getInt("free")),
            args.toArray());

        return new SwapHistory(driverId, effective, start, end, swaps, totals.getSwaps(),
            totals.getCharged(), totals.getFree());
    }

    /**
     * WHERE clause for the driver's swaps between two inclusive dates. A null
     * start leaves the window open at the bottom.
     */
    private String window(UUID driverId, LocalDate start, LocalDate end, List<Object> args) {
        StringBuilder where = new StringBuilder("WHERE sw.driver_id = ? ");
        args.add(driverId);
        if (start != null) {
            where.append("AND sw.swap_time >= ? ");
            args.add(Timestamp.from(start.atStartOfDay(clock.getZone()).toInstant()));
        }
        where.append("AND sw.swap_time < ? ");
        args.add(Timestamp.from(end.plusDays(1).atStartOfDay(clock.getZone()).toInstant()));
        return where.toString();
    }

    private RowMapper<SwapHistory.Entry> entryRowMapper() {
        return (rs, rowNum) -> new SwapHistory.Entry(
            rs.getObject("id", UUID.class),
            rs.getTimestamp("swap_time").toInstant(),
            rs.getObject("station_id", UUID.class),
            rs.getString("station_code"),
            rs.getString("station_name"),
            rs.getObject("subscription_id", UUID.class),
            rs.getString("old_battery_id"),
            rs.getString("new_battery_id"),
            rs.getInt("old_battery_charge"),
            rs.getInt("new_battery_charge"),
            rs.getBoolean("is_subscription_swap"),
            rs.getBigDecimal("charge_amount"),
            SwapStatus.valueOf(rs.getString("status")),
            rs.getString("invoice_number")
        );
    }
}
