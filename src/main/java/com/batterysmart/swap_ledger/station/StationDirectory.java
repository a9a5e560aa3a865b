package com.batterysmart.swap_ledger.station;

import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Stations and their battery inventory.
 *
 * Read-mostly reference data: plain JDBC over stations LEFT JOIN
 * station_inventory. A station without an inventory row reads as empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StationDirectory {

    static final int DEFAULT_NEARBY_LIMIT = 5;
    static final int DEFAULT_SEARCH_LIMIT = 5;
    static final int DEFAULT_CITY_LIMIT = 10;
    private static final int MAX_LIMIT = 50;

    private static final String SELECT_STATION =
        "SELECT s.id, s.code, s.name, s.address, s.landmark, s.latitude, s.longitude, s.city, s.pincode, " +
        "s.operating_hours, s.contact_phone, s.is_dsk, s.google_map_url, s.is_active, " +
        "si.station_id AS inventory_station_id, si.available_batteries, si.charging_batteries, " +
        "si.total_slots, si.last_updated " +
        "FROM stations s LEFT JOIN station_inventory si ON si.station_id = s.id ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Active stations nearest to the point, optionally only those with at
     * least {@code minAvailableBatteries} ready or only DSK stations.
     */
    @Transactional(readOnly = true)
    public List<GeoIndex.Ranked<Station>> findNearby(double latitude, double longitude, Integer limit,
                                                     Integer minAvailableBatteries, boolean dskOnly) {
        GeoIndex.validateCoordinates(latitude, longitude);
        int minAvailable = minAvailableBatteries != null ? minAvailableBatteries : 0;
        if (minAvailable < 0) {
            throw new InvalidInputException("minAvailableBatteries", "Minimum availability must be zero or more");
        }

        StringBuilder sql = new StringBuilder(SELECT_STATION).append("WHERE s.is_active = TRUE");
        List<Object> args = new ArrayList<>();
        if (dskOnly) {
            sql.append(" AND s.is_dsk = TRUE");
        }
        if (minAvailable > 0) {
            sql.append(" AND COALESCE(si.available_batteries, 0) >= ?");
            args.add(minAvailable);
        }

        List<Station> candidates = jdbcTemplate.query(sql.toString(), stationRowMapper(), args.toArray());
        return GeoIndex.nearest(latitude, longitude, candidates, boundedLimit(limit, DEFAULT_NEARBY_LIMIT));
    }

    @Transactional(readOnly = true)
    public Station findByCode(String code) {
        String normalized = normalizeCode(code);
        return jdbcTemplate.query(SELECT_STATION + "WHERE s.code = ?", stationRowMapper(), normalized)
            .stream()
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Station", normalized));
    }

    /**
     * @throws NotFoundException if the station does not exist or is inactive
     */
    @Transactional(readOnly = true)
    public Station requireActive(UUID stationId) {
        return jdbcTemplate.query(SELECT_STATION + "WHERE s.id = ? AND s.is_active = TRUE",
                stationRowMapper(), stationId)
            .stream()
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Station", stationId));
    }

    @Transactional(readOnly = true)
    public Station requireActive(String code) {
        Station station = findByCode(code);
        if (!station.isActive()) {
            throw new NotFoundException("Station", station.getCode());
        }
        return station;
    }

    /**
     * Active stations whose city contains the given text, best stocked first.
     */
    @Transactional(readOnly = true)
    public List<Station> listByCity(String city, Integer limit) {
        if (city == null || city.isBlank()) {
            throw new InvalidInputException("city", "City is required");
        }
        return jdbcTemplate.query(
            SELECT_STATION + "WHERE s.is_active = TRUE AND LOWER(s.city) LIKE ? " +
            "ORDER BY si.available_batteries DESC NULLS LAST, s.code LIMIT ?",
            stationRowMapper(), contains(city), boundedLimit(limit, DEFAULT_CITY_LIMIT));
    }

    /**
     * Matches the term against name, code, address, landmark and city.
     */
    @Transactional(readOnly = true)
    public List<Station> search(String term, Integer limit) {
        if (term == null || term.isBlank()) {
            throw new InvalidInputException("q", "Search term is required");
        }
        String pattern = contains(term);
        return jdbcTemplate.query(
            SELECT_STATION + "WHERE s.is_active = TRUE AND (LOWER(s.name) LIKE ? OR LOWER(s.code) LIKE ? " +
            "OR LOWER(s.address) LIKE ? OR LOWER(s.landmark) LIKE ? OR LOWER(s.city) LIKE ?) " +
            "ORDER BY si.available_batteries DESC NULLS LAST, s.code LIMIT ?",
            stationRowMapper(), pattern, pattern, pattern, pattern, pattern,
            boundedLimit(limit, DEFAULT_SEARCH_LIMIT));
    }

    /**
     * Looks a station up by exact code first, then by name fragment.
     */
    @Transactional(readOnly = true)
    public Station availability(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidInputException("identifier", "Station code or name is required");
        }
        String trimmed = identifier.trim();
        List<Station> byCode = jdbcTemplate.query(
            SELECT_STATION + "WHERE s.is_active = TRUE AND LOWER(s.code) = ?",
            stationRowMapper(), trimmed.toLowerCase(Locale.ROOT));
        if (!byCode.isEmpty()) {
            return byCode.get(0);
        }
        return jdbcTemplate.query(
                SELECT_STATION + "WHERE s.is_active = TRUE AND LOWER(s.name) LIKE ? ORDER BY s.code LIMIT 1",
                stationRowMapper(), contains(trimmed))
            .stream()
            .findFirst()
            .orElseThrow(() -> new NotFoundException("Station", trimmed));
    }

    /**
     * Inserts the station or updates the row with the same code, and makes
     * sure it has an inventory row.
     */
    @Transactional
    public Station upsert(StationDefinition definition) {
        String code = normalizeCode(definition.getCode());
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidInputException("name", "Station name is required");
        }
        GeoIndex.validateCoordinates(definition.getLatitude(), definition.getLongitude());
        Timestamp now = Timestamp.from(clock.instant());

        UUID id = jdbcTemplate.queryForObject(
            "INSERT INTO stations (id, code, name, address, landmark, latitude, longitude, city, pincode, " +
            "operating_hours, contact_phone, is_dsk, google_map_url, is_active, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (code) DO UPDATE SET name = EXCLUDED.name, address = EXCLUDED.address, " +
            "landmark = EXCLUDED.landmark, latitude = EXCLUDED.latitude, longitude = EXCLUDED.longitude, " +
            "city = EXCLUDED.city, pincode = EXCLUDED.pincode, operating_hours = EXCLUDED.operating_hours, " +
            "contact_phone = EXCLUDED.contact_phone, is_dsk = EXCLUDED.is_dsk, " +
            "google_map_url = EXCLUDED.google_map_url, is_active = EXCLUDED.is_active, " +
            "updated_at = EXCLUDED.updated_at " +
            "RETURNING id",
            UUID.class,
            UUID.randomUUID(), code, definition.getName(), definition.getAddress(), definition.getLandmark(),
            definition.getLatitude(), definition.getLongitude(), definition.getCity(), definition.getPincode(),
            definition.getOperatingHours(), definition.getContactPhone(), definition.isDsk(),
            definition.getGoogleMapUrl(), definition.isActive(), now, now
        );

        jdbcTemplate.update(
            "INSERT INTO station_inventory (id, station_id, available_batteries, charging_batteries, total_slots, " +
            "last_updated) VALUES (?, ?, 0, 0, 0, ?) ON CONFLICT (station_id) DO NOTHING",
            UUID.randomUUID(), id, now);

        log.info("Upserted station {}", code);
        return findByCode(code);
    }

    @Transactional
    public Station updateInventory(String code, int available, int charging, int totalSlots) {
        if (available < 0 || charging < 0 || totalSlots < 0) {
            throw new InvalidInputException("inventory", "Battery counts must be zero or more");
        }
        if (available + charging > totalSlots) {
            throw new InvalidInputException("inventory",
                String.format("%d available and %d charging do not fit in %d slots", available, charging, totalSlots));
        }
        Station station = findByCode(code);
        Timestamp now = Timestamp.from(clock.instant());

        jdbcTemplate.update(
            "INSERT INTO station_inventory (id, station_id, available_batteries, charging_batteries, total_slots, " +
            "last_updated) VALUES (?, ?, ?, ?, ?, ?) ON CONFLICT (station_id) DO UPDATE SET " +
            "available_batteries = EXCLUDED.available_batteries, " +
            "charging_batteries = EXCLUDED.charging_batteries, total_slots = EXCLUDED.total_slots, " +
            "last_updated = EXCLUDED.last_updated",
            UUID.randomUUID(), station.getId(), available, charging, totalSlots, now);

        log.debug("Inventory of {} set to available={}, charging={}, slots={}",
            station.getCode(), available, charging, totalSlots);
        return findByCode(station.getCode());
    }

    private RowMapper<Station> stationRowMapper() {
        return (rs, rowNum) -> {
            StationInventory inventory = rs.getObject("inventory_station_id") == null
                ? StationInventory.empty()
                : new StationInventory(
                    rs.getInt("available_batteries"),
                    rs.getInt("charging_batteries"),
                    rs.getInt("total_slots"),
                    rs.getTimestamp("last_updated") != null ? rs.getTimestamp("last_updated").toInstant() : null);
            return new Station(
                rs.getObject("id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                rs.getString("address"),
                rs.getString("landmark"),
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                rs.getString("city"),
                rs.getString("pincode"),
                rs.getString("operating_hours"),
                rs.getString("contact_phone"),
                rs.getBoolean("is_dsk"),
                rs.getString("google_map_url"),
                rs.getBoolean("is_active"),
                inventory
            );
        };
    }

    static int boundedLimit(Integer limit, int defaultLimit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit <= 0) {
            throw new InvalidInputException("limit", "Limit must be at least 1");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    static String contains(String text) {
        return "%" + text.trim().toLowerCase(Locale.ROOT) + "%";
    }

    private static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("code", "Station code is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
